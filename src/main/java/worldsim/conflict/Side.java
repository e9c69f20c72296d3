package worldsim.conflict;

public enum Side {
    ATTACKERS,
    DEFENDERS;

    public Side opponent() {
        return this == ATTACKERS ? DEFENDERS : ATTACKERS;
    }
}
