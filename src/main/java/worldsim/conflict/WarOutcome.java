package worldsim.conflict;

/**
 * Who won a concluded war.
 */
public enum WarOutcome {
    ATTACKERS,
    DEFENDERS,
    STALEMATE;

    public static WarOutcome of(Side side) {
        return side == Side.ATTACKERS ? ATTACKERS : DEFENDERS;
    }
}
