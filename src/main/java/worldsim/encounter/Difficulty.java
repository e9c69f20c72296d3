package worldsim.encounter;

/**
 * Difficulty tier of an encounter and the check DC it maps to.
 */
public enum Difficulty {
    TRIVIAL(5),
    EASY(10),
    MEDIUM(13),
    HARD(16),
    DEADLY(20);

    private final int dc;

    Difficulty(int dc) {
        this.dc = dc;
    }

    public int dc() {
        return dc;
    }
}
