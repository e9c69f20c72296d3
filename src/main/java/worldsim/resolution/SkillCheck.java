package worldsim.resolution;

/**
 * Result of a d20 check against a difficulty threshold.
 * <p>
 * {@code critical} only looks at the natural roll: a 20 is critical even when the
 * modified total still misses the difficulty.
 *
 * @param roll     natural d20 value (1..20)
 * @param total    roll plus all modifiers
 * @param success  {@code total >= difficulty}
 * @param critical {@code roll == 20}
 * @param margin   {@code total - difficulty}
 */
public record SkillCheck(int roll, int total, boolean success, boolean critical, int margin) {

    public static final int DIE_SIDES = 20;

    public SkillCheck {
        if (roll < 1 || roll > DIE_SIDES) {
            throw new IllegalArgumentException("Roll must be between 1 and " + DIE_SIDES + ", but was: " + roll);
        }
    }

    /**
     * Evaluates a natural roll against the given modifiers and difficulty.
     */
    public static SkillCheck of(int roll, int modifierTotal, int difficulty) {
        int total = roll + modifierTotal;
        return new SkillCheck(roll, total, total >= difficulty, roll == DIE_SIDES, total - difficulty);
    }
}
