package worldsim.conflict;

/**
 * Lifecycle of a war. Transitions only ever move forward one step:
 * {@code DECLARED -> ACTIVE -> RESOLUTION -> CONCLUDED}.
 */
public enum WarPhase {
    DECLARED,
    ACTIVE,
    RESOLUTION,
    CONCLUDED;

    public boolean canAdvanceTo(WarPhase next) {
        return next.ordinal() == ordinal() + 1;
    }
}
