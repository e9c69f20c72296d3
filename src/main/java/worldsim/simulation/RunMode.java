package worldsim.simulation;

/**
 * How turns are driven while running. The modes exclude each other.
 */
public enum RunMode {
    /** Turns fire from a {@link TurnTimer}. */
    AUTOMATIC,
    /** Turns run only when the caller invokes {@link TickScheduler#step()}. */
    MANUAL
}
