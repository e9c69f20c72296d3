package worldsim.simulation;

/**
 * {@code IDLE -> INITIALIZED -> RUNNING}; {@code stop()} returns to {@code INITIALIZED},
 * {@code reset()} to {@code IDLE}.
 */
public enum SchedulerState {
    IDLE,
    INITIALIZED,
    RUNNING
}
