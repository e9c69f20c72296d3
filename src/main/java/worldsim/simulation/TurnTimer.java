package worldsim.simulation;

import java.util.function.LongSupplier;

/**
 * Fires turns in automatic mode.
 * <p>
 * The delay before each firing is read from {@code nextDelayMillis} after the previous
 * task finished, so pacing follows the latest committed state.
 */
public interface TurnTimer {

    /**
     * Starts firing {@code task}. Starting an already active timer replaces the schedule.
     */
    void start(LongSupplier nextDelayMillis, Runnable task);

    /**
     * Stops firing. A task that is already running completes; no further task starts.
     */
    void cancel();

    boolean isActive();

    /**
     * Cancels firing and releases any thread the timer holds. The timer cannot be started
     * again afterwards.
     */
    void shutdown();
}
