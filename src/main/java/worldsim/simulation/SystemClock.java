package worldsim.simulation;

import java.time.Duration;

/**
 * Wall clock the scheduler reads when it stamps turn summaries and times turn execution.
 * An offset can be applied so tests can tell scheduler timestamps from the real time.
 */
public class SystemClock {

    private volatile Duration offset = Duration.ZERO;

    /**
     * Monotonic reading used to measure turn duration.
     */
    public long nanoTime() {
        return System.nanoTime() + offset.toNanos();
    }

    /**
     * Epoch milliseconds stamped on {@link TurnSummary#timestamp()}.
     */
    public long now() {
        return System.currentTimeMillis() + offset.toMillis();
    }

    /**
     * Replaces the offset added to every reading.
     */
    public void addClockSkew(Duration skew) {
        if (skew == null) {
            throw new IllegalArgumentException("Clock skew cannot be null");
        }
        this.offset = skew;
    }
}
