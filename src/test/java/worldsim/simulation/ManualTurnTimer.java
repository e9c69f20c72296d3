package worldsim.simulation;

import java.util.function.LongSupplier;

/**
 * {@link TurnTimer} that only fires when the test calls {@link #fire()}.
 */
class ManualTurnTimer implements TurnTimer {

    private LongSupplier nextDelay;
    private Runnable task;
    private int starts = 0;
    private boolean shutdown = false;

    @Override
    public void start(LongSupplier nextDelayMillis, Runnable task) {
        this.nextDelay = nextDelayMillis;
        this.task = task;
        starts++;
    }

    @Override
    public void cancel() {
        nextDelay = null;
        task = null;
    }

    @Override
    public boolean isActive() {
        return task != null;
    }

    @Override
    public void shutdown() {
        cancel();
        shutdown = true;
    }

    boolean isShutdown() {
        return shutdown;
    }

    void fire() {
        if (task != null) {
            task.run();
        }
    }

    long nextDelay() {
        return nextDelay.getAsLong();
    }

    int starts() {
        return starts;
    }
}
