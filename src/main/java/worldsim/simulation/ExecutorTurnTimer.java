package worldsim.simulation;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TurnTimer} backed by a single daemon thread, created on the first {@link #start}.
 * Each run re-arms the timer with a freshly read delay, so turns never overlap on this
 * timer.
 */
public class ExecutorTurnTimer implements TurnTimer {

    private static final Logger logger = Logger.getLogger(ExecutorTurnTimer.class.getName());

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> pending;
    private LongSupplier nextDelay;
    private Runnable task;
    private long generation = 0;
    private boolean shutdown = false;

    @Override
    public synchronized void start(LongSupplier nextDelayMillis, Runnable task) {
        if (nextDelayMillis == null || task == null) {
            throw new IllegalArgumentException("Delay supplier and task cannot be null");
        }
        if (shutdown) {
            throw new IllegalStateException("Timer has been shut down");
        }
        cancel();
        if (executor == null) {
            executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "turn-timer");
                thread.setDaemon(true);
                return thread;
            });
        }
        this.nextDelay = nextDelayMillis;
        this.task = task;
        generation++;
        arm(generation);
    }

    @Override
    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
        nextDelay = null;
        task = null;
        generation++;
    }

    @Override
    public synchronized boolean isActive() {
        return task != null;
    }

    @Override
    public synchronized void shutdown() {
        cancel();
        shutdown = true;
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    synchronized boolean hasThread() {
        return executor != null && !executor.isShutdown();
    }

    private void arm(long armedGeneration) {
        long delay = Math.max(0L, nextDelay.getAsLong());
        pending = executor.schedule(() -> fire(armedGeneration), delay, TimeUnit.MILLISECONDS);
    }

    private void fire(long firedGeneration) {
        Runnable current;
        synchronized (this) {
            if (firedGeneration != generation || task == null) {
                return;
            }
            current = task;
        }
        try {
            current.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Scheduled turn task failed", e);
        }
        synchronized (this) {
            if (firedGeneration == generation && task != null && !shutdown) {
                arm(firedGeneration);
            }
        }
    }
}
