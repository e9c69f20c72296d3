package worldsim.simulation;

import worldsim.conflict.Battle;
import worldsim.conflict.ConflictResolutionEngine;
import worldsim.conflict.War;
import worldsim.encounter.EncounterInstance;
import worldsim.encounter.EncounterLifecycle;
import worldsim.events.ComplexEvent;
import worldsim.events.EventLog;
import worldsim.events.EventQueue;
import worldsim.resolution.StochasticResolver;
import worldsim.storage.InMemoryWorldStore;
import worldsim.storage.WorldStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns one simulation: the committed {@link WorldState}, the pending complex events and
 * the observer streams.
 * <p>
 * Lifecycle: {@code IDLE -> INITIALIZED -> RUNNING}, back to {@code INITIALIZED} on
 * {@link #stop()} and to {@code IDLE} on {@link #reset()}. Turns run one at a time,
 * either fired by the {@link TurnTimer} in {@link RunMode#AUTOMATIC} mode or by
 * {@link #step()} in {@link RunMode#MANUAL} mode.
 * <p>
 * A turn either commits completely or not at all. A rejected turn leaves the committed
 * state, the history and the event log as they were. In automatic mode the failure is
 * logged and the next firing runs normally; {@link #step()} reports it to the caller as a
 * {@link StepException}.
 */
public class TickScheduler implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(TickScheduler.class.getName());

    static final String INITIALIZED_DIGEST = "Simulation initialized";

    private final SchedulerConfig config;
    private final WorldStore store;
    private final TurnTimer timer;
    private final SystemClock clock;
    private final EncounterLifecycle encounters;
    private final TurnProcessor processor;

    private final EventQueue eventQueue = new EventQueue();
    private final EventLog eventLog;
    private final TurnHistory history;
    private final List<EncounterInstance> encounterHistory = new ArrayList<>();
    private final List<War> concludedWars = new ArrayList<>();
    private final List<Battle> battles = new ArrayList<>();
    private final List<Consumer<WorldState>> turnListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<TurnSummary>> summaryListeners = new CopyOnWriteArrayList<>();

    private final Object turnLock = new Object();
    private final AtomicBoolean turnInFlight = new AtomicBoolean(false);

    private volatile WorldState state;
    private volatile SchedulerState schedulerState = SchedulerState.IDLE;
    private volatile RunMode mode;

    public TickScheduler(SchedulerConfig config, StochasticResolver resolver, WorldStore store,
                         TurnTimer timer, SystemClock clock) {
        if (config == null || resolver == null || store == null || timer == null || clock == null) {
            throw new IllegalArgumentException("Scheduler dependencies cannot be null");
        }
        this.config = config;
        this.store = store;
        this.timer = timer;
        this.clock = clock;
        this.encounters = new EncounterLifecycle(resolver);
        ConflictResolutionEngine conflicts = new ConflictResolutionEngine(resolver, config.conflictConfig());
        this.processor = new TurnProcessor(config, resolver, conflicts, encounters);
        this.eventLog = new EventLog(config.eventLogCapacity());
        this.history = new TurnHistory(config.maxTurnHistory());
    }

    /**
     * Scheduler with default configuration, an in-memory store and a real timer. Call
     * {@link #close()} when done to release the timer thread.
     */
    public TickScheduler(StochasticResolver resolver) {
        this(SchedulerConfig.defaults(), resolver, new InMemoryWorldStore(), new ExecutorTurnTimer(), new SystemClock());
    }

    // ========== Lifecycle ==========

    /**
     * Loads a new world at turn zero. A configuration that fails validation leaves the
     * scheduler exactly as it was.
     *
     * @throws ConfigurationException if the configuration is malformed
     * @throws IllegalStateException  if the scheduler is running
     */
    public void initialize(WorldConfig worldConfig) {
        synchronized (turnLock) {
            if (schedulerState == SchedulerState.RUNNING) {
                throw new IllegalStateException("Cannot initialize while running; stop the simulation first");
            }
            WorldConfigValidator.validate(worldConfig);

            WorldState draft = WorldState.initial(worldConfig, config.minTickDelay());
            WorldState initial = WorldState.initial(worldConfig, processor.tickDelay(draft));
            clearObservers();
            eventQueue.clear();
            state = initial;
            TurnSummary summary = TurnSummary.initial(initial.time(), clock.now(), INITIALIZED_DIGEST);
            history.add(summary);
            schedulerState = SchedulerState.INITIALIZED;
            persist(initial);
            logger.info("Initialized world '" + initial.worldName() + "' with " + initial.entities().size()
                    + " entities on " + initial.nodes().size() + " nodes");
        }
    }

    /**
     * Loads the last saved snapshot from the store.
     *
     * @return true if a valid snapshot was loaded; false leaves the scheduler unchanged
     * @throws IllegalStateException if the scheduler is running
     */
    public boolean restore() {
        synchronized (turnLock) {
            if (schedulerState == SchedulerState.RUNNING) {
                throw new IllegalStateException("Cannot restore while running; stop the simulation first");
            }
            Optional<WorldState> loaded;
            try {
                loaded = store.load();
            } catch (PersistenceException e) {
                logger.log(Level.WARNING, "Failed to load saved world", e);
                return false;
            }
            if (loaded.isEmpty()) {
                logger.info("No saved world to restore");
                return false;
            }
            WorldState restored = loaded.get();
            clearObservers();
            eventQueue.clear();
            state = restored;
            history.add(TurnSummary.initial(restored.time(), clock.now(),
                    "Simulation restored at turn " + restored.time()));
            schedulerState = SchedulerState.INITIALIZED;
            logger.info("Restored world '" + restored.worldName() + "' at turn " + restored.time());
            return true;
        }
    }

    /**
     * @throws IllegalStateException if no world is loaded or the scheduler already runs
     */
    public void start(RunMode runMode) {
        if (runMode == null) {
            throw new IllegalArgumentException("Run mode cannot be null");
        }
        synchronized (turnLock) {
            if (schedulerState == SchedulerState.RUNNING) {
                throw new IllegalStateException("Simulation is already running");
            }
            if (schedulerState != SchedulerState.INITIALIZED || state == null) {
                throw new IllegalStateException("No world loaded; initialize or restore first");
            }
            mode = runMode;
            schedulerState = SchedulerState.RUNNING;
        }
        if (runMode == RunMode.AUTOMATIC) {
            timer.start(this::currentTickDelay, this::runScheduledTurn);
        }
        logger.info("Simulation started in " + runMode + " mode");
    }

    /**
     * Stops scheduling further turns. A turn already in progress completes and commits.
     */
    public void stop() {
        timer.cancel();
        if (schedulerState == SchedulerState.RUNNING) {
            schedulerState = SchedulerState.INITIALIZED;
            mode = null;
            logger.info("Simulation stopped at turn " + currentTime());
        }
    }

    /**
     * Stops the simulation and forgets the world, its history and the saved snapshot.
     */
    public void reset() {
        stop();
        synchronized (turnLock) {
            state = null;
            clearObservers();
            eventQueue.clear();
            store.clear();
            schedulerState = SchedulerState.IDLE;
        }
        logger.info("Simulation reset");
    }

    /**
     * Stops the simulation and shuts the timer down. The committed state stays readable;
     * the scheduler cannot run automatic turns afterwards.
     */
    @Override
    public void close() {
        stop();
        timer.shutdown();
    }

    // ========== Turns ==========

    /**
     * Runs one turn in manual mode.
     *
     * @return the summary of the committed turn
     * @throws StepException         if the turn was rejected; the committed state is unchanged
     * @throws IllegalStateException if the scheduler is not running in manual mode
     */
    public TurnSummary step() {
        if (schedulerState != SchedulerState.RUNNING || mode != RunMode.MANUAL) {
            throw new IllegalStateException("step() requires the simulation to be running in manual mode");
        }
        if (timer.isActive()) {
            throw new IllegalStateException("step() is not allowed while the automatic timer is active");
        }
        try {
            return executeTurn();
        } catch (TurnExecutionException e) {
            throw new StepException(e);
        }
    }

    private void runScheduledTurn() {
        if (schedulerState != SchedulerState.RUNNING) {
            return;
        }
        if (!turnInFlight.compareAndSet(false, true)) {
            logger.fine("Turn still in progress, skipping timer firing");
            return;
        }
        try {
            executeTurn();
        } catch (TurnExecutionException e) {
            logger.log(Level.WARNING, "Automatic turn " + e.turn() + " rejected, keeping turn " + currentTime(), e);
        } finally {
            turnInFlight.set(false);
        }
    }

    private TurnSummary executeTurn() {
        synchronized (turnLock) {
            WorldState committed = state;
            if (committed == null) {
                throw new IllegalStateException("No world loaded");
            }
            List<ComplexEvent> drawn = eventQueue.drain(config.maxConcurrentEvents());
            long started = clock.nanoTime();
            TurnOutcome outcome;
            try {
                outcome = processor.process(committed, drawn);
            } catch (TurnExecutionException e) {
                if (!drawn.isEmpty()) {
                    logger.warning("Discarded " + drawn.size() + " events drawn into rejected turn " + e.turn());
                }
                throw e;
            }
            long durationMillis = TimeUnit.NANOSECONDS.toMillis(clock.nanoTime() - started);
            return commit(outcome, durationMillis);
        }
    }

    private TurnSummary commit(TurnOutcome outcome, long durationMillis) {
        WorldState next = outcome.state();
        state = next;
        outcome.events().forEach(eventLog::publish);
        battles.addAll(outcome.battles());
        concludedWars.addAll(outcome.concludedWars());
        encounterHistory.addAll(outcome.finishedEncounters());
        persist(next);

        TurnSummary summary = new TurnSummary(next.time(), clock.now(), durationMillis,
                outcome.actions(), outcome.resourceDeltas(), outcome.significantChanges(),
                TurnSummary.digestOf(outcome.actions(), outcome.resourceDeltas()));
        history.add(summary);
        logger.fine(() -> "Turn " + next.time() + " committed: " + summary.digest());

        notifyListeners(turnListeners, next, "Turn listener");
        notifyListeners(summaryListeners, summary, "Summary listener");
        return summary;
    }

    private void persist(WorldState snapshot) {
        int attempts = Math.max(1, config.persistenceAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                if (store.save(snapshot)) {
                    return;
                }
            } catch (PersistenceException e) {
                logger.log(Level.WARNING, "Persistence attempt " + attempt + " failed with an error", e);
            }
        }
        logger.warning("Failed to persist turn " + snapshot.time() + " after " + attempts
                + " attempts; continuing in memory");
    }

    private <T> void notifyListeners(List<Consumer<T>> listeners, T value, String label) {
        for (Consumer<T> listener : listeners) {
            try {
                listener.accept(value);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, label + " failed", e);
            }
        }
    }

    private void clearObservers() {
        history.clear();
        eventLog.clear();
        encounterHistory.clear();
        concludedWars.clear();
        battles.clear();
    }

    private long currentTickDelay() {
        WorldState current = state;
        return current == null ? config.maxTickDelay() : current.tickDelay();
    }

    private long currentTime() {
        WorldState current = state;
        return current == null ? -1 : current.time();
    }

    // ========== Events and encounters ==========

    /**
     * Queues a complex event for the next turns. At most
     * {@link SchedulerConfig#maxConcurrentEvents()} events are drawn per turn, highest
     * priority first.
     */
    public void submit(ComplexEvent event) {
        eventQueue.submit(event);
    }

    /**
     * Aborts an active encounter instance outside the turn cycle.
     *
     * @return the aborted instance
     * @throws IllegalArgumentException if no active instance has that id
     * @throws IllegalStateException    if no world is loaded
     */
    public EncounterInstance endEncounter(String instanceId, String reason) {
        synchronized (turnLock) {
            WorldState current = state;
            if (current == null) {
                throw new IllegalStateException("No world loaded");
            }
            EncounterInstance instance = current.activeEncounters().stream()
                    .filter(active -> active.id().equals(instanceId))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("No active encounter instance " + instanceId));
            EncounterInstance aborted = encounters.endEncounter(instance, current.time(), reason, eventLog);
            List<EncounterInstance> remaining = current.activeEncounters().stream()
                    .filter(active -> !active.id().equals(instanceId))
                    .toList();
            state = current.withActiveEncounters(remaining);
            encounterHistory.add(aborted);
            persist(state);
            return aborted;
        }
    }

    // ========== Observers ==========

    public void addTurnListener(Consumer<WorldState> listener) {
        turnListeners.add(listener);
    }

    public void removeTurnListener(Consumer<WorldState> listener) {
        turnListeners.remove(listener);
    }

    public void addSummaryListener(Consumer<TurnSummary> listener) {
        summaryListeners.add(listener);
    }

    public Optional<WorldState> state() {
        return Optional.ofNullable(state);
    }

    public SchedulerState schedulerState() {
        return schedulerState;
    }

    public Optional<RunMode> mode() {
        return Optional.ofNullable(mode);
    }

    public boolean isRunning() {
        return schedulerState == SchedulerState.RUNNING;
    }

    public TurnHistory history() {
        return history;
    }

    public EventLog eventLog() {
        return eventLog;
    }

    public int pendingEvents() {
        return eventQueue.size();
    }

    public List<EncounterInstance> encounterHistory() {
        synchronized (turnLock) {
            return List.copyOf(encounterHistory);
        }
    }

    public List<War> concludedWars() {
        synchronized (turnLock) {
            return List.copyOf(concludedWars);
        }
    }

    public List<Battle> battles() {
        synchronized (turnLock) {
            return List.copyOf(battles);
        }
    }

    public SchedulerConfig config() {
        return config;
    }
}
