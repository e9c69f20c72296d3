package worldsim.simulation;

import worldsim.conflict.ConflictConfig;
import worldsim.events.EventLog;

/**
 * Scheduler tuning. Immutable configuration object with builder pattern support.
 */
public final class SchedulerConfig {

    // === History and events ===
    private final int maxTurnHistory;
    private final int maxConcurrentEvents;
    private final int eventLogCapacity;

    // === Pacing ===
    private final long minTickDelay;
    private final long maxTickDelay;

    // === Entity upkeep ===
    private final double energyDecay;
    private final double healthDecay;
    private final double moodDecay;

    // === Persistence ===
    private final int persistenceAttempts;

    private final boolean autoTriggerEncounters;
    private final ConflictConfig conflictConfig;

    private SchedulerConfig(Builder builder) {
        this.maxTurnHistory = builder.maxTurnHistory;
        this.maxConcurrentEvents = builder.maxConcurrentEvents;
        this.eventLogCapacity = builder.eventLogCapacity;
        this.minTickDelay = builder.minTickDelay;
        this.maxTickDelay = builder.maxTickDelay;
        this.energyDecay = builder.energyDecay;
        this.healthDecay = builder.healthDecay;
        this.moodDecay = builder.moodDecay;
        this.persistenceAttempts = builder.persistenceAttempts;
        this.autoTriggerEncounters = builder.autoTriggerEncounters;
        this.conflictConfig = builder.conflictConfig;

        validate();
    }

    private void validate() {
        if (maxTurnHistory <= 0) {
            throw new IllegalArgumentException("maxTurnHistory must be positive");
        }
        if (maxConcurrentEvents <= 0) {
            throw new IllegalArgumentException("maxConcurrentEvents must be positive");
        }
        if (eventLogCapacity <= 0) {
            throw new IllegalArgumentException("eventLogCapacity must be positive");
        }
        if (minTickDelay <= 0 || minTickDelay > maxTickDelay) {
            throw new IllegalArgumentException("tick delay bounds must be positive and ordered");
        }
        if (energyDecay < 0 || healthDecay < 0 || moodDecay < 0) {
            throw new IllegalArgumentException("decay rates cannot be negative");
        }
        if (persistenceAttempts <= 0) {
            throw new IllegalArgumentException("persistenceAttempts must be positive");
        }
        if (conflictConfig == null) {
            throw new IllegalArgumentException("conflictConfig cannot be null");
        }
    }

    public int maxTurnHistory() {
        return maxTurnHistory;
    }

    public int maxConcurrentEvents() {
        return maxConcurrentEvents;
    }

    public int eventLogCapacity() {
        return eventLogCapacity;
    }

    public long minTickDelay() {
        return minTickDelay;
    }

    public long maxTickDelay() {
        return maxTickDelay;
    }

    public double energyDecay() {
        return energyDecay;
    }

    public double healthDecay() {
        return healthDecay;
    }

    public double moodDecay() {
        return moodDecay;
    }

    public int persistenceAttempts() {
        return persistenceAttempts;
    }

    public boolean autoTriggerEncounters() {
        return autoTriggerEncounters;
    }

    public ConflictConfig conflictConfig() {
        return conflictConfig;
    }

    /**
     * Creates a builder with default values.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a configuration with default values.
     */
    public static SchedulerConfig defaults() {
        return builder().build();
    }

    @Override
    public String toString() {
        return String.format("SchedulerConfig{maxTurnHistory=%d, maxConcurrentEvents=%d, tickDelay=[%d, %d], persistenceAttempts=%d, autoTriggerEncounters=%s}",
                maxTurnHistory, maxConcurrentEvents, minTickDelay, maxTickDelay, persistenceAttempts, autoTriggerEncounters);
    }

    /**
     * Builder for SchedulerConfig with fluent API.
     */
    public static final class Builder {
        private int maxTurnHistory = 100;
        private int maxConcurrentEvents = 10;
        private int eventLogCapacity = EventLog.DEFAULT_CAPACITY;
        private long minTickDelay = 100;
        private long maxTickDelay = 1000;
        private double energyDecay = 1.0;
        private double healthDecay = 0.0;
        private double moodDecay = 0.0;
        private int persistenceAttempts = 2;
        private boolean autoTriggerEncounters = true;
        private ConflictConfig conflictConfig = ConflictConfig.defaults();

        public Builder maxTurnHistory(int maxTurnHistory) {
            this.maxTurnHistory = maxTurnHistory;
            return this;
        }

        public Builder maxConcurrentEvents(int maxConcurrentEvents) {
            this.maxConcurrentEvents = maxConcurrentEvents;
            return this;
        }

        public Builder eventLogCapacity(int eventLogCapacity) {
            this.eventLogCapacity = eventLogCapacity;
            return this;
        }

        public Builder tickDelayBounds(long minTickDelay, long maxTickDelay) {
            this.minTickDelay = minTickDelay;
            this.maxTickDelay = maxTickDelay;
            return this;
        }

        public Builder decay(double energy, double health, double mood) {
            this.energyDecay = energy;
            this.healthDecay = health;
            this.moodDecay = mood;
            return this;
        }

        public Builder persistenceAttempts(int persistenceAttempts) {
            this.persistenceAttempts = persistenceAttempts;
            return this;
        }

        public Builder autoTriggerEncounters(boolean autoTriggerEncounters) {
            this.autoTriggerEncounters = autoTriggerEncounters;
            return this;
        }

        public Builder conflictConfig(ConflictConfig conflictConfig) {
            this.conflictConfig = conflictConfig;
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(this);
        }
    }
}
