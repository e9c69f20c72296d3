package worldsim.cmd;

import worldsim.resolution.StochasticResolver;
import worldsim.simulation.ExecutorTurnTimer;
import worldsim.simulation.RunMode;
import worldsim.simulation.SchedulerConfig;
import worldsim.simulation.SimulationException;
import worldsim.simulation.StepException;
import worldsim.simulation.SystemClock;
import worldsim.simulation.TickScheduler;
import worldsim.simulation.TurnSummary;
import worldsim.simulation.WorldConfig;
import worldsim.storage.InMemoryWorldStore;
import worldsim.storage.RocksDbWorldStore;
import worldsim.storage.WorldStateCodec;
import worldsim.storage.WorldStore;

import java.nio.file.Path;

/**
 * Command-line runner: loads a world configuration, runs a number of manual turns and
 * prints the digest of each one.
 */
public class SimulationApplication {

    private final String configPath;
    private final int turns;
    private final long seed;
    private final String storagePath;

    private WorldStore store;
    private TickScheduler scheduler;

    public SimulationApplication(String configPath, int turns, long seed, String storagePath) {
        this.configPath = configPath;
        this.turns = turns;
        this.seed = seed;
        this.storagePath = storagePath;
    }

    /**
     * Loads the world and starts the scheduler in manual mode.
     * @return true if the simulation started successfully, false otherwise
     */
    public boolean start() {
        try {
            System.out.println("Loading world configuration from " + configPath + "...");
            WorldConfig worldConfig = new WorldStateCodec().readConfig(Path.of(configPath));

            if (storagePath == null || storagePath.isBlank()) {
                System.out.println("No storage path given, keeping state in memory");
                this.store = new InMemoryWorldStore();
            } else {
                System.out.println("Initializing storage at " + storagePath + "...");
                this.store = new RocksDbWorldStore(storagePath);
            }

            this.scheduler = new TickScheduler(SchedulerConfig.defaults(), StochasticResolver.seeded(seed),
                    store, new ExecutorTurnTimer(), new SystemClock());
            scheduler.initialize(worldConfig);
            scheduler.start(RunMode.MANUAL);
            System.out.println("World '" + worldConfig.name() + "' initialized with seed " + seed);
            return true;
        } catch (SimulationException | IllegalArgumentException e) {
            System.err.println("Failed to start simulation: " + e.getMessage());
            e.printStackTrace();
            stop();
            return false;
        }
    }

    /**
     * Runs the configured number of turns. Rejected turns are reported and skipped.
     * @return the number of committed turns
     */
    public int run() {
        if (scheduler == null || !scheduler.isRunning()) {
            System.err.println("Simulation not started. Call start() first.");
            return 0;
        }
        int committed = 0;
        for (int i = 0; i < turns; i++) {
            try {
                TurnSummary summary = scheduler.step();
                committed++;
                System.out.println("Turn " + summary.turn() + ": " + summary.digest());
            } catch (StepException e) {
                System.err.println("Turn " + e.turnFailure().turn() + " rejected: " + e.getMessage());
            }
        }
        return committed;
    }

    public void stop() {
        if (scheduler != null) {
            scheduler.close();
        }
        if (store instanceof RocksDbWorldStore) {
            System.out.println("Closing storage...");
            ((RocksDbWorldStore) store).close();
        }
        store = null;
    }

    public static void main(String[] args) {
        SimulationApplication application;
        try {
            application = SimulationApplication.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }
        if (application.configPath == null) {
            System.err.println("Usage: SimulationApplication --config=<world.json> [--turns=<n>] [--seed=<long>] [--storage=<dir>]");
            System.exit(2);
        }
        if (!application.start()) {
            System.exit(1);
        }
        try {
            int committed = application.run();
            System.out.println("Committed " + committed + " of " + application.turns + " turns");
        } finally {
            application.stop();
        }
    }

    public static SimulationApplication fromArgs(String[] args) {
        String configPath = null;
        int turns = 10;
        long seed = 42L;
        String storagePath = null;
        for (String arg : args) {
            if (arg.startsWith("--config=")) configPath = arg.substring(9);
            else if (arg.startsWith("--turns=")) turns = (int) parseNumber("--turns", arg.substring(8), true);
            else if (arg.startsWith("--seed=")) seed = parseNumber("--seed", arg.substring(7), false);
            else if (arg.startsWith("--storage=")) storagePath = arg.substring(10);
        }
        if (turns < 0) {
            throw new IllegalArgumentException("Turn count cannot be negative: " + turns);
        }
        return new SimulationApplication(configPath, turns, seed, storagePath);
    }

    private static long parseNumber(String flag, String value, boolean intRange) {
        try {
            return intRange ? Integer.parseInt(value) : Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + flag + ": '" + value + "'", e);
        }
    }

    // Getters for testing and diagnostics
    public String getConfigPath() { return configPath; }
    public int getTurns() { return turns; }
    public long getSeed() { return seed; }
    public String getStoragePath() { return storagePath; }
}
