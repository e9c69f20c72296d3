package worldsim.storage;

import worldsim.simulation.PersistenceException;
import worldsim.simulation.WorldState;

import java.util.Optional;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Keeps the encoded snapshot in memory.
 * <p>
 * Writes fail with the configured probability, drawn from the supplied {@link Random},
 * so persistence failures can be reproduced in tests.
 */
public class InMemoryWorldStore implements WorldStore {

    private static final Logger logger = Logger.getLogger(InMemoryWorldStore.class.getName());

    private final Random random;
    private final double failureRate;
    private final WorldStateCodec codec = new WorldStateCodec();
    private byte[] snapshot;
    private int saveCount = 0;

    public InMemoryWorldStore() {
        this(new Random(), 0.0);
    }

    public InMemoryWorldStore(Random random) {
        this(random, 0.0);
    }

    public InMemoryWorldStore(Random random, double failureRate) {
        if (random == null) {
            throw new IllegalArgumentException("Random generator cannot be null");
        }
        if (failureRate < 0.0 || failureRate > 1.0) {
            throw new IllegalArgumentException("Failure rate must be between 0.0 and 1.0");
        }
        this.random = random;
        this.failureRate = failureRate;
    }

    @Override
    public synchronized boolean save(WorldState state) {
        if (failureRate > 0.0 && random.nextDouble() < failureRate) {
            logger.fine(() -> "Simulated write failure for turn " + state.time());
            return false;
        }
        snapshot = codec.encode(state);
        saveCount++;
        return true;
    }

    @Override
    public synchronized Optional<WorldState> load() {
        if (snapshot == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(snapshot));
        } catch (PersistenceException e) {
            logger.warning("Stored snapshot rejected: " + e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized void clear() {
        snapshot = null;
    }

    /**
     * Replaces the stored bytes without going through the codec.
     */
    public synchronized void putRaw(byte[] data) {
        snapshot = data == null ? null : data.clone();
    }

    public synchronized int saveCount() {
        return saveCount;
    }
}
