package worldsim.storage;

import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import worldsim.simulation.PersistenceException;
import worldsim.simulation.WorldState;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Production {@link WorldStore} that keeps the latest snapshot in a RocksDB database
 * under a single key.
 */
public class RocksDbWorldStore implements WorldStore, AutoCloseable {

    private static final Logger logger = Logger.getLogger(RocksDbWorldStore.class.getName());

    static final byte[] SNAPSHOT_KEY = "world-state".getBytes(StandardCharsets.UTF_8);

    static {
        RocksDB.loadLibrary();
    }

    private final String path;
    private final Options options;
    private final RocksDB db;
    private final WorldStateCodec codec = new WorldStateCodec();

    public RocksDbWorldStore(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Storage path cannot be blank");
        }
        this.path = path;
        this.options = new Options().setCreateIfMissing(true);
        try {
            this.db = RocksDB.open(options, path);
        } catch (RocksDBException e) {
            options.close();
            throw new PersistenceException("Failed to open RocksDB at " + path, e);
        }
    }

    @Override
    public synchronized boolean save(WorldState state) {
        try {
            db.put(SNAPSHOT_KEY, codec.encode(state));
            return true;
        } catch (RocksDBException | PersistenceException e) {
            logger.log(Level.WARNING, "Failed to save turn " + state.time() + " to " + path, e);
            return false;
        }
    }

    @Override
    public synchronized Optional<WorldState> load() {
        try {
            byte[] data = db.get(SNAPSHOT_KEY);
            if (data == null) {
                return Optional.empty();
            }
            return Optional.of(codec.decode(data));
        } catch (RocksDBException e) {
            logger.log(Level.WARNING, "Failed to read snapshot from " + path, e);
            return Optional.empty();
        } catch (PersistenceException e) {
            logger.warning("Stored snapshot rejected: " + e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized void clear() {
        try {
            db.delete(SNAPSHOT_KEY);
        } catch (RocksDBException e) {
            logger.log(Level.WARNING, "Failed to clear snapshot in " + path, e);
        }
    }

    /**
     * Writes raw bytes under the snapshot key. Used to check how corrupt data is handled.
     */
    synchronized void putRaw(byte[] data) throws RocksDBException {
        db.put(SNAPSHOT_KEY, data);
    }

    public String path() {
        return path;
    }

    @Override
    public synchronized void close() {
        db.close();
        options.close();
    }
}
