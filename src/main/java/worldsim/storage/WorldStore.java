package worldsim.storage;

import worldsim.simulation.WorldState;

import java.util.Optional;

/**
 * Durable home of the latest committed {@link WorldState}.
 * <p>
 * Implementations report failures through return values rather than exceptions; the
 * scheduler treats a failed save as non-fatal and retries it.
 */
public interface WorldStore {

    /**
     * Replaces the stored snapshot.
     *
     * @param state the committed state to store
     * @return true if the snapshot was written, false otherwise
     */
    boolean save(WorldState state);

    /**
     * Reads the stored snapshot.
     *
     * @return the stored state, or empty if nothing is stored or the stored data is not a
     *         valid snapshot
     */
    Optional<WorldState> load();

    /**
     * Removes the stored snapshot, if any.
     */
    void clear();
}
