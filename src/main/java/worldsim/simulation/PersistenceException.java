package worldsim.simulation;

/**
 * Saving or loading a snapshot failed. Never fatal to the simulation.
 */
public class PersistenceException extends SimulationException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
