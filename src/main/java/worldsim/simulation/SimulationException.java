package worldsim.simulation;

/**
 * Root of the simulation's failures. All are unchecked; each subtype states how far the
 * failure reaches.
 */
public class SimulationException extends RuntimeException {

    public SimulationException(String message) {
        super(message);
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
