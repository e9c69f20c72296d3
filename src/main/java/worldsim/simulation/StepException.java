package worldsim.simulation;

/**
 * A manually stepped turn was rejected. Thrown to the caller after the committed state
 * has been kept.
 */
public class StepException extends SimulationException {

    public StepException(TurnExecutionException cause) {
        super(cause.getMessage(), cause);
    }

    public TurnExecutionException turnFailure() {
        return (TurnExecutionException) getCause();
    }
}
