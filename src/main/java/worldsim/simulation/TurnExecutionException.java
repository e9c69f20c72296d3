package worldsim.simulation;

import java.util.List;

/**
 * A turn could not produce a valid next state. The committed state is retained.
 */
public class TurnExecutionException extends SimulationException {

    private final long turn;
    private final List<String> violations;

    public TurnExecutionException(long turn, List<String> violations) {
        super("Turn " + turn + " rejected: " + String.join("; ", violations));
        this.turn = turn;
        this.violations = List.copyOf(violations);
    }

    public TurnExecutionException(long turn, String message, Throwable cause) {
        super("Turn " + turn + " failed: " + message, cause);
        this.turn = turn;
        this.violations = List.of(message);
    }

    public long turn() {
        return turn;
    }

    public List<String> violations() {
        return violations;
    }
}
