package worldsim.simulation;

import java.util.List;

/**
 * Malformed or incomplete world configuration, raised at initialization. The scheduler's
 * previous state is untouched.
 */
public class ConfigurationException extends SimulationException {

    private final List<String> problems;

    public ConfigurationException(List<String> problems) {
        super("Invalid world configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public List<String> problems() {
        return problems;
    }
}
