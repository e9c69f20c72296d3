package worldsim.simulation;

import java.util.List;

/**
 * Digest of one committed turn.
 *
 * @param timestamp          wall-clock millis when the turn was committed
 * @param durationMillis     time spent computing the turn
 * @param significantChanges entities with a score change above 5 or a new interaction type
 */
public record TurnSummary(
        long turn,
        long timestamp,
        long durationMillis,
        List<CharacterAction> actions,
        List<ResourceDelta> resourceDeltas,
        int significantChanges,
        String digest
) {

    public static final String NO_CHANGES = "No significant changes occurred";

    public TurnSummary {
        actions = actions == null ? List.of() : List.copyOf(actions);
        resourceDeltas = resourceDeltas == null ? List.of() : List.copyOf(resourceDeltas);
    }

    public static TurnSummary initial(long turn, long timestamp, String digest) {
        return new TurnSummary(turn, timestamp, 0, List.of(), List.of(), 0, digest);
    }

    static String digestOf(List<CharacterAction> actions, List<ResourceDelta> deltas) {
        if (actions.isEmpty() && deltas.isEmpty()) {
            return NO_CHANGES;
        }
        return actions.size() + " characters took action, " + deltas.size() + " resources changed";
    }
}
