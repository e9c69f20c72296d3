package worldsim.simulation;

/**
 * One entity's resolved interaction in a turn.
 */
public record CharacterAction(
        String entityId,
        String interactionId,
        String interactionType,
        String branchId,
        int roll,
        int total,
        int difficulty,
        boolean success,
        boolean critical
) {
}
