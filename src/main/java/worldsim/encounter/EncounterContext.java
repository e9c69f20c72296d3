package worldsim.encounter;

import worldsim.world.Entity;

/**
 * What an encounter sees when deciding whether it can start.
 *
 * @param character           entity the encounter would start around; {@code null} skips prerequisites
 * @param lastInteractionType most recent interaction type of that entity
 */
public record EncounterContext(long currentTurn, String nodeId, Entity character, String lastInteractionType) {

    public static EncounterContext forEntity(Entity entity, long currentTurn) {
        return new EncounterContext(currentTurn, entity.nodeId(), entity, entity.lastInteractionType());
    }

    public static EncounterContext atNode(String nodeId, long currentTurn) {
        return new EncounterContext(currentTurn, nodeId, null, null);
    }
}
