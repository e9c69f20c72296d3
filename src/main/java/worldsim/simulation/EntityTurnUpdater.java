package worldsim.simulation;

import worldsim.world.Entity;
import worldsim.world.Stat;

import java.util.Optional;

/**
 * Per-entity work of a turn: upkeep decay, passive drift of the ability tied to the last
 * interaction type, then one resolved interaction.
 */
class EntityTurnUpdater {

    static final double PASSIVE_GROWTH = 0.01;

    private final SchedulerConfig config;
    private final InteractionResolver interactions;

    EntityTurnUpdater(SchedulerConfig config, InteractionResolver interactions) {
        this.config = config;
        this.interactions = interactions;
    }

    Optional<CharacterAction> update(String entityId, TurnWorkspace workspace) {
        Entity entity = workspace.entities.get(entityId);
        entity = decay(entity);
        entity = evolve(entity);
        workspace.entities.put(entityId, entity);
        return interactions.resolve(entity, workspace);
    }

    Entity decay(Entity entity) {
        return entity
                .adjustStat(Stat.ENERGY, -config.energyDecay())
                .adjustStat(Stat.HEALTH, -config.healthDecay())
                .adjustStat(Stat.MOOD, -config.moodDecay());
    }

    Entity evolve(Entity entity) {
        String attribute = InteractionResolver.attributeFor(entity.lastInteractionType());
        return entity.withAttributes(entity.attributes().adjust(attribute, PASSIVE_GROWTH * entity.coherence()));
    }
}
