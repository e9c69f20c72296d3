package worldsim.simulation;

import org.junit.jupiter.api.Test;
import worldsim.WorldFixtures;
import worldsim.resolution.StochasticResolver;
import worldsim.world.Attributes;
import worldsim.world.Entity;
import worldsim.world.Stat;

import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class EntityTurnUpdaterTest {

    private static EntityTurnUpdater updater(SchedulerConfig config) {
        return new EntityTurnUpdater(config, new InteractionResolver(new StochasticResolver(new Random(42L))));
    }

    @Test
    void shouldDecayStatsByConfiguredAmounts() {
        // Given
        EntityTurnUpdater updater = updater(SchedulerConfig.builder().decay(2.0, 1.0, 3.0).build());
        Entity entity = Entity.builder("ana", "Ana").build();

        // When
        Entity decayed = updater.decay(entity);

        // Then
        assertEquals(98.0, decayed.stat(Stat.ENERGY), 1e-9);
        assertEquals(99.0, decayed.stat(Stat.HEALTH), 1e-9);
        assertEquals(77.0, decayed.stat(Stat.MOOD), 1e-9);
    }

    @Test
    void shouldNotDecayBelowZero() {
        EntityTurnUpdater updater = updater(SchedulerConfig.defaults());
        Entity exhausted = Entity.builder("ana", "Ana").energy(0.5).build();

        assertEquals(0.0, updater.decay(exhausted).stat(Stat.ENERGY));
    }

    @Test
    void shouldGrowAbilityTiedToLastInteractionType() {
        // Given
        EntityTurnUpdater updater = updater(SchedulerConfig.defaults());
        Entity talker = Entity.builder("ana", "Ana").lastInteractionType("dialogue").coherence(0.5).build();

        // When
        Entity evolved = updater.evolve(talker);

        // Then
        assertEquals(10.005, evolved.attributes().score(Attributes.CHARISMA), 1e-9);
        assertEquals(10.0, evolved.attributes().score(Attributes.WISDOM));
        assertEquals(10.0, evolved.attributes().score(Attributes.STRENGTH));
    }

    @Test
    void shouldGrowWisdomWhenNothingWasDoneYet() {
        EntityTurnUpdater updater = updater(SchedulerConfig.defaults());
        Entity newcomer = Entity.builder("ana", "Ana").coherence(1.0).build();

        assertEquals(10.01, updater.evolve(newcomer).attributes().score(Attributes.WISDOM), 1e-9);
    }

    @Test
    void shouldDecayEvenWhenNoInteractionIsPossible() {
        // Given
        WorldState state = WorldState.initial(WorldFixtures.village(), 100)
                .withEntities(List.of(Entity.builder("idle", "Idle").nodeId("square").build()));
        TurnWorkspace workspace = new TurnWorkspace(state, 1);

        // When
        Optional<CharacterAction> action = updater(SchedulerConfig.defaults()).update("idle", workspace);

        // Then
        assertTrue(action.isEmpty());
        assertEquals(99.0, workspace.entities.get("idle").stat(Stat.ENERGY), 1e-9);
    }

    @Test
    void shouldDecayThenActInTheWorkspace() {
        // Given
        TurnWorkspace workspace = new TurnWorkspace(WorldState.initial(WorldFixtures.village(), 100), 1);

        // When
        CharacterAction action = updater(SchedulerConfig.defaults()).update("bo", workspace).orElseThrow();

        // Then
        Entity bo = workspace.entities.get("bo");
        assertEquals("bo", action.entityId());
        assertEquals("chat", action.interactionId());
        assertEquals("dialogue", bo.lastInteractionType());
        assertEquals(99.0, bo.stat(Stat.ENERGY), 1e-9);
    }
}
