package worldsim.simulation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import worldsim.WorldFixtures;
import worldsim.conflict.ConflictConfig;
import worldsim.conflict.ConflictResolutionEngine;
import worldsim.encounter.EncounterLifecycle;
import worldsim.events.ComplexEvent;
import worldsim.events.HistoricalEvent;
import worldsim.events.HistoricalEventType;
import worldsim.resolution.StochasticResolver;
import worldsim.world.Entity;
import worldsim.world.Faction;
import worldsim.world.Relation;
import worldsim.world.Stat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TurnProcessorTest {

    private TurnProcessor processor;
    private WorldState village;

    @BeforeEach
    void setUp() {
        processor = newProcessor(SchedulerConfig.defaults());
        village = WorldState.initial(WorldFixtures.village(), 100);
    }

    private static TurnProcessor newProcessor(SchedulerConfig config) {
        StochasticResolver resolver = new StochasticResolver(new Random(42L));
        return new TurnProcessor(config, resolver,
                new ConflictResolutionEngine(resolver, ConflictConfig.defaults()), new EncounterLifecycle(resolver));
    }

    private static Faction faction(WorldState state, String id) {
        return state.factions().stream()
                .filter(faction -> faction.id().equals(id))
                .findFirst()
                .orElseThrow();
    }

    private static List<HistoricalEvent> eventsOfType(TurnOutcome outcome, HistoricalEventType type) {
        return outcome.events().stream().filter(event -> event.type() == type).toList();
    }

    private static WorldState withCoherence(WorldState state, double... coherence) {
        List<Entity> entities = new ArrayList<>();
        for (int i = 0; i < coherence.length; i++) {
            entities.add(Entity.builder("e" + i, "E" + i).nodeId("square").interactions("chat").coherence(coherence[i]).build());
        }
        return state.withEntities(entities);
    }

    @Test
    void shouldPaceByAverageCoherence() {
        assertEquals(100, processor.tickDelay(withCoherence(village, 0.0, 0.0)));
        assertEquals(1000, processor.tickDelay(withCoherence(village, 1.0, 1.0)));
        assertEquals(550, processor.tickDelay(withCoherence(village, 0.2, 0.8)));
    }

    @Test
    void shouldFallBackToMinimumDelayForUnusableCoherence() {
        assertEquals(100, processor.tickDelay(withCoherence(village, Double.NaN)));
        assertEquals(100, processor.tickDelay(village.withEntities(List.of())));
    }

    @Test
    void shouldProduceCandidateForNextTurn() {
        // When
        TurnOutcome outcome = processor.process(village, List.of());

        // Then
        assertEquals(1, outcome.state().time());
        assertEquals(processor.tickDelay(village), outcome.state().tickDelay());
        assertEquals(3, outcome.actions().size());
        assertEquals(0, village.time(), "committed state is never modified");
    }

    @Test
    void shouldApplyPoliticalShiftAndCollectItsEvent() {
        // When
        TurnOutcome outcome = processor.process(village,
                List.of(new ComplexEvent.PoliticalShift("north", -5, 1)));

        // Then
        assertEquals(45.0, faction(outcome.state(), "north").stability(), 1e-9);
        assertEquals(1, eventsOfType(outcome, HistoricalEventType.POLITICAL_SHIFT).size());
    }

    // ========== Complex events ==========

    @Test
    void shouldCrashMarketOnLargeTradeLoss() {
        // When
        TurnOutcome outcome = processor.process(village,
                List.of(new ComplexEvent.TradeDeal(null, "wood", -40, 1, 3)));

        // Then
        assertEquals(10.0, outcome.state().resource("wood"), 1e-9);
        assertEquals(1, eventsOfType(outcome, HistoricalEventType.TRADE_COMPLETED).size());
        List<HistoricalEvent> crashes = eventsOfType(outcome, HistoricalEventType.MARKET_CRASH);
        assertEquals(1, crashes.size());
        assertEquals("wood", crashes.get(0).subject());
        assertEquals(-3.0, crashes.get(0).consciousnessImpact(), 1e-9);
        assertTrue(outcome.resourceDeltas().contains(new ResourceDelta("wood", 50.0, 10.0)));
    }

    @Test
    void shouldCompleteSmallTradeWithoutCrash() {
        // When
        TurnOutcome outcome = processor.process(village,
                List.of(new ComplexEvent.TradeDeal(null, "wood", -10, 1, 3)));

        // Then
        assertEquals(40.0, outcome.state().resource("wood"), 1e-9);
        assertTrue(eventsOfType(outcome, HistoricalEventType.MARKET_CRASH).isEmpty());
    }

    @Test
    void shouldLeaveResourcesAloneWhenBargainingFails() {
        // When
        TurnOutcome outcome = processor.process(village,
                List.of(new ComplexEvent.TradeDeal(null, "wood", -40, 21, 3)));

        // Then
        assertEquals(50.0, outcome.state().resource("wood"), 1e-9);
        assertEquals(1, eventsOfType(outcome, HistoricalEventType.TRADE_FAILED).size());
        assertTrue(eventsOfType(outcome, HistoricalEventType.TRADE_COMPLETED).isEmpty());
    }

    @Test
    void shouldShiftDiplomaticRelation() {
        // When
        TurnOutcome outcome = processor.process(village,
                List.of(new ComplexEvent.DiplomaticShift("north", "south", -30, -10, 1)));

        // Then
        assertEquals(new Relation(-30, -10), faction(outcome.state(), "north").relationTo("south"));
        assertEquals(Relation.NEUTRAL, faction(outcome.state(), "south").relationTo("north"));
        List<HistoricalEvent> shifts = eventsOfType(outcome, HistoricalEventType.DIPLOMATIC_SHIFT);
        assertEquals(1, shifts.size());
        assertEquals(-3.0, shifts.get(0).consciousnessImpact(), 1e-9);
    }

    @Test
    void shouldRejectDiplomaticShiftTowardsUnknownFaction() {
        assertThrows(TurnExecutionException.class, () -> processor.process(village,
                List.of(new ComplexEvent.DiplomaticShift("north", "nobody", -30, -10, 1))));
    }

    @Test
    void shouldTriggerEncounterFromEvent() {
        // Given
        TurnProcessor manualEncounters = newProcessor(SchedulerConfig.builder().autoTriggerEncounters(false).build());
        WorldState festive = WorldState.initial(WorldFixtures.villageWithFestival(), 100);

        // When
        TurnOutcome idle = manualEncounters.process(festive, List.of());
        TurnOutcome requested = manualEncounters.process(festive,
                List.of(new ComplexEvent.EncounterStart("festival", "square", List.of(), 1)));

        // Then
        assertTrue(idle.state().activeEncounters().isEmpty());
        assertEquals(1, requested.state().activeEncounters().size());
        assertEquals("festival", requested.state().activeEncounters().get(0).encounterId());
        assertEquals(List.of("ana", "bo"), requested.state().activeEncounters().get(0).participants());
        assertEquals(1, eventsOfType(requested, HistoricalEventType.ENCOUNTER_TRIGGERED).size());
    }

    @Test
    void shouldRejectUnknownEncounterRequest() {
        assertThrows(TurnExecutionException.class, () -> processor.process(village,
                List.of(new ComplexEvent.EncounterStart("parade", "square", List.of(), 1))));
    }

    @Test
    void shouldFoldScaledImpactIntoMood() {
        // Given
        WorldConfig config = WorldFixtures.village();
        List<Entity> lowFrequency = List.of(
                Entity.builder("ana", "Ana").interactions("chat", "gather").frequency(3).build(),
                Entity.builder("bo", "Bo").interactions("chat").frequency(3).build(),
                Entity.builder("cy", "Cy").interactions("chat").coherence(0.3).frequency(3).build());
        WorldState dull = WorldState.initial(new WorldConfig(config.name(), config.nodes(), lowFrequency,
                config.interactions(), config.factions(), config.encounters()), 100);

        // When
        TurnOutcome quiet = newProcessor(SchedulerConfig.defaults()).process(dull, List.of());
        TurnOutcome shaken = newProcessor(SchedulerConfig.defaults()).process(dull,
                List.of(new ComplexEvent.PoliticalShift("north", -20, 1)));

        // Then
        assertEquals(30.0, faction(shaken.state(), "north").stability(), 1e-9);
        for (Entity entity : shaken.state().entities()) {
            double baseline = quiet.state().entity(entity.id()).orElseThrow().mood();
            assertEquals(baseline - 2.0 * 1.2, entity.mood(), 1e-9, entity.id());
        }
    }

    @Test
    void shouldReportFailuresAsTurnExecutionException() {
        TurnExecutionException error = assertThrows(TurnExecutionException.class,
                () -> processor.process(village, List.of(new ComplexEvent.PoliticalShift("nobody", 5, 1))));

        assertEquals(1, error.turn());
    }

    @Test
    void shouldListChangedResourcesInNameOrder() {
        // Given
        Map<String, Double> before = new LinkedHashMap<>();
        before.put("wood", 10.0);
        before.put("grain", 5.0);
        before.put("stone", 1.0);
        Map<String, Double> after = new LinkedHashMap<>();
        after.put("wood", 12.0);
        after.put("grain", 5.0);
        after.put("iron", 3.0);

        // When
        List<ResourceDelta> deltas = TurnProcessor.resourceDeltas(before, after);

        // Then
        assertEquals(List.of(
                new ResourceDelta("iron", 0.0, 3.0),
                new ResourceDelta("stone", 1.0, 0.0),
                new ResourceDelta("wood", 10.0, 12.0)), deltas);
        assertEquals(2.0, deltas.get(2).delta());
    }

    @Test
    void shouldCountOnlySignificantEntityChanges() {
        // Given
        Entity ana = village.entity("ana").orElseThrow();
        Entity bo = village.entity("bo").orElseThrow();
        Entity cy = village.entity("cy").orElseThrow();
        WorldState after = village.withEntities(List.of(
                ana.adjustStat(Stat.MOOD, -5.0),
                bo.adjustStat(Stat.ENERGY, -6.0),
                cy.withLastInteractionType("dialogue")));

        // When / Then
        assertEquals(2, TurnProcessor.significantChanges(village, after));
    }
}
