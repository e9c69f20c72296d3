package worldsim.simulation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import worldsim.WorldFixtures;
import worldsim.conflict.Commander;
import worldsim.conflict.Force;
import worldsim.conflict.Location;
import worldsim.conflict.Terrain;
import worldsim.conflict.Unit;
import worldsim.conflict.UnitType;
import worldsim.encounter.EncounterInstance;
import worldsim.encounter.EncounterStatus;
import worldsim.events.ComplexEvent;
import worldsim.events.HistoricalEventType;
import worldsim.resolution.StochasticResolver;
import worldsim.storage.InMemoryWorldStore;
import worldsim.world.Entity;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class TickSchedulerTest {

    private InMemoryWorldStore store;
    private ManualTurnTimer timer;
    private TickScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryWorldStore(new Random(42L));
        timer = new ManualTurnTimer();
        scheduler = newScheduler(SchedulerConfig.defaults());
    }

    private TickScheduler newScheduler(SchedulerConfig config) {
        return new TickScheduler(config, new StochasticResolver(new Random(42L)), store, timer, new SystemClock());
    }

    private WorldState state() {
        return scheduler.state().orElseThrow();
    }

    // ========== Lifecycle ==========

    @Test
    void shouldInitializeWorldAtTurnZero() {
        // When
        scheduler.initialize(WorldFixtures.village());

        // Then
        assertEquals(SchedulerState.INITIALIZED, scheduler.schedulerState());
        assertEquals(0, state().time());
        assertEquals(150.0, state().resource("grain") + state().resource("wood"));
        assertEquals("square", state().entity("ana").orElseThrow().nodeId());
        assertEquals(List.of("cy"), state().entitiesAt("forest").stream().map(Entity::id).toList());
        assertEquals(1, scheduler.history().size());
        assertEquals(TickScheduler.INITIALIZED_DIGEST, scheduler.history().latest().orElseThrow().digest());
        assertEquals(1, store.saveCount());
    }

    @Test
    void shouldRejectMalformedConfigurationWithoutTouchingState() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        WorldState before = state();
        WorldConfig broken = new WorldConfig("broken", List.of(), List.of(), List.of(), List.of(), List.of());

        // When
        ConfigurationException error = assertThrows(ConfigurationException.class, () -> scheduler.initialize(broken));

        // Then
        assertFalse(error.problems().isEmpty());
        assertSame(before, state());
        assertEquals(SchedulerState.INITIALIZED, scheduler.schedulerState());
    }

    @Test
    void shouldRequireLoadedWorldToStart() {
        assertThrows(IllegalStateException.class, () -> scheduler.start(RunMode.MANUAL));
    }

    @Test
    void shouldRejectStartingTwice() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.MANUAL);

        // Then
        assertThrows(IllegalStateException.class, () -> scheduler.start(RunMode.MANUAL));
        assertThrows(IllegalStateException.class, () -> scheduler.initialize(WorldFixtures.village()));
    }

    @Test
    void shouldStopAndRestart() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.AUTOMATIC);

        // When
        scheduler.stop();

        // Then
        assertEquals(SchedulerState.INITIALIZED, scheduler.schedulerState());
        assertFalse(timer.isActive());
        scheduler.start(RunMode.MANUAL);
        assertTrue(scheduler.isRunning());
    }

    @Test
    void shouldResetToIdleAndClearStore() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.MANUAL);
        scheduler.step();

        // When
        scheduler.reset();

        // Then
        assertEquals(SchedulerState.IDLE, scheduler.schedulerState());
        assertTrue(scheduler.state().isEmpty());
        assertEquals(0, scheduler.history().size());
        assertTrue(store.load().isEmpty());
    }

    @Test
    void shouldShutDownTimerOnClose() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.AUTOMATIC);

        // When
        scheduler.close();

        // Then
        assertTrue(timer.isShutdown());
        assertFalse(scheduler.isRunning());
        assertEquals(0, state().time());
    }

    @Test
    void shouldDropQueuedEventsWhenWorldIsReinitialized() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        scheduler.submit(new ComplexEvent.PoliticalShift("north", -5, 1));

        // When
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.MANUAL);
        scheduler.step();

        // Then
        assertEquals(0, scheduler.pendingEvents());
        assertTrue(scheduler.eventLog().eventsOfType(HistoricalEventType.POLITICAL_SHIFT).isEmpty());
    }

    // ========== Manual turns ==========

    @Test
    void shouldAdvanceTimeByOnePerStep() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.MANUAL);

        // When / Then
        for (long turn = 1; turn <= 5; turn++) {
            TurnSummary summary = scheduler.step();
            assertEquals(turn, state().time());
            assertEquals(turn, summary.turn());
            assertTrue(state().tickDelay() >= 100 && state().tickDelay() <= 1000);
        }
        assertEquals(6, scheduler.history().size());
    }

    @Test
    void shouldRecordCharacterActionsInSummary() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.MANUAL);

        // When
        TurnSummary summary = scheduler.step();

        // Then
        assertEquals(3, summary.actions().size());
        assertEquals(List.of("ana", "bo", "cy"), summary.actions().stream().map(CharacterAction::entityId).toList());
        assertTrue(summary.digest().startsWith("3 characters took action"));
        assertEquals("dialogue", state().entity("bo").orElseThrow().lastInteractionType());
    }

    @Test
    void shouldOnlyStepInManualMode() {
        // Given
        scheduler.initialize(WorldFixtures.village());

        // Then
        assertThrows(IllegalStateException.class, () -> scheduler.step());
        scheduler.start(RunMode.AUTOMATIC);
        assertThrows(IllegalStateException.class, () -> scheduler.step());
    }

    @Test
    void shouldEvictOldestSummaryOnceHistoryIsFull() {
        // Given
        scheduler = newScheduler(SchedulerConfig.builder().maxTurnHistory(3).build());
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.MANUAL);

        // When
        for (int i = 0; i < 5; i++) {
            scheduler.step();
        }

        // Then
        assertEquals(3, scheduler.history().size());
        assertEquals(List.of(3L, 4L, 5L), scheduler.history().entries().stream().map(TurnSummary::turn).toList());
    }

    @Test
    void shouldTimestampSummariesWithSchedulerClock() {
        // Given
        SystemClock clock = new SystemClock();
        clock.addClockSkew(Duration.ofDays(1));
        scheduler = new TickScheduler(SchedulerConfig.defaults(), StochasticResolver.seeded(42L), store, timer, clock);
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.MANUAL);
        long earliest = System.currentTimeMillis() + Duration.ofDays(1).toMillis();

        // When
        TurnSummary summary = scheduler.step();

        // Then
        assertTrue(summary.timestamp() >= earliest);
        assertTrue(summary.durationMillis() >= 0);
        assertThrows(IllegalArgumentException.class, () -> clock.addClockSkew(null));
    }

    // ========== Rejected turns ==========

    @Test
    void shouldKeepCommittedStateWhenTurnFails() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.MANUAL);
        scheduler.step();
        WorldState before = state();
        int historyBefore = scheduler.history().size();
        int eventsBefore = scheduler.eventLog().size();
        scheduler.submit(new ComplexEvent.TradeDeal(null, "grain", Double.NaN, 1, 1));

        // When
        StepException error = assertThrows(StepException.class, () -> scheduler.step());

        // Then
        assertEquals(2, error.turnFailure().turn());
        assertSame(before, state());
        assertEquals(historyBefore, scheduler.history().size());
        assertEquals(eventsBefore, scheduler.eventLog().size());
        assertEquals(0, scheduler.pendingEvents(), "events drawn into a rejected turn are discarded");
        assertTrue(scheduler.isRunning());

        scheduler.step();
        assertEquals(2, state().time());
    }

    @Test
    void shouldRejectBattleInUnknownWar() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.MANUAL);
        scheduler.submit(new ComplexEvent.BattleEngagement("no-such-war", force("north"), force("south"),
                Location.field("square", Terrain.PLAINS), 1));

        // When / Then
        assertThrows(StepException.class, () -> scheduler.step());
        assertEquals(0, state().time());
        assertTrue(scheduler.battles().isEmpty());
    }

    @Test
    void shouldContinueAutomaticModeAfterFailedTurn() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.AUTOMATIC);
        scheduler.submit(new ComplexEvent.PoliticalShift("no-such-faction", -5, 1));

        // When
        timer.fire();

        // Then
        assertEquals(0, state().time());
        assertTrue(scheduler.isRunning());
        timer.fire();
        assertEquals(1, state().time());
    }

    // ========== Automatic mode ==========

    @Test
    void shouldPaceAutomaticTurnsByCommittedTickDelay() {
        // Given
        scheduler.initialize(WorldFixtures.village());

        // When
        scheduler.start(RunMode.AUTOMATIC);
        timer.fire();

        // Then
        assertEquals(1, timer.starts());
        assertEquals(1, state().time());
        assertEquals(state().tickDelay(), timer.nextDelay());
    }

    @Test
    void shouldSkipTimerFiringWhileTurnIsInFlight() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        scheduler.addTurnListener(committed -> timer.fire());
        scheduler.start(RunMode.AUTOMATIC);

        // When
        timer.fire();

        // Then
        assertEquals(1, state().time());
    }

    @Test
    void shouldNotFireAfterStop() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.AUTOMATIC);
        scheduler.stop();

        // When
        timer.fire();

        // Then
        assertEquals(0, state().time());
    }

    // ========== Persistence ==========

    @Test
    void shouldKeepRunningWhenPersistenceFails() {
        // Given
        store = new InMemoryWorldStore(new Random(42L), 1.0);
        scheduler = newScheduler(SchedulerConfig.defaults());
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.MANUAL);

        // When
        scheduler.step();

        // Then
        assertEquals(1, state().time());
        assertEquals(0, store.saveCount());
        assertTrue(store.load().isEmpty());
    }

    @Test
    void shouldRestoreSavedWorld() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.MANUAL);
        scheduler.step();
        scheduler.step();
        TickScheduler restored = newScheduler(SchedulerConfig.defaults());

        // When
        boolean loaded = restored.restore();

        // Then
        assertTrue(loaded);
        assertEquals(SchedulerState.INITIALIZED, restored.schedulerState());
        assertEquals(2, restored.state().orElseThrow().time());
        assertEquals(state().entities(), restored.state().orElseThrow().entities());
    }

    @Test
    void shouldDropQueuedEventsOnRestore() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        scheduler.submit(new ComplexEvent.PoliticalShift("north", -5, 1));

        // When
        boolean loaded = scheduler.restore();

        // Then
        assertTrue(loaded);
        assertEquals(0, scheduler.pendingEvents());
    }

    @Test
    void shouldTreatCorruptSnapshotAsNoSavedState() {
        // Given
        store.putRaw("{\"time\": -3, \"nodes\": [], \"entities\": [], \"resources\": {}}".getBytes(StandardCharsets.UTF_8));

        // When / Then
        assertFalse(scheduler.restore());
        assertEquals(SchedulerState.IDLE, scheduler.schedulerState());
    }

    // ========== Events, encounters and observers ==========

    @Test
    void shouldDeclareWarAndPublishOnCommit() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.MANUAL);
        scheduler.submit(new ComplexEvent.WarDeclaration("war-1", List.of("north"), List.of("south"), "grain",
                List.of(), 1));

        // When
        scheduler.step();

        // Then
        assertTrue(state().war("war-1").isPresent());
        assertEquals(1, scheduler.eventLog().eventsOfType(HistoricalEventType.WAR_DECLARED).size());
        assertEquals(1, scheduler.eventLog().eventsOfType(HistoricalEventType.WAR_DECLARED).get(0).timestamp());
    }

    @Test
    void shouldFoldBattleIntoWar() {
        // Given
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.MANUAL);
        scheduler.submit(new ComplexEvent.WarDeclaration("war-1", List.of("north"), List.of("south"), null,
                List.of(), 1));
        scheduler.step();
        scheduler.submit(new ComplexEvent.BattleEngagement("war-1", force("north"), force("south"),
                Location.field("forest", Terrain.FOREST), 1));

        // When
        scheduler.step();

        // Then
        assertEquals(1, scheduler.battles().size());
        assertEquals("war-1", scheduler.battles().get(0).warId());
        assertEquals(List.of(scheduler.battles().get(0).id()), state().war("war-1").orElseThrow().battleIds());
    }

    @Test
    void shouldDrawAtMostConfiguredEventsPerTurn() {
        // Given
        scheduler = newScheduler(SchedulerConfig.builder().maxConcurrentEvents(1).build());
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.MANUAL);
        scheduler.submit(new ComplexEvent.PoliticalShift("north", -5, 1));
        scheduler.submit(new ComplexEvent.PoliticalShift("south", -5, 1));

        // When
        scheduler.step();

        // Then
        assertEquals(1, scheduler.pendingEvents());
        assertEquals(1, scheduler.eventLog().eventsOfType(HistoricalEventType.POLITICAL_SHIFT).size());
    }

    @Test
    void shouldRunEncounterToCompletion() {
        // Given
        scheduler.initialize(WorldFixtures.villageWithFestival());
        scheduler.start(RunMode.MANUAL);

        // When
        scheduler.step();
        EncounterInstance started = state().activeEncounters().get(0);
        scheduler.step();
        scheduler.step();

        // Then
        assertEquals(List.of("ana", "bo"), started.participants());
        assertTrue(state().activeEncounters().isEmpty());
        assertEquals(1, scheduler.encounterHistory().size());
        assertEquals(EncounterStatus.COMPLETED, scheduler.encounterHistory().get(0).status());
        assertEquals(1, scheduler.eventLog().eventsOfType(HistoricalEventType.ENCOUNTER_RESOLVED).size());
    }

    @Test
    void shouldEndEncounterOnRequest() {
        // Given
        scheduler.initialize(WorldFixtures.villageWithFestival());
        scheduler.start(RunMode.MANUAL);
        scheduler.step();
        String instanceId = state().activeEncounters().get(0).id();

        // When
        EncounterInstance aborted = scheduler.endEncounter(instanceId, "storm");

        // Then
        assertEquals(EncounterStatus.ABORTED, aborted.status());
        assertEquals("storm", aborted.endReason());
        assertTrue(state().activeEncounters().isEmpty());
        assertEquals(List.of(aborted), scheduler.encounterHistory());
        assertThrows(IllegalArgumentException.class, () -> scheduler.endEncounter(instanceId, "again"));
    }

    @Test
    void shouldNotifyListenersAndSurviveListenerFailure() {
        // Given
        List<Long> seen = new ArrayList<>();
        List<TurnSummary> summaries = new ArrayList<>();
        scheduler.addTurnListener(committed -> {
            throw new IllegalStateException("listener failure");
        });
        scheduler.addTurnListener(committed -> seen.add(committed.time()));
        scheduler.addSummaryListener(summaries::add);
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.MANUAL);

        // When
        scheduler.step();
        scheduler.step();

        // Then
        assertEquals(List.of(1L, 2L), seen);
        assertEquals(2, summaries.size());
    }

    @Test
    void shouldStopNotifyingRemovedTurnListener() {
        // Given
        List<Long> seen = new ArrayList<>();
        Consumer<WorldState> listener = committed -> seen.add(committed.time());
        scheduler.addTurnListener(listener);
        scheduler.initialize(WorldFixtures.village());
        scheduler.start(RunMode.MANUAL);
        scheduler.step();

        // When
        scheduler.removeTurnListener(listener);
        scheduler.step();

        // Then
        assertEquals(List.of(1L), seen);
    }

    private static Force force(String factionId) {
        return new Force(factionId, new Commander("commander", 10, 10, 7, 0),
                List.of(new Unit(20, 1.0, 0.5, 0.5, 7)), UnitType.INFANTRY, 1, 1, 1, 7, 0.5, 0);
    }
}
