package worldsim.encounter;

import worldsim.events.EventSink;
import worldsim.events.HistoricalEvent;
import worldsim.events.HistoricalEventType;
import worldsim.resolution.SkillCheck;
import worldsim.resolution.StochasticResolver;
import worldsim.world.Entity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Starts, advances and finishes encounter instances.
 * <p>
 * Definitions and instances are immutable; every operation returns the updated value and
 * the caller decides whether to keep it. Outcome selection and participant checks draw
 * from the injected {@link StochasticResolver}.
 */
public class EncounterLifecycle {

    private static final Logger logger = Logger.getLogger(EncounterLifecycle.class.getName());

    static final int SEQUENTIAL_ASSIST = 2;

    private final StochasticResolver resolver;

    public EncounterLifecycle(StochasticResolver resolver) {
        if (resolver == null) {
            throw new IllegalArgumentException("Resolver cannot be null");
        }
        this.resolver = resolver;
    }

    /**
     * Gates, in order: cooldown, node restriction, prerequisites (only when the context
     * names a character), then triggers (only when any are declared; one is enough).
     * Probability triggers consume a random draw each time they are reached.
     */
    public boolean canTrigger(Encounter encounter, EncounterContext context) {
        if (!encounter.isOffCooldown(context.currentTurn())) {
            return false;
        }
        if (context.nodeId() != null && !encounter.allowsNode(context.nodeId())) {
            return false;
        }
        if (context.character() != null
                && !encounter.prerequisites().stream().allMatch(prerequisite -> prerequisite.isMetBy(context.character()))) {
            return false;
        }
        if (encounter.triggers().isEmpty()) {
            return true;
        }
        for (Trigger trigger : encounter.triggers()) {
            if (trigger.isSatisfied(context, resolver)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Starts an instance when {@link #canTrigger} passes.
     *
     * @param participants entity ids taking part, in acting order
     * @return empty when the encounter cannot trigger in this context
     */
    public Optional<EncounterActivation> triggerEncounter(Encounter encounter, EncounterContext context,
                                                          List<String> participants, EventSink events) {
        if (!canTrigger(encounter, context)) {
            return Optional.empty();
        }
        Encounter triggered = encounter.markTriggered(context.currentTurn());
        EncounterInstance instance = new EncounterInstance(
                triggered.id() + "#" + triggered.timesTriggered(),
                triggered.id(),
                context.currentTurn(),
                context.nodeId(),
                participants,
                0,
                triggered.duration(),
                EncounterStatus.ACTIVE,
                triggered.generateInteractions(),
                List.of(),
                null,
                null,
                null);

        logger.fine(() -> "Encounter " + instance.id() + " started at " + context.nodeId() + " with " + participants);
        events.publish(HistoricalEvent.of(context.currentTurn(), HistoricalEventType.ENCOUNTER_TRIGGERED, instance.id(),
                triggered.name() + " began" + (context.nodeId() == null ? "" : " at " + context.nodeId())));
        return Optional.of(new EncounterActivation(triggered, instance));
    }

    /**
     * Advances one instance by a turn. Once the elapsed count reaches the duration the
     * outcome is resolved and the instance is returned completed; otherwise participants
     * act according to the encounter's sequencing.
     *
     * @param entities current entities by id; participants missing from it sit the turn out
     * @throws IllegalStateException if the instance is no longer active
     */
    public EncounterInstance processTurn(Encounter encounter, EncounterInstance instance,
                                         Map<String, Entity> entities, long globalTurn, EventSink events) {
        if (!instance.isActive()) {
            throw new IllegalStateException("Encounter instance " + instance.id() + " is " + instance.status());
        }
        EncounterInstance advanced = instance.advanced();

        if (advanced.elapsedTurns() >= advanced.maxTurns()) {
            Entity lead = advanced.participants().stream()
                    .map(entities::get)
                    .filter(Objects::nonNull)
                    .findFirst()
                    .orElse(null);
            EncounterContext context = new EncounterContext(globalTurn, advanced.nodeId(), lead,
                    lead == null ? null : lead.lastInteractionType());
            EncounterOutcome outcome = resolveOutcome(encounter, context).orElse(null);
            EncounterInstance completed = advanced.completed(outcome, globalTurn);

            logger.fine(() -> "Encounter " + instance.id() + " resolved: " + (outcome == null ? "no outcome" : outcome.id()));
            events.publish(HistoricalEvent.of(globalTurn, HistoricalEventType.ENCOUNTER_RESOLVED, instance.id(),
                    encounter.name() + " ended" + (outcome == null ? " without an outcome" : ": " + outcome.description())));
            return completed;
        }

        List<ParticipantAction> actions = encounter.sequencing() == Sequencing.SEQUENTIAL
                ? actSequentially(encounter, advanced, entities)
                : actSimultaneously(encounter, advanced, entities);
        return advanced.withTurn(new EncounterTurn(advanced.elapsedTurns(), globalTurn, actions));
    }

    private List<ParticipantAction> actSequentially(Encounter encounter, EncounterInstance instance,
                                                    Map<String, Entity> entities) {
        List<ParticipantAction> actions = new ArrayList<>();
        boolean previousSucceeded = false;
        for (String participantId : instance.participants()) {
            Entity participant = entities.get(participantId);
            if (participant == null) {
                continue;
            }
            ParticipantAction action = act(encounter, participant, previousSucceeded ? SEQUENTIAL_ASSIST : 0);
            actions.add(action);
            previousSucceeded = action.success();
        }
        return actions;
    }

    private List<ParticipantAction> actSimultaneously(Encounter encounter, EncounterInstance instance,
                                                      Map<String, Entity> entities) {
        return instance.participants().stream()
                .map(entities::get)
                .filter(Objects::nonNull)
                .map(participant -> act(encounter, participant, 0))
                .toList();
    }

    private ParticipantAction act(Encounter encounter, Entity participant, int assist) {
        int modifier = participant.attributes().modifier(encounter.type().checkedAttribute());
        SkillCheck check = resolver.skillCheck(List.of(modifier, assist), encounter.difficulty().dc());
        return new ParticipantAction(participant.id(), check, assist);
    }

    /**
     * Weighted choice over the outcomes whose condition holds for the context character.
     *
     * @return empty when no outcome is eligible
     */
    public Optional<EncounterOutcome> resolveOutcome(Encounter encounter, EncounterContext context) {
        List<EncounterOutcome> eligible = encounter.outcomes().stream()
                .filter(outcome -> outcome.isAvailableFor(context.character()))
                .toList();
        if (eligible.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(resolver.select(eligible, EncounterOutcome::weight));
    }

    /**
     * Forces an active instance to end without an outcome.
     *
     * @throws IllegalStateException if the instance has already ended
     */
    public EncounterInstance endEncounter(EncounterInstance instance, long currentTurn, String reason, EventSink events) {
        if (!instance.isActive()) {
            throw new IllegalStateException("Encounter instance " + instance.id() + " already ended as " + instance.status());
        }
        String endReason = reason == null || reason.isBlank() ? "forced" : reason;
        EncounterInstance aborted = instance.aborted(currentTurn, endReason);
        logger.info(() -> "Encounter " + instance.id() + " aborted: " + endReason);
        events.publish(HistoricalEvent.of(currentTurn, HistoricalEventType.ENCOUNTER_ABORTED, instance.id(),
                "Encounter " + instance.encounterId() + " aborted: " + endReason));
        return aborted;
    }
}
