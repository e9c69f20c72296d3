package worldsim.simulation;

import worldsim.conflict.ConflictResolutionEngine;
import worldsim.conflict.War;
import worldsim.encounter.Encounter;
import worldsim.encounter.EncounterActivation;
import worldsim.encounter.EncounterContext;
import worldsim.encounter.EncounterInstance;
import worldsim.encounter.EncounterLifecycle;
import worldsim.events.ComplexEvent;
import worldsim.events.ConsciousnessScaling;
import worldsim.resolution.StochasticResolver;
import worldsim.world.Attributes;
import worldsim.world.Entity;
import worldsim.world.Stat;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Computes the candidate next state from a committed one.
 * <p>
 * Work happens in a fixed order on a {@link TurnWorkspace}:
 * <ol>
 *     <li>per-entity decay, passive evolution and one interaction, in entity order</li>
 *     <li>active encounter instances advance; resolved ones apply their outcome</li>
 *     <li>drawn complex events are dispatched and their scaled impact shifts every mood</li>
 *     <li>every open war is updated and concluded wars are archived</li>
 *     <li>idle encounters are offered to entities for automatic triggering</li>
 * </ol>
 * The candidate is validated against the committed state; any failure along the way is
 * reported as a {@link TurnExecutionException} and the committed state is untouched.
 */
class TurnProcessor {

    private static final Logger logger = Logger.getLogger(TurnProcessor.class.getName());

    static final double SIGNIFICANT_CHANGE = 5.0;

    private final SchedulerConfig config;
    private final ConflictResolutionEngine conflicts;
    private final EncounterLifecycle encounters;
    private final EntityTurnUpdater entityUpdater;
    private final ComplexEventDispatcher dispatcher;
    private final WorldStateValidator validator;

    TurnProcessor(SchedulerConfig config, StochasticResolver resolver,
                  ConflictResolutionEngine conflicts, EncounterLifecycle encounters) {
        this.config = config;
        this.conflicts = conflicts;
        this.encounters = encounters;
        this.entityUpdater = new EntityTurnUpdater(config, new InteractionResolver(resolver));
        this.dispatcher = new ComplexEventDispatcher(conflicts, encounters, resolver);
        this.validator = new WorldStateValidator(config.conflictConfig().exhaustionLimit());
    }

    /**
     * Pacing from mean coherence: {@code min + coherence * (max - min)}, clamped to the
     * configured bounds. Higher coherence gives a longer delay.
     */
    long tickDelay(WorldState state) {
        double coherence = state.averageCoherence();
        double raw = config.minTickDelay() + coherence * (config.maxTickDelay() - config.minTickDelay());
        if (Double.isNaN(raw)) {
            return config.minTickDelay();
        }
        return Math.max(config.minTickDelay(), Math.min(config.maxTickDelay(), Math.round(raw)));
    }

    TurnOutcome process(WorldState committed, List<ComplexEvent> events) {
        long turn = committed.time() + 1;
        try {
            return compute(committed, events, turn);
        } catch (TurnExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TurnExecutionException(turn, String.valueOf(e.getMessage()), e);
        }
    }

    private TurnOutcome compute(WorldState committed, List<ComplexEvent> events, long turn) {
        long tickDelay = tickDelay(committed);
        TurnWorkspace workspace = new TurnWorkspace(committed, turn);

        for (String entityId : new ArrayList<>(workspace.entities.keySet())) {
            entityUpdater.update(entityId, workspace).ifPresent(workspace.actions::add);
        }

        advanceEncounters(workspace);
        dispatchEvents(events, workspace);
        updateWars(workspace);
        if (config.autoTriggerEncounters()) {
            autoTriggerEncounters(workspace);
        }

        WorldState candidate = workspace.toState(tickDelay);
        List<String> violations = validator.validate(committed, candidate);
        if (!violations.isEmpty()) {
            throw new TurnExecutionException(turn, violations);
        }

        return new TurnOutcome(candidate,
                workspace.actions,
                resourceDeltas(committed.resources(), candidate.resources()),
                significantChanges(committed, candidate),
                workspace.events.pending(),
                workspace.battles,
                workspace.concludedWars,
                workspace.finishedEncounters);
    }

    private void advanceEncounters(TurnWorkspace workspace) {
        for (EncounterInstance instance : new ArrayList<>(workspace.activeEncounters.values())) {
            Encounter encounter = workspace.encounters.get(instance.encounterId());
            if (encounter == null) {
                throw new IllegalStateException("Encounter instance " + instance.id() + " has no definition");
            }
            EncounterInstance next = encounters.processTurn(encounter, instance, workspace.entities,
                    workspace.turn(), workspace.events);
            if (next.isActive()) {
                workspace.activeEncounters.put(next.id(), next);
                continue;
            }
            workspace.activeEncounters.remove(next.id());
            workspace.finishedEncounters.add(next);
            if (next.outcome() != null) {
                for (String participantId : next.participants()) {
                    Entity participant = workspace.entities.get(participantId);
                    if (participant != null) {
                        workspace.entities.put(participantId,
                                InteractionResolver.applyEffects(participant, next.outcome().effects(), workspace.resources));
                    }
                }
            }
        }
    }

    private void dispatchEvents(List<ComplexEvent> events, TurnWorkspace workspace) {
        if (events.isEmpty()) {
            return;
        }
        double collective = ConsciousnessScaling.collective(workspace.entities.values());
        double moodShift = 0.0;
        for (ComplexEvent event : events) {
            double impact = dispatcher.dispatch(event, workspace);
            moodShift += ConsciousnessScaling.scale(impact, collective);
        }
        if (moodShift != 0.0) {
            double shift = moodShift;
            workspace.entities.replaceAll((id, entity) -> entity.adjustStat(Stat.MOOD, shift));
        }
    }

    private void updateWars(TurnWorkspace workspace) {
        for (War war : new ArrayList<>(workspace.wars.values())) {
            War updated = conflicts.updateWar(war, workspace.factions, workspace.turn(), workspace.events);
            if (updated.isConcluded()) {
                workspace.wars.remove(updated.id());
                workspace.concludedWars.add(updated);
            } else {
                workspace.wars.put(updated.id(), updated);
            }
        }
    }

    /**
     * Offers each idle encounter to entities in collection order; the first entity whose
     * context passes starts it with everyone on that entity's node.
     */
    private void autoTriggerEncounters(TurnWorkspace workspace) {
        for (Encounter encounter : new ArrayList<>(workspace.encounters.values())) {
            if (workspace.hasActiveInstanceOf(encounter.id())) {
                continue;
            }
            for (Entity entity : workspace.entities.values()) {
                EncounterContext context = EncounterContext.forEntity(entity, workspace.turn());
                Optional<EncounterActivation> activation = encounters.triggerEncounter(encounter, context,
                        workspace.entityIdsAt(entity.nodeId()), workspace.events);
                if (activation.isPresent()) {
                    workspace.encounters.put(encounter.id(), activation.get().encounter());
                    workspace.activeEncounters.put(activation.get().instance().id(), activation.get().instance());
                    logger.fine(() -> "Encounter " + encounter.id() + " auto-triggered by " + entity.id());
                    break;
                }
            }
        }
    }

    static List<ResourceDelta> resourceDeltas(Map<String, Double> before, Map<String, Double> after) {
        List<ResourceDelta> deltas = new ArrayList<>();
        Set<String> names = new HashSet<>(before.keySet());
        names.addAll(after.keySet());
        names.stream().sorted().forEach(name -> {
            double was = before.getOrDefault(name, 0.0);
            double now = after.getOrDefault(name, 0.0);
            if (Double.compare(was, now) != 0) {
                deltas.add(new ResourceDelta(name, was, now));
            }
        });
        return deltas;
    }

    static int significantChanges(WorldState before, WorldState after) {
        int changed = 0;
        for (Entity updated : after.entities()) {
            Entity previous = before.entity(updated.id()).orElse(null);
            if (previous == null || isSignificant(previous, updated)) {
                changed++;
            }
        }
        return changed;
    }

    private static boolean isSignificant(Entity before, Entity after) {
        for (Stat stat : Stat.values()) {
            if (Math.abs(after.stat(stat) - before.stat(stat)) > SIGNIFICANT_CHANGE) {
                return true;
            }
        }
        for (String attribute : Attributes.NAMES) {
            if (Math.abs(after.attributes().score(attribute) - before.attributes().score(attribute)) > SIGNIFICANT_CHANGE) {
                return true;
            }
        }
        return after.lastInteractionType() != null
                && !Objects.equals(after.lastInteractionType(), before.lastInteractionType());
    }
}
