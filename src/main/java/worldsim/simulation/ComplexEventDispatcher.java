package worldsim.simulation;

import worldsim.conflict.Battle;
import worldsim.conflict.ConflictResolutionEngine;
import worldsim.conflict.War;
import worldsim.encounter.Encounter;
import worldsim.encounter.EncounterContext;
import worldsim.encounter.EncounterLifecycle;
import worldsim.events.ComplexEvent;
import worldsim.events.HistoricalEvent;
import worldsim.events.HistoricalEventType;
import worldsim.resolution.SkillCheck;
import worldsim.resolution.StochasticResolver;
import worldsim.world.Attributes;
import worldsim.world.Entity;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Routes complex events to the engine that owns them and reports each event's raw
 * consciousness impact: the sum of the impacts annotated on the historical events it
 * produced.
 * <p>
 * Any {@link IllegalArgumentException} or {@link IllegalStateException} thrown here
 * (unknown faction, war or encounter, non-finite trade delta) fails the whole turn.
 */
class ComplexEventDispatcher {

    private static final Logger logger = Logger.getLogger(ComplexEventDispatcher.class.getName());

    static final String BARGAINING_SKILL = "bargaining";
    static final int DEFAULT_TRADE_DIFFICULTY = 10;
    static final double SHIFT_IMPACT_FACTOR = 0.1;

    private final ConflictResolutionEngine conflicts;
    private final EncounterLifecycle encounters;
    private final StochasticResolver resolver;

    ComplexEventDispatcher(ConflictResolutionEngine conflicts, EncounterLifecycle encounters, StochasticResolver resolver) {
        this.conflicts = conflicts;
        this.encounters = encounters;
        this.resolver = resolver;
    }

    double dispatch(ComplexEvent event, TurnWorkspace workspace) {
        int before = workspace.events.size();
        event.accept(new Handler(workspace));
        List<HistoricalEvent> produced = workspace.events.pending().subList(before, workspace.events.size());
        return produced.stream().mapToDouble(HistoricalEvent::consciousnessImpact).sum();
    }

    private final class Handler implements ComplexEvent.Handler<Void> {

        private final TurnWorkspace workspace;

        private Handler(TurnWorkspace workspace) {
            this.workspace = workspace;
        }

        @Override
        public Void onWarDeclaration(ComplexEvent.WarDeclaration event) {
            String warId = event.warId() == null || event.warId().isBlank() ? workspace.nextWarId() : event.warId();
            if (workspace.wars.containsKey(warId)) {
                throw new IllegalArgumentException("War " + warId + " already exists");
            }
            List<String> belligerents = new ArrayList<>(event.attackers());
            belligerents.addAll(event.defenders());
            belligerents.forEach(workspace.factions::get);

            War war = conflicts.declareWar(warId, event.attackers(), event.defenders(), event.cause(), event.goals(),
                    workspace.turn(), workspace.events);
            workspace.wars.put(warId, war);
            return null;
        }

        @Override
        public Void onBattle(ComplexEvent.BattleEngagement event) {
            War war = null;
            if (event.warId() != null) {
                war = workspace.wars.get(event.warId());
                if (war == null) {
                    throw new IllegalArgumentException("Unknown war: " + event.warId());
                }
            }
            Battle battle = conflicts.resolveBattle(workspace.nextBattleId(), event.attacker(), event.defender(),
                    event.location(), workspace.turn(), workspace.events);
            if (war != null) {
                battle = battle.withWarId(war.id());
                workspace.wars.put(war.id(), conflicts.recordBattle(war, battle, workspace.factions));
            }
            workspace.battles.add(battle);
            return null;
        }

        @Override
        public Void onTrade(ComplexEvent.TradeDeal event) {
            if (event.resource() == null || event.resource().isBlank()) {
                throw new IllegalArgumentException("Trade needs a resource");
            }
            if (!Double.isFinite(event.delta())) {
                throw new IllegalArgumentException("Trade delta must be finite, but was: " + event.delta());
            }
            List<Integer> modifiers = new ArrayList<>();
            if (event.traderId() != null) {
                Entity trader = workspace.entities.get(event.traderId());
                if (trader == null) {
                    throw new IllegalArgumentException("Unknown trader: " + event.traderId());
                }
                modifiers.add(trader.attributes().modifier(Attributes.CHARISMA));
                modifiers.add((int) Math.floor(trader.skill(BARGAINING_SKILL)));
            }
            int difficulty = event.difficulty() > 0 ? event.difficulty() : DEFAULT_TRADE_DIFFICULTY;
            SkillCheck bargain = resolver.skillCheck(modifiers, difficulty);
            long turn = workspace.turn();

            if (!bargain.success()) {
                workspace.events.publish(HistoricalEvent.of(turn, HistoricalEventType.TRADE_FAILED, event.resource(),
                        "Trade in " + event.resource() + " fell through (rolled " + bargain.total() + " against " + difficulty + ")"));
                return null;
            }

            double before = workspace.resources.getOrDefault(event.resource(), 0.0);
            double after = Math.max(0.0, before + event.delta());
            workspace.resources.put(event.resource(), after);
            workspace.events.publish(HistoricalEvent.of(turn, HistoricalEventType.TRADE_COMPLETED, event.resource(),
                    String.format("Trade moved %s from %.1f to %.1f", event.resource(), before, after)));

            if (before > 0 && before - after > before / 2) {
                double magnitude = event.magnitude() > 0 ? event.magnitude() : 1.0;
                logger.info(() -> "Market crash in " + event.resource() + " at turn " + turn);
                workspace.events.publish(new HistoricalEvent(turn, HistoricalEventType.MARKET_CRASH, event.resource(),
                        String.format("%s stock collapsed from %.1f to %.1f", event.resource(), before, after),
                        -magnitude));
            }
            return null;
        }

        @Override
        public Void onPolitical(ComplexEvent.PoliticalShift event) {
            double stability = conflicts.adjustStability(workspace.factions, event.factionId(), event.stabilityDelta());
            workspace.events.publish(new HistoricalEvent(workspace.turn(), HistoricalEventType.POLITICAL_SHIFT,
                    event.factionId(),
                    String.format("Stability of %s is now %.1f", event.factionId(), stability),
                    event.stabilityDelta() * SHIFT_IMPACT_FACTOR));
            return null;
        }

        @Override
        public Void onDiplomatic(ComplexEvent.DiplomaticShift event) {
            conflicts.adjustRelation(workspace.factions, event.fromFactionId(), event.toFactionId(),
                    event.opinionDelta(), event.trustDelta());
            workspace.events.publish(new HistoricalEvent(workspace.turn(), HistoricalEventType.DIPLOMATIC_SHIFT,
                    event.fromFactionId(),
                    event.fromFactionId() + " reassessed " + event.toFactionId(),
                    event.opinionDelta() * SHIFT_IMPACT_FACTOR));
            return null;
        }

        @Override
        public Void onEncounter(ComplexEvent.EncounterStart event) {
            Encounter encounter = workspace.encounters.get(event.encounterId());
            if (encounter == null) {
                throw new IllegalArgumentException("Unknown encounter: " + event.encounterId());
            }
            if (workspace.hasActiveInstanceOf(encounter.id())) {
                logger.fine(() -> "Encounter " + encounter.id() + " is already running; request ignored");
                return null;
            }
            List<String> participants = event.participants().isEmpty()
                    ? workspace.entityIdsAt(event.nodeId())
                    : event.participants();
            Entity lead = participants.stream()
                    .map(workspace.entities::get)
                    .filter(Objects::nonNull)
                    .findFirst()
                    .orElse(null);
            EncounterContext context = new EncounterContext(workspace.turn(), event.nodeId(), lead,
                    lead == null ? null : lead.lastInteractionType());

            encounters.triggerEncounter(encounter, context, participants, workspace.events)
                    .ifPresentOrElse(activation -> {
                        workspace.encounters.put(encounter.id(), activation.encounter());
                        workspace.activeEncounters.put(activation.instance().id(), activation.instance());
                    }, () -> logger.fine(() -> "Encounter " + encounter.id() + " could not trigger at turn " + workspace.turn()));
            return null;
        }
    }
}
