package worldsim.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import worldsim.conflict.Force;
import worldsim.conflict.Location;
import worldsim.conflict.WarGoal;

import java.util.List;

/**
 * A world-level event queued for processing by the scheduler.
 * <p>
 * Handlers are selected through {@link #accept(Handler)}, so a new event variant does not
 * compile until every handler covers it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ComplexEvent.WarDeclaration.class, name = "war_declaration"),
        @JsonSubTypes.Type(value = ComplexEvent.BattleEngagement.class, name = "battle"),
        @JsonSubTypes.Type(value = ComplexEvent.TradeDeal.class, name = "trade"),
        @JsonSubTypes.Type(value = ComplexEvent.PoliticalShift.class, name = "political"),
        @JsonSubTypes.Type(value = ComplexEvent.DiplomaticShift.class, name = "diplomatic"),
        @JsonSubTypes.Type(value = ComplexEvent.EncounterStart.class, name = "encounter")
})
public sealed interface ComplexEvent permits ComplexEvent.WarDeclaration, ComplexEvent.BattleEngagement,
        ComplexEvent.TradeDeal, ComplexEvent.PoliticalShift, ComplexEvent.DiplomaticShift, ComplexEvent.EncounterStart {

    /**
     * Priority class of an event. Queue priority is the base priority scaled by magnitude.
     */
    enum Kind {
        WAR(100),
        POLITICAL(75),
        DIPLOMATIC(60),
        TRADE(50),
        ENCOUNTER(40);

        private final int basePriority;

        Kind(int basePriority) {
            this.basePriority = basePriority;
        }

        public int basePriority() {
            return basePriority;
        }
    }

    Kind kind();

    /**
     * Scale of the event; values {@code <= 0} count as 1.
     */
    double magnitude();

    <R> R accept(Handler<R> handler);

    @JsonIgnore
    default double priority() {
        double scale = magnitude() > 0 ? magnitude() : 1.0;
        return kind().basePriority() * scale;
    }

    interface Handler<R> {
        R onWarDeclaration(WarDeclaration event);

        R onBattle(BattleEngagement event);

        R onTrade(TradeDeal event);

        R onPolitical(PoliticalShift event);

        R onDiplomatic(DiplomaticShift event);

        R onEncounter(EncounterStart event);
    }

    record WarDeclaration(String warId, List<String> attackers, List<String> defenders, String cause,
                          List<WarGoal> goals, double magnitude) implements ComplexEvent {
        public WarDeclaration {
            attackers = attackers == null ? List.of() : List.copyOf(attackers);
            defenders = defenders == null ? List.of() : List.copyOf(defenders);
            goals = goals == null ? List.of() : List.copyOf(goals);
        }

        @Override
        public Kind kind() {
            return Kind.WAR;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.onWarDeclaration(this);
        }
    }

    /**
     * @param warId war the battle is fought in, or {@code null} for a skirmish
     */
    record BattleEngagement(String warId, Force attacker, Force defender, Location location,
                            double magnitude) implements ComplexEvent {
        @Override
        public Kind kind() {
            return Kind.WAR;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.onBattle(this);
        }
    }

    /**
     * @param traderId   entity whose bargaining decides the deal; may be {@code null}
     * @param delta      signed change to the resource pool when the deal lands
     * @param difficulty bargaining difficulty
     */
    record TradeDeal(String traderId, String resource, double delta, int difficulty,
                     double magnitude) implements ComplexEvent {
        @Override
        public Kind kind() {
            return Kind.TRADE;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.onTrade(this);
        }
    }

    record PoliticalShift(String factionId, double stabilityDelta, double magnitude) implements ComplexEvent {
        @Override
        public Kind kind() {
            return Kind.POLITICAL;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.onPolitical(this);
        }
    }

    record DiplomaticShift(String fromFactionId, String toFactionId, double opinionDelta, double trustDelta,
                           double magnitude) implements ComplexEvent {
        @Override
        public Kind kind() {
            return Kind.DIPLOMATIC;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.onDiplomatic(this);
        }
    }

    /**
     * Explicit request to start an encounter. {@code participants} empty means every
     * entity on the node.
     */
    record EncounterStart(String encounterId, String nodeId, List<String> participants,
                          double magnitude) implements ComplexEvent {
        public EncounterStart {
            participants = participants == null ? List.of() : List.copyOf(participants);
        }

        @Override
        public Kind kind() {
            return Kind.ENCOUNTER;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.onEncounter(this);
        }
    }
}
