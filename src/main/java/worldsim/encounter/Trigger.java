package worldsim.encounter;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import worldsim.resolution.StochasticResolver;
import worldsim.world.StateCondition;

import java.util.Objects;

/**
 * Condition that lets an encounter start. An encounter with several triggers starts when
 * any one of them holds.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Trigger.Time.class, name = "time"),
        @JsonSubTypes.Type(value = Trigger.AtNode.class, name = "location"),
        @JsonSubTypes.Type(value = Trigger.AfterInteraction.class, name = "interaction"),
        @JsonSubTypes.Type(value = Trigger.OnCondition.class, name = "condition"),
        @JsonSubTypes.Type(value = Trigger.Chance.class, name = "probability")
})
public sealed interface Trigger permits Trigger.Time, Trigger.AtNode, Trigger.AfterInteraction,
        Trigger.OnCondition, Trigger.Chance {

    boolean isSatisfied(EncounterContext context, StochasticResolver resolver);

    /**
     * Holds from the given turn on.
     */
    record Time(long turn) implements Trigger {
        @Override
        public boolean isSatisfied(EncounterContext context, StochasticResolver resolver) {
            return context.currentTurn() >= turn;
        }
    }

    record AtNode(String nodeId) implements Trigger {
        @Override
        public boolean isSatisfied(EncounterContext context, StochasticResolver resolver) {
            return Objects.equals(context.nodeId(), nodeId);
        }
    }

    record AfterInteraction(String interactionType) implements Trigger {
        @Override
        public boolean isSatisfied(EncounterContext context, StochasticResolver resolver) {
            return Objects.equals(context.lastInteractionType(), interactionType);
        }
    }

    /**
     * Holds when the context character's stat is at or below the threshold.
     */
    record OnCondition(StateCondition condition) implements Trigger {
        @Override
        public boolean isSatisfied(EncounterContext context, StochasticResolver resolver) {
            return condition != null && condition.test(context.character());
        }
    }

    /**
     * Draws from the shared resolver every time it is evaluated.
     */
    record Chance(double probability) implements Trigger {
        @Override
        public boolean isSatisfied(EncounterContext context, StochasticResolver resolver) {
            return resolver.chance(probability);
        }
    }
}
