package worldsim.encounter;

import com.fasterxml.jackson.annotation.JsonIgnore;
import worldsim.world.Effect;
import worldsim.world.Entity;
import worldsim.world.StateCondition;

import java.util.List;

/**
 * Possible end of an encounter.
 *
 * @param probability relative weight; values {@code <= 0} count as 1
 * @param condition   optional gate evaluated against the encounter's lead participant
 * @param effects     applied to every participant once this outcome is chosen
 */
public record EncounterOutcome(
        String id,
        String description,
        double probability,
        StateCondition condition,
        List<Effect> effects
) {

    public EncounterOutcome {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Outcome id cannot be blank");
        }
        if (Double.isNaN(probability)) {
            throw new IllegalArgumentException("Outcome probability cannot be NaN");
        }
        description = description == null ? "" : description;
        effects = effects == null ? List.of() : List.copyOf(effects);
    }

    public static EncounterOutcome of(String id, double probability, Effect... effects) {
        return new EncounterOutcome(id, id, probability, null, List.of(effects));
    }

    @JsonIgnore
    public double weight() {
        return probability > 0 ? probability : 1.0;
    }

    public boolean isAvailableFor(Entity character) {
        return condition == null || condition.test(character);
    }
}
