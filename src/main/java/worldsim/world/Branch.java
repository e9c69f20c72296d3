package worldsim.world;

import java.util.List;

/**
 * One possible path through an interaction.
 *
 * @param weight     relative selection weight, non-negative
 * @param condition  optional gate on the acting entity's state
 * @param attribute  ability checked when the branch is attempted
 * @param difficulty check difficulty
 */
public record Branch(
        String id,
        String text,
        double weight,
        StateCondition condition,
        List<Effect> effects,
        String attribute,
        int difficulty
) {

    public static final String DEFAULT_ATTRIBUTE = Attributes.CHARISMA;
    public static final int DEFAULT_DIFFICULTY = 10;

    public Branch {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Branch id cannot be blank");
        }
        if (Double.isNaN(weight) || weight < 0) {
            throw new IllegalArgumentException("Branch weight must be non-negative, but was: " + weight);
        }
        effects = effects == null ? List.of() : List.copyOf(effects);
        attribute = attribute == null || attribute.isBlank() ? DEFAULT_ATTRIBUTE : attribute;
        difficulty = difficulty <= 0 ? DEFAULT_DIFFICULTY : difficulty;
    }

    public static Branch of(String id, double weight, Effect... effects) {
        return new Branch(id, id, weight, null, List.of(effects), DEFAULT_ATTRIBUTE, DEFAULT_DIFFICULTY);
    }

    public boolean isEligibleFor(Entity entity) {
        return condition == null || condition.test(entity);
    }
}
