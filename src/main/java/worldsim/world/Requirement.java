package worldsim.world;

/**
 * Minimum attribute score an entity needs before it may attempt an interaction.
 */
public record Requirement(String attribute, double min) {

    public Requirement {
        if (attribute == null || attribute.isBlank()) {
            throw new IllegalArgumentException("Requirement attribute cannot be blank");
        }
    }

    public boolean isMetBy(Entity entity) {
        return entity.attributes().score(attribute) >= min;
    }
}
