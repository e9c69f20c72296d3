package worldsim.world;

import java.util.Map;

/**
 * A bounded state change carried by interaction branches and encounter outcomes.
 *
 * @param kind   what the effect touches
 * @param target attribute or resource name; unused for stat effects
 * @param value  signed delta
 */
public record Effect(Kind kind, String target, double value) {

    public enum Kind {
        ATTRIBUTE,
        ENERGY,
        HEALTH,
        MOOD,
        RESOURCE
    }

    public Effect {
        if (kind == null) {
            throw new IllegalArgumentException("Effect kind cannot be null");
        }
        if ((kind == Kind.ATTRIBUTE || kind == Kind.RESOURCE) && (target == null || target.isBlank())) {
            throw new IllegalArgumentException(kind + " effect requires a target");
        }
    }

    public static Effect attribute(String attribute, double value) {
        return new Effect(Kind.ATTRIBUTE, attribute, value);
    }

    public static Effect stat(Stat stat, double value) {
        return new Effect(Kind.valueOf(stat.name()), null, value);
    }

    public static Effect resource(String resource, double value) {
        return new Effect(Kind.RESOURCE, resource, value);
    }

    /**
     * Applies the entity-facing part of this effect. Resource effects leave the entity
     * untouched; see {@link #applyTo(Map)}.
     */
    public Entity applyTo(Entity entity) {
        return switch (kind) {
            case ATTRIBUTE -> entity.withAttributes(entity.attributes().adjust(target, value));
            case ENERGY -> entity.adjustStat(Stat.ENERGY, value);
            case HEALTH -> entity.adjustStat(Stat.HEALTH, value);
            case MOOD -> entity.adjustStat(Stat.MOOD, value);
            case RESOURCE -> entity;
        };
    }

    /**
     * Applies a resource effect to a mutable pool copy; pools never go below zero.
     */
    public void applyTo(Map<String, Double> resources) {
        if (kind != Kind.RESOURCE) {
            return;
        }
        double current = resources.getOrDefault(target, 0.0);
        resources.put(target, Math.max(0.0, current + value));
    }
}
