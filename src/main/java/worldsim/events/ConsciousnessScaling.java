package worldsim.events;

import worldsim.world.Entity;

import java.util.Collection;

/**
 * Scales event impacts by the world's collective consciousness (mean entity frequency).
 * A high collective dampens harmful impacts, a low one amplifies them. Beneficial
 * impacts pass through unchanged.
 */
public final class ConsciousnessScaling {

    public static final double HIGH_THRESHOLD = 10.0;
    public static final double LOW_THRESHOLD = 5.0;
    public static final double STEP = 0.1;

    private ConsciousnessScaling() {
    }

    public static double collective(Collection<Entity> entities) {
        return entities.stream().mapToDouble(Entity::frequency).average().orElse(0.0);
    }

    public static double scale(double impact, double collectiveConsciousness) {
        if (impact >= 0) {
            return impact;
        }
        if (collectiveConsciousness > HIGH_THRESHOLD) {
            return impact * Math.max(0.0, 1.0 - (collectiveConsciousness - HIGH_THRESHOLD) * STEP);
        }
        if (collectiveConsciousness < LOW_THRESHOLD) {
            return impact * (1.0 + (LOW_THRESHOLD - collectiveConsciousness) * STEP);
        }
        return impact;
    }
}
