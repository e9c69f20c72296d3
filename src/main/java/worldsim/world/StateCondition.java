package worldsim.world;

/**
 * Holds when the entity's stat is at or below the threshold, e.g. "health &lt;= 30".
 */
public record StateCondition(Stat stat, double threshold) {

    public StateCondition {
        if (stat == null) {
            throw new IllegalArgumentException("Stat cannot be null");
        }
    }

    public boolean test(Entity entity) {
        if (entity == null) {
            return false;
        }
        return entity.stat(stat) <= threshold;
    }
}
