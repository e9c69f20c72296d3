package worldsim.world;

/**
 * Directed diplomatic standing of one faction towards another.
 * Both axes are clamped to {@code [-100, 100]}.
 */
public record Relation(double opinion, double trust) {

    public static final double LIMIT = 100.0;

    public static final Relation NEUTRAL = new Relation(0, 0);

    public Relation {
        opinion = clamp(opinion);
        trust = clamp(trust);
    }

    public Relation adjust(double opinionDelta, double trustDelta) {
        return new Relation(opinion + opinionDelta, trust + trustDelta);
    }

    private static double clamp(double value) {
        return Math.max(-LIMIT, Math.min(LIMIT, value));
    }
}
