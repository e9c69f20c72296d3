package worldsim.resolution;

import java.util.List;
import java.util.Random;
import java.util.function.ToDoubleFunction;

/**
 * Shared probabilistic primitive used by combat, trade and dialogue-branch selection.
 * <p>
 * The resolver holds no state other than the injected random source. Passing a seeded
 * {@link Random} makes every draw reproducible; the class never touches ambient
 * randomness such as {@link Math#random()}.
 * <p>
 * Not thread-safe. Turns execute one at a time, so a single resolver instance is shared
 * by all engines within a simulation.
 */
public class StochasticResolver {

    private final Random random;

    /**
     * @param random seeded random generator for deterministic behavior
     */
    public StochasticResolver(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("Random cannot be null");
        }
        this.random = random;
    }

    public static StochasticResolver seeded(long seed) {
        return new StochasticResolver(new Random(seed));
    }

    /**
     * Picks exactly one candidate with probability proportional to its weight.
     * <p>
     * A uniform value in {@code [0, total)} is drawn and weights are subtracted in list
     * order until the remainder is {@code <= 0}. When floating-point drift exhausts the
     * list without triggering, the last candidate is returned. This fallback is also the
     * only way a zero-weight candidate can be picked, and only when it is last.
     *
     * @throws IllegalArgumentException if the list is empty or a weight is negative or NaN
     */
    public <T> T select(List<T> candidates, ToDoubleFunction<? super T> weight) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("Weighted selection requires at least one candidate");
        }
        double[] weights = new double[candidates.size()];
        double total = 0.0;
        for (int i = 0; i < candidates.size(); i++) {
            double w = weight.applyAsDouble(candidates.get(i));
            if (Double.isNaN(w) || w < 0.0) {
                throw new IllegalArgumentException("Weight must be non-negative, but was: " + w);
            }
            weights[i] = w;
            total += w;
        }

        double remainder = random.nextDouble() * total;
        for (int i = 0; i < weights.length; i++) {
            remainder -= weights[i];
            if (remainder <= 0 && weights[i] > 0) {
                return candidates.get(i);
            }
        }
        return candidates.get(candidates.size() - 1);
    }

    /**
     * Rolls a d20 and adds every modifier.
     */
    public SkillCheck skillCheck(List<Integer> modifiers, int difficulty) {
        return skillCheck(rollD20(), modifiers, difficulty);
    }

    /**
     * Evaluates a known natural roll. Used where the roll has already been drawn or must
     * be fixed for replay.
     */
    public SkillCheck skillCheck(int roll, List<Integer> modifiers, int difficulty) {
        int modifierTotal = 0;
        for (Integer modifier : modifiers) {
            modifierTotal += modifier;
        }
        return SkillCheck.of(roll, modifierTotal, difficulty);
    }

    public int rollD20() {
        return random.nextInt(SkillCheck.DIE_SIDES) + 1;
    }

    /**
     * Bernoulli draw: true with the given probability.
     */
    public boolean chance(double probability) {
        if (probability <= 0.0) {
            return false;
        }
        return random.nextDouble() < probability;
    }

    /**
     * Uniform draw in {@code [0, 1)}.
     */
    public double nextDouble() {
        return random.nextDouble();
    }

    /**
     * D&amp;D ability modifier: {@code floor((score - 10) / 2)}.
     */
    public static int abilityModifier(double score) {
        return (int) Math.floor((score - 10) / 2.0);
    }
}
