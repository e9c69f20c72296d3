package worldsim.world;

import com.fasterxml.jackson.annotation.JsonIgnore;
import worldsim.resolution.StochasticResolver;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable set of D&amp;D style ability scores.
 * Every score lives in {@code [MIN_SCORE, MAX_SCORE]}; updates clamp instead of failing.
 */
public record Attributes(Map<String, Double> scores) {

    public static final double MIN_SCORE = 3.0;
    public static final double MAX_SCORE = 20.0;
    public static final double DEFAULT_SCORE = 10.0;

    public static final String STRENGTH = "strength";
    public static final String DEXTERITY = "dexterity";
    public static final String CONSTITUTION = "constitution";
    public static final String INTELLIGENCE = "intelligence";
    public static final String WISDOM = "wisdom";
    public static final String CHARISMA = "charisma";

    public static final List<String> NAMES = List.of(STRENGTH, DEXTERITY, CONSTITUTION, INTELLIGENCE, WISDOM, CHARISMA);

    public Attributes {
        Map<String, Double> normalized = new LinkedHashMap<>();
        for (String name : NAMES) {
            Double value = scores == null ? null : scores.get(name);
            normalized.put(name, clamp(value == null ? DEFAULT_SCORE : value));
        }
        if (scores != null) {
            scores.forEach((name, value) -> normalized.putIfAbsent(name, clamp(value == null ? DEFAULT_SCORE : value)));
        }
        scores = Map.copyOf(normalized);
    }

    public static Attributes defaults() {
        return new Attributes(Map.of());
    }

    public static Attributes of(double strength, double dexterity, double constitution,
                                double intelligence, double wisdom, double charisma) {
        return new Attributes(Map.of(
                STRENGTH, strength,
                DEXTERITY, dexterity,
                CONSTITUTION, constitution,
                INTELLIGENCE, intelligence,
                WISDOM, wisdom,
                CHARISMA, charisma));
    }

    public double score(String name) {
        Double value = scores.get(name);
        return value == null ? DEFAULT_SCORE : value;
    }

    public int modifier(String name) {
        return StochasticResolver.abilityModifier(score(name));
    }

    public Attributes with(String name, double score) {
        Map<String, Double> updated = new LinkedHashMap<>(scores);
        updated.put(name, score);
        return new Attributes(updated);
    }

    public Attributes adjust(String name, double delta) {
        return with(name, score(name) + delta);
    }

    @JsonIgnore
    public boolean isWithinBounds() {
        return scores.values().stream().allMatch(v -> Double.isFinite(v) && v >= MIN_SCORE && v <= MAX_SCORE);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return value;
        }
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, value));
    }
}
