package worldsim.world;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A simulated character.
 * <p>
 * Immutable: every update returns a new instance, so a turn can build its candidate
 * state without touching the committed one. Energy, health and mood are clamped to
 * {@code [MIN_STAT, MAX_STAT]} on construction.
 * <p>
 * {@code frequency} and {@code coherence} are opaque tuning inputs. Coherence (0..1)
 * paces the simulation and biases choices, frequency feeds leadership checks and the
 * collective consciousness used to scale event impacts.
 */
public record Entity(
        String id,
        String name,
        String nodeId,
        Attributes attributes,
        Map<String, Double> skills,
        int level,
        Map<String, String> quests,
        List<String> inventory,
        List<String> goals,
        List<String> assignedInteractions,
        double energy,
        double health,
        double mood,
        String lastInteractionType,
        double frequency,
        double coherence
) {

    public static final double MIN_STAT = 0.0;
    public static final double MAX_STAT = 100.0;

    public Entity {
        Objects.requireNonNull(id, "Entity id cannot be null");
        attributes = attributes == null ? Attributes.defaults() : attributes;
        skills = skills == null ? Map.of() : Map.copyOf(skills);
        level = Math.max(1, level);
        quests = quests == null ? Map.of() : Map.copyOf(quests);
        inventory = inventory == null ? List.of() : List.copyOf(inventory);
        goals = goals == null ? List.of() : List.copyOf(goals);
        assignedInteractions = assignedInteractions == null ? List.of() : List.copyOf(assignedInteractions);
        energy = clampStat(energy);
        health = clampStat(health);
        mood = clampStat(mood);
    }

    public static Builder builder(String id, String name) {
        return new Builder(id, name);
    }

    public double stat(Stat stat) {
        return switch (stat) {
            case ENERGY -> energy;
            case HEALTH -> health;
            case MOOD -> mood;
        };
    }

    public double skill(String skill) {
        Double value = skills.get(skill);
        return value == null ? 0.0 : value;
    }

    public Entity withStat(Stat stat, double value) {
        return switch (stat) {
            case ENERGY -> new Entity(id, name, nodeId, attributes, skills, level, quests, inventory, goals,
                    assignedInteractions, value, health, mood, lastInteractionType, frequency, coherence);
            case HEALTH -> new Entity(id, name, nodeId, attributes, skills, level, quests, inventory, goals,
                    assignedInteractions, energy, value, mood, lastInteractionType, frequency, coherence);
            case MOOD -> new Entity(id, name, nodeId, attributes, skills, level, quests, inventory, goals,
                    assignedInteractions, energy, health, value, lastInteractionType, frequency, coherence);
        };
    }

    public Entity adjustStat(Stat stat, double delta) {
        return withStat(stat, stat(stat) + delta);
    }

    public Entity withAttributes(Attributes updated) {
        return new Entity(id, name, nodeId, updated, skills, level, quests, inventory, goals,
                assignedInteractions, energy, health, mood, lastInteractionType, frequency, coherence);
    }

    public Entity withNodeId(String updated) {
        return new Entity(id, name, updated, attributes, skills, level, quests, inventory, goals,
                assignedInteractions, energy, health, mood, lastInteractionType, frequency, coherence);
    }

    public Entity withLastInteractionType(String updated) {
        return new Entity(id, name, nodeId, attributes, skills, level, quests, inventory, goals,
                assignedInteractions, energy, health, mood, updated, frequency, coherence);
    }

    @JsonIgnore
    public boolean isWithinBounds() {
        return attributes.isWithinBounds()
                && inRange(energy) && inRange(health) && inRange(mood)
                && Double.isFinite(frequency) && Double.isFinite(coherence);
    }

    private static boolean inRange(double value) {
        return Double.isFinite(value) && value >= MIN_STAT && value <= MAX_STAT;
    }

    static double clampStat(double value) {
        if (Double.isNaN(value)) {
            return value;
        }
        return Math.max(MIN_STAT, Math.min(MAX_STAT, value));
    }

    /**
     * Fluent builder with authoring defaults (full energy and health, mood 80,
     * frequency 7, coherence 0.7).
     */
    public static final class Builder {
        private final String id;
        private final String name;
        private String nodeId;
        private Attributes attributes = Attributes.defaults();
        private final Map<String, Double> skills = new LinkedHashMap<>();
        private int level = 1;
        private final Map<String, String> quests = new LinkedHashMap<>();
        private final List<String> inventory = new ArrayList<>();
        private final List<String> goals = new ArrayList<>();
        private final List<String> assignedInteractions = new ArrayList<>();
        private double energy = 100;
        private double health = 100;
        private double mood = 80;
        private String lastInteractionType;
        private double frequency = 7;
        private double coherence = 0.7;

        private Builder(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder attributes(Attributes attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder skill(String skill, double value) {
            this.skills.put(skill, value);
            return this;
        }

        public Builder level(int level) {
            this.level = level;
            return this;
        }

        public Builder quest(String questId, String status) {
            this.quests.put(questId, status);
            return this;
        }

        public Builder item(String itemId) {
            this.inventory.add(itemId);
            return this;
        }

        public Builder goal(String goal) {
            this.goals.add(goal);
            return this;
        }

        public Builder interactions(String... interactionIds) {
            this.assignedInteractions.addAll(List.of(interactionIds));
            return this;
        }

        public Builder energy(double energy) {
            this.energy = energy;
            return this;
        }

        public Builder health(double health) {
            this.health = health;
            return this;
        }

        public Builder mood(double mood) {
            this.mood = mood;
            return this;
        }

        public Builder lastInteractionType(String lastInteractionType) {
            this.lastInteractionType = lastInteractionType;
            return this;
        }

        public Builder frequency(double frequency) {
            this.frequency = frequency;
            return this;
        }

        public Builder coherence(double coherence) {
            this.coherence = coherence;
            return this;
        }

        public Entity build() {
            return new Entity(id, name, nodeId, attributes, skills, level, quests, inventory, goals,
                    assignedInteractions, energy, health, mood, lastInteractionType, frequency, coherence);
        }
    }
}
