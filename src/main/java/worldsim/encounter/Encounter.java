package worldsim.encounter;

import worldsim.world.Branch;
import worldsim.world.Interaction;
import worldsim.world.Requirement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static definition of an encounter plus its trigger bookkeeping.
 * <p>
 * {@code lastTriggered == null} means the encounter has never started, so the cooldown
 * cannot block it.
 *
 * @param duration         encounter turns until the outcome is resolved, at least 1
 * @param nodeRestrictions node ids the encounter may start at; empty means anywhere
 */
public record Encounter(
        String id,
        String name,
        String description,
        EncounterType type,
        Difficulty difficulty,
        int duration,
        Sequencing sequencing,
        List<Trigger> triggers,
        List<Prerequisite> prerequisites,
        List<String> nodeRestrictions,
        List<EncounterOutcome> outcomes,
        int cooldown,
        Long lastTriggered,
        int timesTriggered
) {

    public Encounter {
        Objects.requireNonNull(id, "Encounter id cannot be null");
        name = name == null ? id : name;
        description = description == null ? "" : description;
        type = type == null ? EncounterType.COMBAT : type;
        difficulty = difficulty == null ? Difficulty.MEDIUM : difficulty;
        duration = Math.max(1, duration);
        sequencing = sequencing == null ? Sequencing.SIMULTANEOUS : sequencing;
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        prerequisites = prerequisites == null ? List.of() : List.copyOf(prerequisites);
        nodeRestrictions = nodeRestrictions == null ? List.of() : List.copyOf(nodeRestrictions);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        cooldown = Math.max(0, cooldown);
        timesTriggered = Math.max(0, timesTriggered);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public boolean isOffCooldown(long currentTurn) {
        return cooldown == 0 || lastTriggered == null || currentTurn - lastTriggered >= cooldown;
    }

    public boolean allowsNode(String nodeId) {
        return nodeRestrictions.isEmpty() || nodeRestrictions.contains(nodeId);
    }

    public Encounter markTriggered(long currentTurn) {
        return new Encounter(id, name, description, type, difficulty, duration, sequencing, triggers, prerequisites,
                nodeRestrictions, outcomes, cooldown, currentTurn, timesTriggered + 1);
    }

    /**
     * The base interaction a live instance exposes: one branch per declared outcome,
     * requirements taken from the attribute prerequisites.
     */
    public List<Interaction> generateInteractions() {
        List<Branch> branches = new ArrayList<>();
        for (EncounterOutcome outcome : outcomes) {
            branches.add(new Branch(outcome.id(), outcome.description(), outcome.weight(), outcome.condition(),
                    outcome.effects(), type.checkedAttribute(), difficulty.dc()));
        }
        List<Requirement> requirements = prerequisites.stream()
                .filter(Prerequisite.AttributeAtLeast.class::isInstance)
                .map(Prerequisite.AttributeAtLeast.class::cast)
                .map(prerequisite -> new Requirement(prerequisite.attribute(), prerequisite.value()))
                .toList();
        Interaction base = new Interaction("encounter_" + id + "_base", "Encounter: " + name, "encounter",
                requirements, branches, cooldown, cooldown > 0, null, Set.of());
        return List.of(base);
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String description;
        private EncounterType type = EncounterType.COMBAT;
        private Difficulty difficulty = Difficulty.MEDIUM;
        private int duration = 1;
        private Sequencing sequencing = Sequencing.SIMULTANEOUS;
        private final List<Trigger> triggers = new ArrayList<>();
        private final List<Prerequisite> prerequisites = new ArrayList<>();
        private final List<String> nodeRestrictions = new ArrayList<>();
        private final List<EncounterOutcome> outcomes = new ArrayList<>();
        private int cooldown;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(EncounterType type) {
            this.type = type;
            return this;
        }

        public Builder difficulty(Difficulty difficulty) {
            this.difficulty = difficulty;
            return this;
        }

        public Builder duration(int duration) {
            this.duration = duration;
            return this;
        }

        public Builder sequencing(Sequencing sequencing) {
            this.sequencing = sequencing;
            return this;
        }

        public Builder trigger(Trigger trigger) {
            this.triggers.add(trigger);
            return this;
        }

        public Builder prerequisite(Prerequisite prerequisite) {
            this.prerequisites.add(prerequisite);
            return this;
        }

        public Builder restrictTo(String... nodeIds) {
            this.nodeRestrictions.addAll(List.of(nodeIds));
            return this;
        }

        public Builder outcome(EncounterOutcome outcome) {
            this.outcomes.add(outcome);
            return this;
        }

        public Builder cooldown(int cooldown) {
            this.cooldown = cooldown;
            return this;
        }

        public Encounter build() {
            return new Encounter(id, name, description, type, difficulty, duration, sequencing, triggers,
                    prerequisites, nodeRestrictions, outcomes, cooldown, null, 0);
        }
    }
}
