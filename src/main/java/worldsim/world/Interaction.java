package worldsim.world;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Authored interaction an entity can perform at a node.
 * <p>
 * The engine only ever changes {@code lastUsed}, through {@link #markUsed(long)}.
 * {@code lastUsed == null} means the interaction has never been used.
 *
 * @param nodeTypes node types the interaction is offered at; empty means every node
 */
public record Interaction(
        String id,
        String name,
        String type,
        List<Requirement> requirements,
        List<Branch> branches,
        int cooldown,
        boolean repeatable,
        Long lastUsed,
        Set<String> nodeTypes
) {

    public Interaction {
        Objects.requireNonNull(id, "Interaction id cannot be null");
        type = type == null || type.isBlank() ? "dialogue" : type;
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        branches = branches == null ? List.of() : List.copyOf(branches);
        cooldown = Math.max(0, cooldown);
        nodeTypes = nodeTypes == null ? Set.of() : Set.copyOf(nodeTypes);
    }

    public static Interaction of(String id, String type, int cooldown, boolean repeatable, Branch... branches) {
        return new Interaction(id, id, type, List.of(), List.of(branches), cooldown, repeatable, null, Set.of());
    }

    /**
     * Usable when repeatable, never used, or when the cooldown has elapsed since the last use.
     */
    public boolean isAvailable(long currentTurn) {
        return repeatable || lastUsed == null || currentTurn - lastUsed >= cooldown;
    }

    public boolean meetsRequirements(Entity entity) {
        return requirements.stream().allMatch(requirement -> requirement.isMetBy(entity));
    }

    public boolean isOfferedAt(Node node) {
        return nodeTypes.isEmpty() || (node != null && nodeTypes.contains(node.type()));
    }

    public Interaction markUsed(long currentTurn) {
        return new Interaction(id, name, type, requirements, branches, cooldown, repeatable, currentTurn, nodeTypes);
    }

    public Interaction withRequirements(List<Requirement> updated) {
        return new Interaction(id, name, type, updated, branches, cooldown, repeatable, lastUsed, nodeTypes);
    }
}
