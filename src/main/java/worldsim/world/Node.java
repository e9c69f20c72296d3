package worldsim.world;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An abstract location. Nodes carry no spatial coordinates; entities are attached to
 * them by assignment.
 */
public record Node(
        String id,
        String name,
        String type,
        long population,
        boolean populationCenter,
        Map<String, Double> resourceAvailability,
        List<String> assignedCharacters
) {

    public Node {
        Objects.requireNonNull(id, "Node id cannot be null");
        population = Math.max(0, population);
        resourceAvailability = resourceAvailability == null ? Map.of() : Map.copyOf(resourceAvailability);
        assignedCharacters = assignedCharacters == null ? List.of() : List.copyOf(assignedCharacters);
    }

    public static Node of(String id, String type, String... characters) {
        return new Node(id, id, type, 0, false, Map.of(), List.of(characters));
    }
}
