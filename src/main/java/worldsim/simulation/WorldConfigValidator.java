package worldsim.simulation;

import worldsim.encounter.Encounter;
import worldsim.world.Entity;
import worldsim.world.Faction;
import worldsim.world.Interaction;
import worldsim.world.Node;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Checks an authored world before it is turned into state. Every problem is collected so
 * the author sees them all at once.
 */
public final class WorldConfigValidator {

    private WorldConfigValidator() {
    }

    /**
     * @throws ConfigurationException listing every problem found
     */
    public static void validate(WorldConfig config) {
        List<String> problems = problems(config);
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }

    public static List<String> problems(WorldConfig config) {
        List<String> problems = new ArrayList<>();
        if (config == null) {
            problems.add("world configuration is missing");
            return problems;
        }
        if (isBlank(config.name())) {
            problems.add("world name is required");
        }
        if (config.nodes().isEmpty()) {
            problems.add("at least one node is required");
        }
        if (config.characters().isEmpty()) {
            problems.add("at least one character is required");
        }
        if (config.interactions().isEmpty()) {
            problems.add("at least one interaction is required");
        }

        Set<String> characterIds = uniqueIds("character", config.characters(), Entity::id, problems);
        Set<String> interactionIds = uniqueIds("interaction", config.interactions(), Interaction::id, problems);
        uniqueIds("node", config.nodes(), Node::id, problems);
        uniqueIds("faction", config.factions(), Faction::id, problems);
        uniqueIds("encounter", config.encounters(), Encounter::id, problems);

        for (Node node : config.nodes()) {
            String label = "node " + node.id();
            if (isBlank(node.name())) {
                problems.add(label + " has no name");
            }
            if (isBlank(node.type())) {
                problems.add(label + " has no type");
            }
            if (node.assignedCharacters().isEmpty()) {
                problems.add(label + " has no assigned characters");
            }
            for (String characterId : node.assignedCharacters()) {
                if (!characterIds.contains(characterId)) {
                    problems.add(label + " references unknown character " + characterId);
                }
            }
        }

        for (Entity character : config.characters()) {
            String label = "character " + character.id();
            if (isBlank(character.name())) {
                problems.add(label + " has no name");
            }
            if (character.assignedInteractions().isEmpty()) {
                problems.add(label + " has no assigned interactions");
            }
            for (String interactionId : character.assignedInteractions()) {
                if (!interactionIds.contains(interactionId)) {
                    problems.add(label + " references unknown interaction " + interactionId);
                }
            }
            if (!character.isWithinBounds()) {
                problems.add(label + " has values outside their allowed range");
            }
            if (character.coherence() < 0 || character.coherence() > 1) {
                problems.add(label + " coherence must be between 0 and 1");
            }
        }

        for (Interaction interaction : config.interactions()) {
            if (interaction.branches().isEmpty()) {
                problems.add("interaction " + interaction.id() + " has no branches");
            }
        }
        return problems;
    }

    private static <T> Set<String> uniqueIds(String kind, List<T> items, Function<T, String> id, List<String> problems) {
        Set<String> seen = new HashSet<>();
        for (T item : items) {
            String itemId = id.apply(item);
            if (isBlank(itemId)) {
                problems.add(kind + " without id");
            } else if (!seen.add(itemId)) {
                problems.add("duplicate " + kind + " id " + itemId);
            }
        }
        return seen;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
