package worldsim.simulation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import worldsim.conflict.War;
import worldsim.encounter.Encounter;
import worldsim.encounter.EncounterInstance;
import worldsim.world.Entity;
import worldsim.world.Faction;
import worldsim.world.Interaction;
import worldsim.world.Node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Committed snapshot of the world after a turn.
 * <p>
 * Everything a turn can change lives here, so rejecting a turn only means not replacing
 * the snapshot. Collections keep the order they were authored in; entity updates within a
 * turn follow that order.
 *
 * @param time      turns committed since initialization
 * @param tickDelay advisory pacing in milliseconds, recomputed every turn
 * @param resources world resource pool by name
 */
public record WorldState(
        String worldName,
        long time,
        long tickDelay,
        List<Node> nodes,
        List<Entity> entities,
        List<Interaction> interactions,
        Map<String, Double> resources,
        List<Faction> factions,
        List<War> wars,
        List<Encounter> encounters,
        List<EncounterInstance> activeEncounters
) {

    public WorldState {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        entities = entities == null ? List.of() : List.copyOf(entities);
        interactions = interactions == null ? List.of() : List.copyOf(interactions);
        resources = resources == null ? Map.of() : unmodifiableOrdered(resources);
        factions = factions == null ? List.of() : List.copyOf(factions);
        wars = wars == null ? List.of() : List.copyOf(wars);
        encounters = encounters == null ? List.of() : List.copyOf(encounters);
        activeEncounters = activeEncounters == null ? List.of() : List.copyOf(activeEncounters);
    }

    private static Map<String, Double> unmodifiableOrdered(Map<String, Double> resources) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(resources));
    }

    /**
     * Turn-zero state for a validated configuration. Each character is placed on the node
     * that lists it and the resource pool is the sum of every node's availability.
     */
    public static WorldState initial(WorldConfig config, long tickDelay) {
        Map<String, String> placement = new LinkedHashMap<>();
        Map<String, Double> resources = new LinkedHashMap<>();
        for (Node node : config.nodes()) {
            for (String characterId : node.assignedCharacters()) {
                placement.putIfAbsent(characterId, node.id());
            }
            node.resourceAvailability().forEach((resource, amount) -> resources.merge(resource, amount, Double::sum));
        }
        List<Entity> entities = config.characters().stream()
                .map(character -> character.withNodeId(placement.getOrDefault(character.id(), character.nodeId())))
                .toList();
        return new WorldState(config.name(), 0, tickDelay, config.nodes(), entities, config.interactions(),
                resources, config.factions(), List.of(), config.encounters(), List.of());
    }

    public Optional<Entity> entity(String id) {
        return entities.stream().filter(entity -> entity.id().equals(id)).findFirst();
    }

    public Optional<Node> node(String id) {
        return nodes.stream().filter(node -> node.id().equals(id)).findFirst();
    }

    public Optional<Interaction> interaction(String id) {
        return interactions.stream().filter(interaction -> interaction.id().equals(id)).findFirst();
    }

    public Optional<War> war(String id) {
        return wars.stream().filter(war -> war.id().equals(id)).findFirst();
    }

    public List<Entity> entitiesAt(String nodeId) {
        return entities.stream().filter(entity -> Objects.equals(entity.nodeId(), nodeId)).toList();
    }

    public double resource(String name) {
        Double amount = resources.get(name);
        return amount == null ? 0.0 : amount;
    }

    @JsonIgnore
    public double averageCoherence() {
        return entities.stream().mapToDouble(Entity::coherence).average().orElse(0.0);
    }

    public WorldState withEntities(List<Entity> updated) {
        return new WorldState(worldName, time, tickDelay, nodes, updated, interactions, resources, factions, wars,
                encounters, activeEncounters);
    }

    public WorldState withActiveEncounters(List<EncounterInstance> updated) {
        return new WorldState(worldName, time, tickDelay, nodes, entities, interactions, resources, factions, wars,
                encounters, updated);
    }
}
