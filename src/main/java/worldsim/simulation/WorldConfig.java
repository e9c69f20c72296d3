package worldsim.simulation;

import worldsim.encounter.Encounter;
import worldsim.world.Entity;
import worldsim.world.Faction;
import worldsim.world.Interaction;
import worldsim.world.Node;

import java.util.List;

/**
 * Authored world handed to {@link TickScheduler#initialize(WorldConfig)}. Validated by
 * {@link WorldConfigValidator} before any state is built from it.
 */
public record WorldConfig(
        String name,
        List<Node> nodes,
        List<Entity> characters,
        List<Interaction> interactions,
        List<Faction> factions,
        List<Encounter> encounters
) {

    public WorldConfig {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        characters = characters == null ? List.of() : List.copyOf(characters);
        interactions = interactions == null ? List.of() : List.copyOf(interactions);
        factions = factions == null ? List.of() : List.copyOf(factions);
        encounters = encounters == null ? List.of() : List.copyOf(encounters);
    }
}
