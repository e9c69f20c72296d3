package worldsim.world;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A political body that can wage war. Immutable; updates return copies.
 *
 * @param economy             abstract economic output, never negative
 * @param militaryStrength    fighting strength used for war momentum, never negative
 * @param collectiveFrequency collective consciousness scalar shifted by war outcomes
 * @param stability           internal stability in {@code [0, 100]}
 * @param territories         node ids this faction controls
 * @param resources           resource names this faction controls
 * @param relations           opinion of other factions, keyed by faction id
 */
public record Faction(
        String id,
        String name,
        double economy,
        double militaryStrength,
        double collectiveFrequency,
        double stability,
        Set<String> territories,
        Set<String> resources,
        Map<String, Relation> relations
) {

    public static final double MAX_STABILITY = 100.0;

    public Faction {
        Objects.requireNonNull(id, "Faction id cannot be null");
        economy = Math.max(0, economy);
        militaryStrength = Math.max(0, militaryStrength);
        stability = Math.max(0, Math.min(MAX_STABILITY, stability));
        territories = territories == null ? Set.of() : Set.copyOf(territories);
        resources = resources == null ? Set.of() : Set.copyOf(resources);
        relations = relations == null ? Map.of() : Map.copyOf(relations);
    }

    public static Faction of(String id, double militaryStrength) {
        return new Faction(id, id, 100, militaryStrength, 7, 50, Set.of(), Set.of(), Map.of());
    }

    public Relation relationTo(String factionId) {
        return relations.getOrDefault(factionId, Relation.NEUTRAL);
    }

    public Faction withEconomy(double updated) {
        return new Faction(id, name, updated, militaryStrength, collectiveFrequency, stability, territories, resources, relations);
    }

    public Faction withMilitaryStrength(double updated) {
        return new Faction(id, name, economy, updated, collectiveFrequency, stability, territories, resources, relations);
    }

    public Faction withCollectiveFrequency(double updated) {
        return new Faction(id, name, economy, militaryStrength, updated, stability, territories, resources, relations);
    }

    public Faction withStability(double updated) {
        return new Faction(id, name, economy, militaryStrength, collectiveFrequency, updated, territories, resources, relations);
    }

    public Faction withTerritories(Set<String> updated) {
        return new Faction(id, name, economy, militaryStrength, collectiveFrequency, stability, updated, resources, relations);
    }

    public Faction withTerritory(String territory) {
        Set<String> updated = new LinkedHashSet<>(territories);
        updated.add(territory);
        return withTerritories(updated);
    }

    public Faction withoutTerritory(String territory) {
        Set<String> updated = new LinkedHashSet<>(territories);
        updated.remove(territory);
        return withTerritories(updated);
    }

    public Faction withRelation(String factionId, Relation relation) {
        Map<String, Relation> updated = new LinkedHashMap<>(relations);
        updated.put(factionId, relation);
        return new Faction(id, name, economy, militaryStrength, collectiveFrequency, stability, territories, resources, updated);
    }
}
