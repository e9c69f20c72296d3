package worldsim.conflict;

/**
 * Where a battle is fought. Civilian casualties only occur at population centers.
 */
public record Location(String nodeId, Terrain terrain, boolean populationCenter, long population) {

    public Location {
        terrain = terrain == null ? Terrain.OPEN : terrain;
        population = Math.max(0, population);
    }

    public static Location field(String nodeId, Terrain terrain) {
        return new Location(nodeId, terrain, false, 0);
    }
}
