package worldsim.conflict;

/**
 * Battlefield terrain and the bonus it grants a defender of each unit type.
 */
public enum Terrain {
    MOUNTAINS(0.3, -0.2, 0.1),
    FOREST(0.2, -0.3, 0.2),
    PLAINS(0.0, 0.2, -0.1),
    RIVER(0.1, -0.1, 0.1),
    OPEN(0.0, 0.0, 0.0);

    private final double infantry;
    private final double cavalry;
    private final double archers;

    Terrain(double infantry, double cavalry, double archers) {
        this.infantry = infantry;
        this.cavalry = cavalry;
        this.archers = archers;
    }

    public double defenderBonus(UnitType type) {
        if (type == null) {
            return 0.0;
        }
        return switch (type) {
            case INFANTRY -> infantry;
            case CAVALRY -> cavalry;
            case ARCHERS -> archers;
        };
    }
}
