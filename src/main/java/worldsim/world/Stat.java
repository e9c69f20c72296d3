package worldsim.world;

/**
 * Derived, bounded per-entity scores.
 */
public enum Stat {
    ENERGY,
    HEALTH,
    MOOD
}
