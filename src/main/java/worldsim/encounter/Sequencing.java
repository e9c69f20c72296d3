package worldsim.encounter;

/**
 * How participants act within one encounter turn.
 * <p>
 * {@code SEQUENTIAL} processes participants strictly in their listed order and lets a
 * participant build on the one before. {@code SIMULTANEOUS} computes every action
 * independently, so no ordering is guaranteed or needed.
 */
public enum Sequencing {
    SEQUENTIAL,
    SIMULTANEOUS
}
