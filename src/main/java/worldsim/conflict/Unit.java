package worldsim.conflict;

/**
 * A body of troops inside a {@link Force}.
 *
 * @param quantity            head count
 * @param quality             per-soldier fighting value
 * @param equipment           equipment level, scaled by 0.2 in strength
 * @param training            training level, scaled by 0.3 in strength
 * @param collectiveFrequency unit consciousness; above 10 grants a flat 0.2 bonus
 */
public record Unit(long quantity, double quality, double equipment, double training, double collectiveFrequency) {

    public Unit {
        if (quantity < 0) {
            throw new IllegalArgumentException("Unit quantity cannot be negative: " + quantity);
        }
        if (quality < 0) {
            throw new IllegalArgumentException("Unit quality cannot be negative: " + quality);
        }
    }
}
