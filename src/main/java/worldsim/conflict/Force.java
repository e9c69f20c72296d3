package worldsim.conflict;

import java.util.List;
import java.util.Objects;

/**
 * One side's army in a battle.
 * <p>
 * Morale inputs ({@code training}, {@code equipment}, {@code supplies},
 * {@code veteranRatio}) are fractions in {@code [0, 1]}. {@code preparation} only
 * counts when the force defends.
 */
public record Force(
        String factionId,
        Commander commander,
        List<Unit> units,
        UnitType type,
        double training,
        double equipment,
        double supplies,
        double collectiveFrequency,
        double veteranRatio,
        double preparation
) {

    public Force {
        Objects.requireNonNull(factionId, "Force faction cannot be null");
        Objects.requireNonNull(commander, "Force commander cannot be null");
        units = units == null ? List.of() : List.copyOf(units);
        type = type == null ? UnitType.INFANTRY : type;
    }

    /**
     * Head count across all units; casualty ratios apply to this number.
     */
    public long totalStrength() {
        return units.stream().mapToLong(Unit::quantity).sum();
    }
}
