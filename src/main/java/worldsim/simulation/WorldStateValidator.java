package worldsim.simulation;

import worldsim.conflict.War;
import worldsim.world.Entity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Invariants a candidate state must satisfy before it can be committed.
 */
public class WorldStateValidator {

    private final double exhaustionLimit;

    public WorldStateValidator(double exhaustionLimit) {
        this.exhaustionLimit = exhaustionLimit;
    }

    /**
     * @return every violated invariant; empty when the candidate may be committed
     */
    public List<String> validate(WorldState previous, WorldState candidate) {
        List<String> violations = new ArrayList<>();
        if (candidate.time() < 0) {
            violations.add("time must be non-negative, but was " + candidate.time());
        }
        if (candidate.time() != previous.time() + 1) {
            violations.add("time must advance from " + previous.time() + " to " + (previous.time() + 1)
                    + ", but was " + candidate.time());
        }

        Set<String> nodeIds = new HashSet<>();
        candidate.nodes().forEach(node -> nodeIds.add(node.id()));
        for (Entity entity : candidate.entities()) {
            if (!entity.isWithinBounds()) {
                violations.add("entity " + entity.id() + " is out of bounds");
            }
            if (entity.nodeId() != null && !nodeIds.contains(entity.nodeId())) {
                violations.add("entity " + entity.id() + " is on unknown node " + entity.nodeId());
            }
        }

        for (Map.Entry<String, Double> resource : candidate.resources().entrySet()) {
            Double amount = resource.getValue();
            if (amount == null || !Double.isFinite(amount) || amount < 0) {
                violations.add("resource " + resource.getKey() + " has invalid amount " + amount);
            }
        }

        for (War war : candidate.wars()) {
            if (!Double.isFinite(war.momentum()) || Math.abs(war.momentum()) > War.MOMENTUM_LIMIT) {
                violations.add("war " + war.id() + " momentum out of range: " + war.momentum());
            }
            if (!withinExhaustion(war.attackerExhaustion()) || !withinExhaustion(war.defenderExhaustion())) {
                violations.add("war " + war.id() + " exhaustion out of range");
            }
        }
        return violations;
    }

    private boolean withinExhaustion(double exhaustion) {
        return Double.isFinite(exhaustion) && exhaustion >= 0 && exhaustion <= exhaustionLimit;
    }
}
