package worldsim.conflict;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import worldsim.world.FactionLedger;

/**
 * Objective a war is fought for. Each goal is evaluated on its own.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WarGoal.Territory.class, name = "territory"),
        @JsonSubTypes.Type(value = WarGoal.Resource.class, name = "resource"),
        @JsonSubTypes.Type(value = WarGoal.Political.class, name = "political")
})
public sealed interface WarGoal permits WarGoal.Territory, WarGoal.Resource, WarGoal.Political {

    boolean isAchieved(War war, FactionLedger factions);

    /**
     * Met once any attacker controls the territory (node id).
     */
    record Territory(String territory) implements WarGoal {
        @Override
        public boolean isAchieved(War war, FactionLedger factions) {
            return war.attackers().stream()
                    .flatMap(id -> factions.find(id).stream())
                    .anyMatch(faction -> faction.territories().contains(territory));
        }
    }

    /**
     * Met once any attacker controls the resource.
     */
    record Resource(String resource) implements WarGoal {
        @Override
        public boolean isAchieved(War war, FactionLedger factions) {
            return war.attackers().stream()
                    .flatMap(id -> factions.find(id).stream())
                    .anyMatch(faction -> faction.resources().contains(resource));
        }
    }

    /**
     * Met once the target faction's stability has fallen to the threshold.
     */
    record Political(String targetFactionId, double maxStability) implements WarGoal {
        @Override
        public boolean isAchieved(War war, FactionLedger factions) {
            return factions.find(targetFactionId)
                    .map(faction -> faction.stability() <= maxStability)
                    .orElse(false);
        }
    }
}
