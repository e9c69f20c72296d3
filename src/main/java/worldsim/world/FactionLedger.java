package worldsim.world;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Mutable working copy of the faction roster used while a turn is being computed.
 * <p>
 * Each turn copies the committed factions into a fresh ledger, so engines may update it
 * freely; the committed world only sees the result once the turn is accepted.
 */
public final class FactionLedger {

    private final Map<String, Faction> factions = new LinkedHashMap<>();

    public FactionLedger(Collection<Faction> initial) {
        for (Faction faction : initial) {
            factions.put(faction.id(), faction);
        }
    }

    public Optional<Faction> find(String factionId) {
        return Optional.ofNullable(factions.get(factionId));
    }

    public Faction get(String factionId) {
        Faction faction = factions.get(factionId);
        if (faction == null) {
            throw new IllegalArgumentException("Unknown faction: " + factionId);
        }
        return faction;
    }

    public boolean contains(String factionId) {
        return factions.containsKey(factionId);
    }

    /**
     * Replaces a faction with the operator's result; unknown ids are ignored.
     */
    public void update(String factionId, UnaryOperator<Faction> change) {
        factions.computeIfPresent(factionId, (id, faction) -> change.apply(faction));
    }

    public double totalMilitaryStrength(Collection<String> factionIds) {
        return factionIds.stream()
                .map(factions::get)
                .filter(Objects::nonNull)
                .mapToDouble(Faction::militaryStrength)
                .sum();
    }

    public List<Faction> toList() {
        return List.copyOf(new ArrayList<>(factions.values()));
    }
}
