package worldsim.simulation;

import worldsim.conflict.Battle;
import worldsim.conflict.War;
import worldsim.encounter.Encounter;
import worldsim.encounter.EncounterInstance;
import worldsim.events.BufferedEventSink;
import worldsim.world.Entity;
import worldsim.world.FactionLedger;
import worldsim.world.Interaction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable copy of a committed {@link WorldState} that one turn works on.
 * <p>
 * Nothing here is visible outside the turn until {@link #toState(long)} produces the
 * candidate snapshot and the scheduler accepts it. Maps keep the committed collection
 * order.
 */
final class TurnWorkspace {

    private final WorldState base;
    private final long turn;
    final Map<String, Entity> entities = new LinkedHashMap<>();
    final Map<String, Interaction> interactions = new LinkedHashMap<>();
    final Map<String, Double> resources;
    final FactionLedger factions;
    final Map<String, War> wars = new LinkedHashMap<>();
    final Map<String, Encounter> encounters = new LinkedHashMap<>();
    final Map<String, EncounterInstance> activeEncounters = new LinkedHashMap<>();

    final BufferedEventSink events = new BufferedEventSink();
    final List<CharacterAction> actions = new ArrayList<>();
    final List<Battle> battles = new ArrayList<>();
    final List<War> concludedWars = new ArrayList<>();
    final List<EncounterInstance> finishedEncounters = new ArrayList<>();
    private int battleSequence = 0;
    private int warSequence = 0;

    TurnWorkspace(WorldState base, long turn) {
        this.base = base;
        this.turn = turn;
        base.entities().forEach(entity -> entities.put(entity.id(), entity));
        base.interactions().forEach(interaction -> interactions.put(interaction.id(), interaction));
        this.resources = new LinkedHashMap<>(base.resources());
        this.factions = new FactionLedger(base.factions());
        base.wars().forEach(war -> wars.put(war.id(), war));
        base.encounters().forEach(encounter -> encounters.put(encounter.id(), encounter));
        base.activeEncounters().forEach(instance -> activeEncounters.put(instance.id(), instance));
    }

    long turn() {
        return turn;
    }

    WorldState base() {
        return base;
    }

    List<String> entityIdsAt(String nodeId) {
        return entities.values().stream()
                .filter(entity -> Objects.equals(entity.nodeId(), nodeId))
                .map(Entity::id)
                .toList();
    }

    boolean hasActiveInstanceOf(String encounterId) {
        return activeEncounters.values().stream().anyMatch(instance -> instance.encounterId().equals(encounterId));
    }

    String nextBattleId() {
        return "battle-" + turn + "-" + (++battleSequence);
    }

    String nextWarId() {
        String id;
        do {
            id = "war-" + turn + "-" + (++warSequence);
        } while (wars.containsKey(id));
        return id;
    }

    WorldState toState(long tickDelay) {
        return new WorldState(base.worldName(), turn, tickDelay, base.nodes(),
                new ArrayList<>(entities.values()),
                new ArrayList<>(interactions.values()),
                resources,
                factions.toList(),
                new ArrayList<>(wars.values()),
                new ArrayList<>(encounters.values()),
                new ArrayList<>(activeEncounters.values()));
    }
}
