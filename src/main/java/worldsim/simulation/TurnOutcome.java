package worldsim.simulation;

import worldsim.conflict.Battle;
import worldsim.conflict.War;
import worldsim.encounter.EncounterInstance;
import worldsim.events.HistoricalEvent;

import java.util.List;

/**
 * Everything a successfully computed turn produced. Nothing in it is visible to observers
 * until the scheduler commits it.
 */
public record TurnOutcome(
        WorldState state,
        List<CharacterAction> actions,
        List<ResourceDelta> resourceDeltas,
        int significantChanges,
        List<HistoricalEvent> events,
        List<Battle> battles,
        List<War> concludedWars,
        List<EncounterInstance> finishedEncounters
) {

    public TurnOutcome {
        actions = List.copyOf(actions);
        resourceDeltas = List.copyOf(resourceDeltas);
        events = List.copyOf(events);
        battles = List.copyOf(battles);
        concludedWars = List.copyOf(concludedWars);
        finishedEncounters = List.copyOf(finishedEncounters);
    }
}
