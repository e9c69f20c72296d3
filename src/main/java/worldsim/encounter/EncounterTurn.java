package worldsim.encounter;

import java.util.List;

/**
 * Participant actions of one encounter turn.
 *
 * @param turn       encounter-local turn number, starting at 1
 * @param globalTurn simulation turn it happened in
 */
public record EncounterTurn(int turn, long globalTurn, List<ParticipantAction> actions) {

    public EncounterTurn {
        actions = List.copyOf(actions);
    }
}
