package worldsim.encounter;

import com.fasterxml.jackson.annotation.JsonIgnore;
import worldsim.world.Interaction;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A running (or archived) encounter.
 *
 * @param elapsedTurns encounter turns advanced so far
 * @param outcome      chosen outcome once completed; {@code null} while active, when
 *                     aborted, or when no outcome was eligible
 * @param endReason    why an aborted instance ended
 */
public record EncounterInstance(
        String id,
        String encounterId,
        long startTurn,
        String nodeId,
        List<String> participants,
        int elapsedTurns,
        int maxTurns,
        EncounterStatus status,
        List<Interaction> generatedInteractions,
        List<EncounterTurn> history,
        EncounterOutcome outcome,
        Long endTurn,
        String endReason
) {

    public EncounterInstance {
        Objects.requireNonNull(id, "Encounter instance id cannot be null");
        participants = participants == null ? List.of() : List.copyOf(participants);
        status = status == null ? EncounterStatus.ACTIVE : status;
        generatedInteractions = generatedInteractions == null ? List.of() : List.copyOf(generatedInteractions);
        history = history == null ? List.of() : List.copyOf(history);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == EncounterStatus.ACTIVE;
    }

    EncounterInstance advanced() {
        return new EncounterInstance(id, encounterId, startTurn, nodeId, participants, elapsedTurns + 1, maxTurns,
                status, generatedInteractions, history, outcome, endTurn, endReason);
    }

    EncounterInstance withTurn(EncounterTurn turn) {
        List<EncounterTurn> updated = new ArrayList<>(history);
        updated.add(turn);
        return new EncounterInstance(id, encounterId, startTurn, nodeId, participants, elapsedTurns, maxTurns,
                status, generatedInteractions, updated, outcome, endTurn, endReason);
    }

    EncounterInstance completed(EncounterOutcome chosen, long turn) {
        return new EncounterInstance(id, encounterId, startTurn, nodeId, participants, elapsedTurns, maxTurns,
                EncounterStatus.COMPLETED, generatedInteractions, history, chosen, turn, null);
    }

    EncounterInstance aborted(long turn, String reason) {
        return new EncounterInstance(id, encounterId, startTurn, nodeId, participants, elapsedTurns, maxTurns,
                EncounterStatus.ABORTED, generatedInteractions, history, null, turn, reason);
    }
}
