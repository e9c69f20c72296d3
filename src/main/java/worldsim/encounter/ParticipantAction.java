package worldsim.encounter;

import worldsim.resolution.SkillCheck;

/**
 * @param assist bonus carried over from the previous participant in sequential mode
 */
public record ParticipantAction(String participantId, SkillCheck check, int assist) {

    public boolean success() {
        return check.success();
    }
}
