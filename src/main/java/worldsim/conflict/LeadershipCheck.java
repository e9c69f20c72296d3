package worldsim.conflict;

import worldsim.resolution.SkillCheck;

/**
 * @param inspirationalBonus extra damage fraction granted by a high-frequency commander
 */
public record LeadershipCheck(SkillCheck check, Tactics tactics, double inspirationalBonus) {

    public int total() {
        return check.total();
    }
}
