package worldsim.conflict;

/**
 * Consciousness shifts a battle causes for each side and the battlefield itself.
 */
public record BattleImpact(double attackerFrequency, double defenderFrequency, double locationFrequency) {
}
