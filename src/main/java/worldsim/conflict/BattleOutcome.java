package worldsim.conflict;

/**
 * @param victor      side that dealt more damage in the final round
 * @param decisive    final-round damage margin exceeded the configured threshold
 * @param moraleBreak a morale break happened in any round
 */
public record BattleOutcome(Side victor, boolean decisive, int roundsFought, boolean moraleBreak) {

    public Side loser() {
        return victor.opponent();
    }
}
