package worldsim.conflict;

import java.util.List;

/**
 * A fully resolved battle. Battles are produced in one call and never change afterwards.
 *
 * @param warId war the battle belongs to, or {@code null} for a skirmish outside any war
 */
public record Battle(
        String id,
        String warId,
        long turn,
        Location location,
        String attackerFactionId,
        String defenderFactionId,
        LeadershipCheck attackLeadership,
        LeadershipCheck defenseLeadership,
        double attackMorale,
        double defenseMorale,
        List<BattleRound> rounds,
        BattleOutcome outcome,
        Casualties casualties,
        BattleImpact impact
) {

    public Battle {
        rounds = List.copyOf(rounds);
    }

    public Battle withWarId(String updated) {
        return new Battle(id, updated, turn, location, attackerFactionId, defenderFactionId, attackLeadership,
                defenseLeadership, attackMorale, defenseMorale, rounds, outcome, casualties, impact);
    }
}
