package worldsim.conflict;

/**
 * One exchange of a battle. HP values are each side's pool at the start of the round.
 */
public record BattleRound(
        int number,
        double attackerHp,
        double defenderHp,
        double attackerDamage,
        double defenderDamage,
        boolean attackerMoraleBreak,
        boolean defenderMoraleBreak
) {

    public boolean moraleBreak() {
        return attackerMoraleBreak || defenderMoraleBreak;
    }
}
