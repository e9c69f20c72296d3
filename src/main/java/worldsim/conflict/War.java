package worldsim.conflict;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * State of one war. Immutable; the engine replaces it on every update.
 *
 * @param momentum  signed advantage, positive favours the attackers, within {@code [-100, 100]}
 * @param outcome   set once the war is concluded
 */
public record War(
        String id,
        List<String> attackers,
        List<String> defenders,
        String cause,
        List<WarGoal> goals,
        WarPhase phase,
        long startTurn,
        Long endTurn,
        double momentum,
        double attackerExhaustion,
        double defenderExhaustion,
        Casualties casualties,
        List<String> battleIds,
        WarOutcome outcome
) {

    public static final double MOMENTUM_LIMIT = 100.0;

    public War {
        Objects.requireNonNull(id, "War id cannot be null");
        attackers = List.copyOf(attackers);
        defenders = List.copyOf(defenders);
        goals = goals == null ? List.of() : List.copyOf(goals);
        phase = phase == null ? WarPhase.DECLARED : phase;
        casualties = casualties == null ? Casualties.NONE : casualties;
        battleIds = battleIds == null ? List.of() : List.copyOf(battleIds);
    }

    public double exhaustion(Side side) {
        return side == Side.ATTACKERS ? attackerExhaustion : defenderExhaustion;
    }

    public List<String> belligerents(Side side) {
        return side == Side.ATTACKERS ? attackers : defenders;
    }

    @JsonIgnore
    public boolean isConcluded() {
        return phase == WarPhase.CONCLUDED;
    }

    /**
     * @throws IllegalStateException if {@code next} is not the immediate successor of the current phase
     */
    public War advanceTo(WarPhase next) {
        if (!phase.canAdvanceTo(next)) {
            throw new IllegalStateException("War " + id + " cannot move from " + phase + " to " + next);
        }
        return new War(id, attackers, defenders, cause, goals, next, startTurn, endTurn, momentum,
                attackerExhaustion, defenderExhaustion, casualties, battleIds, outcome);
    }

    public War withMomentum(double updated) {
        return new War(id, attackers, defenders, cause, goals, phase, startTurn, endTurn, updated,
                attackerExhaustion, defenderExhaustion, casualties, battleIds, outcome);
    }

    public War withExhaustion(double attackers, double defenders) {
        return new War(id, this.attackers, this.defenders, cause, goals, phase, startTurn, endTurn, momentum,
                attackers, defenders, casualties, battleIds, outcome);
    }

    public War withBattle(String battleId, Casualties battleCasualties) {
        List<String> updated = new ArrayList<>(battleIds);
        updated.add(battleId);
        return new War(id, attackers, defenders, cause, goals, phase, startTurn, endTurn, momentum,
                attackerExhaustion, defenderExhaustion, casualties.plus(battleCasualties), updated, outcome);
    }

    /**
     * Final record of a war leaving {@code RESOLUTION}. Exhaustion is clamped to
     * {@code [0, limit]} for the archive.
     */
    War concluded(WarOutcome victor, long turn, double exhaustionLimit) {
        if (phase != WarPhase.RESOLUTION) {
            throw new IllegalStateException("War " + id + " must be in RESOLUTION to conclude, but is " + phase);
        }
        return new War(id, attackers, defenders, cause, goals, WarPhase.CONCLUDED, startTurn, turn, momentum,
                clamp(attackerExhaustion, exhaustionLimit), clamp(defenderExhaustion, exhaustionLimit),
                casualties, battleIds, victor);
    }

    private static double clamp(double value, double limit) {
        return Math.max(0.0, Math.min(limit, value));
    }
}
