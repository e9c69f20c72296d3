package worldsim.conflict;

import worldsim.events.EventSink;
import worldsim.events.HistoricalEvent;
import worldsim.events.HistoricalEventType;
import worldsim.resolution.SkillCheck;
import worldsim.resolution.StochasticResolver;
import worldsim.world.Faction;
import worldsim.world.FactionLedger;
import worldsim.world.Relation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Wars and battles.
 * <p>
 * A war moves strictly through {@code DECLARED -> ACTIVE -> RESOLUTION -> CONCLUDED}.
 * Battles are resolved in one call from two forces and a location, then folded into the
 * war they belong to through {@link #recordBattle}. The engine keeps no war state of its
 * own: every method takes the current {@link War} and returns its successor, and faction
 * changes go to the caller's {@link FactionLedger}. All randomness comes from the injected
 * {@link StochasticResolver}.
 */
public class ConflictResolutionEngine {

    private static final Logger logger = Logger.getLogger(ConflictResolutionEngine.class.getName());

    static final double INSPIRING_FREQUENCY = 12.0;
    static final double INSPIRATIONAL_BONUS = 0.2;
    static final double HIGH_FREQUENCY_UNIT = 10.0;
    static final double PREPARATION_FACTOR = 0.2;
    static final double VICTOR_FREQUENCY_SHIFT = 0.5;
    static final double LOSER_FREQUENCY_SHIFT = -1.0;
    static final double STALEMATE_FREQUENCY_SHIFT = -0.5;
    static final double DECLARATION_IMPACT = -2.0;
    static final double VICTOR_OPINION_SHIFT = 20.0;
    static final double VICTOR_TRUST_SHIFT = -30.0;
    static final double ECONOMIC_DAMAGE_FACTOR = 0.01;

    private final StochasticResolver resolver;
    private final ConflictConfig config;

    public ConflictResolutionEngine(StochasticResolver resolver) {
        this(resolver, ConflictConfig.defaults());
    }

    public ConflictResolutionEngine(StochasticResolver resolver, ConflictConfig config) {
        if (resolver == null) {
            throw new IllegalArgumentException("Resolver cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        this.resolver = resolver;
        this.config = config;
    }

    public ConflictConfig config() {
        return config;
    }

    // ========== DECLARATION ==========

    /**
     * Opens a war with zero momentum and exhaustion.
     *
     * @throws IllegalArgumentException if either side is empty or the sides share a faction
     */
    public War declareWar(String warId, List<String> attackers, List<String> defenders, String cause,
                          List<WarGoal> goals, long turn, EventSink events) {
        if (warId == null || warId.isBlank()) {
            throw new IllegalArgumentException("War id cannot be blank");
        }
        if (attackers == null || attackers.isEmpty()) {
            throw new IllegalArgumentException("War " + warId + " needs at least one attacker");
        }
        if (defenders == null || defenders.isEmpty()) {
            throw new IllegalArgumentException("War " + warId + " needs at least one defender");
        }
        Set<String> overlap = new HashSet<>(attackers);
        overlap.retainAll(defenders);
        if (!overlap.isEmpty()) {
            throw new IllegalArgumentException("Factions cannot fight on both sides of war " + warId + ": " + overlap);
        }

        War war = new War(warId, attackers, defenders, cause, goals, WarPhase.DECLARED, turn, null,
                0.0, 0.0, 0.0, Casualties.NONE, List.of(), null);

        logger.info(() -> "War " + warId + " declared: " + attackers + " against " + defenders);
        events.publish(new HistoricalEvent(turn, HistoricalEventType.WAR_DECLARED, warId,
                String.join(", ", attackers) + " declared war on " + String.join(", ", defenders)
                        + (cause == null ? "" : " over " + cause),
                DECLARATION_IMPACT));
        return war;
    }

    // ========== BATTLE INPUTS ==========

    /**
     * Sum over units of {@code quantity * quality * (1 + equipment*0.2 + training*0.3 + consciousness)},
     * where the consciousness bonus is 0.2 for units whose collective frequency exceeds 10.
     */
    public double calculateForceStrength(Force force) {
        double total = 0.0;
        for (Unit unit : force.units()) {
            double base = unit.quantity() * unit.quality();
            double equipmentBonus = unit.equipment() * 0.2;
            double trainingBonus = unit.training() * 0.3;
            double consciousnessBonus = unit.collectiveFrequency() > HIGH_FREQUENCY_UNIT ? 0.2 : 0.0;
            total += base * (1 + equipmentBonus + trainingBonus + consciousnessBonus);
        }
        return total;
    }

    /**
     * d20 + CHA mod + WIS mod + {@code floor((frequency - 7) / 3)} + war skill.
     */
    public LeadershipCheck rollLeadershipCheck(Commander commander) {
        return leadershipCheck(resolver.rollD20(), commander);
    }

    LeadershipCheck leadershipCheck(int roll, Commander commander) {
        List<Integer> modifiers = List.of(
                StochasticResolver.abilityModifier(commander.charisma()),
                StochasticResolver.abilityModifier(commander.wisdom()),
                (int) Math.floor((commander.frequency() - 7) / 3.0),
                commander.warSkill());
        // Graded by total only.
        SkillCheck check = resolver.skillCheck(roll, modifiers, 0);
        double inspiration = commander.frequency() > INSPIRING_FREQUENCY ? INSPIRATIONAL_BONUS : 0.0;
        return new LeadershipCheck(check, config.tacticsFor(check.total()), inspiration);
    }

    /**
     * {@code min(1, training*0.3 + equipment*0.2 + supplies*0.2 + frequency/20 + veteranRatio*0.3)}.
     */
    public double calculateMorale(Force force) {
        double base = force.training() * 0.3 + force.equipment() * 0.2 + force.supplies() * 0.2;
        double consciousness = force.collectiveFrequency() / 20.0;
        double veterans = force.veteranRatio() * 0.3;
        return Math.min(1.0, base + consciousness + veterans);
    }

    public double terrainBonus(Location location, Force defender) {
        return location.terrain().defenderBonus(defender.type());
    }

    public double preparationBonus(Force defender) {
        return defender.preparation() * PREPARATION_FACTOR;
    }

    // ========== BATTLE ==========

    /**
     * Resolves a battle between two forces.
     * <p>
     * Each side starts with {@code strength * 100} HP; the defender's pool is scaled by
     * {@code 1 + terrain + preparation}. Rounds continue until a pool is exhausted, a
     * morale break routs a side, or the round cap is reached. The returned battle is not
     * attached to any war; see {@link #recordBattle}.
     */
    public Battle resolveBattle(String battleId, Force attacker, Force defender, Location location,
                                long turn, EventSink events) {
        if (attacker.factionId().equals(defender.factionId())) {
            throw new IllegalArgumentException("Faction " + attacker.factionId() + " cannot fight itself");
        }
        double attackStrength = calculateForceStrength(attacker);
        double defenseStrength = calculateForceStrength(defender);
        LeadershipCheck attackLeadership = rollLeadershipCheck(attacker.commander());
        LeadershipCheck defenseLeadership = rollLeadershipCheck(defender.commander());
        double attackMorale = calculateMorale(attacker);
        double defenseMorale = calculateMorale(defender);
        double defenderAdvantage = terrainBonus(location, defender) + preparationBonus(defender);

        List<BattleRound> rounds = fightRounds(
                attackStrength * 100,
                defenseStrength * 100 * (1 + defenderAdvantage),
                attackLeadership, defenseLeadership, attackMorale, defenseMorale);

        BattleOutcome outcome = determineOutcome(rounds);
        Casualties casualties = calculateCasualties(outcome, attacker, defender, location);
        BattleImpact impact = calculateImpact(outcome, casualties);

        Battle battle = new Battle(battleId, null, turn, location, attacker.factionId(), defender.factionId(),
                attackLeadership, defenseLeadership, attackMorale, defenseMorale, rounds, outcome, casualties, impact);

        logger.fine(() -> "Battle " + battleId + " at " + location.nodeId() + ": " + outcome.victor()
                + " won after " + outcome.roundsFought() + " rounds");
        events.publish(new HistoricalEvent(turn, HistoricalEventType.BATTLE_RESOLVED, battleId,
                describe(battle), impact.locationFrequency()));
        return battle;
    }

    private List<BattleRound> fightRounds(double attackerHp, double defenderHp,
                                          LeadershipCheck attackLeadership, LeadershipCheck defenseLeadership,
                                          double attackMorale, double defenseMorale) {
        List<BattleRound> rounds = new ArrayList<>();
        while (attackerHp > 0 && defenderHp > 0 && rounds.size() < config.maxRounds()) {
            // Each side's blow scales with the opposing pool and the opposing commander's inspiration.
            double attackerDamage = config.roundDamageFraction() * defenderHp * (1 + defenseLeadership.inspirationalBonus())
                    * config.multiplier(attackLeadership.tactics());
            double defenderDamage = config.roundDamageFraction() * attackerHp * (1 + attackLeadership.inspirationalBonus())
                    * config.multiplier(defenseLeadership.tactics());

            boolean attackerBreak = moraleBreaks(attackMorale);
            if (attackerBreak) {
                attackerDamage *= 0.5;
            }
            boolean defenderBreak = moraleBreaks(defenseMorale);
            if (defenderBreak) {
                defenderDamage *= 0.5;
            }

            BattleRound round = new BattleRound(rounds.size() + 1, attackerHp, defenderHp,
                    attackerDamage, defenderDamage, attackerBreak, defenderBreak);
            rounds.add(round);
            attackerHp -= defenderDamage;
            defenderHp -= attackerDamage;

            if (round.moraleBreak()) {
                break;
            }
        }
        return rounds;
    }

    private boolean moraleBreaks(double morale) {
        return morale < config.moraleBreakThreshold() && resolver.chance(config.moraleBreakChance());
    }

    /**
     * The side that dealt more damage in the final round wins; the defender holds on a tie.
     */
    BattleOutcome determineOutcome(List<BattleRound> rounds) {
        if (rounds.isEmpty()) {
            return new BattleOutcome(Side.DEFENDERS, false, 0, false);
        }
        BattleRound last = rounds.get(rounds.size() - 1);
        Side victor = last.attackerDamage() > last.defenderDamage() ? Side.ATTACKERS : Side.DEFENDERS;
        boolean decisive = Math.abs(last.attackerDamage() - last.defenderDamage()) > config.decisiveMargin();
        boolean moraleBreak = rounds.stream().anyMatch(BattleRound::moraleBreak);
        return new BattleOutcome(victor, decisive, rounds.size(), moraleBreak);
    }

    Casualties calculateCasualties(BattleOutcome outcome, Force attacker, Force defender, Location location) {
        double attackerRatio = outcome.victor() == Side.ATTACKERS ? config.winnerCasualtyRatio() : config.loserCasualtyRatio();
        double defenderRatio = outcome.victor() == Side.DEFENDERS ? config.winnerCasualtyRatio() : config.loserCasualtyRatio();
        long attackerMilitary = (long) Math.floor(attacker.totalStrength() * attackerRatio);
        long defenderMilitary = (long) Math.floor(defender.totalStrength() * defenderRatio);

        long civilian = 0;
        if (location.populationCenter()) {
            civilian = (long) Math.floor(location.population() * config.civilianCasualtyRatio());
        }
        return new Casualties(attackerMilitary, defenderMilitary, civilian, civilian);
    }

    BattleImpact calculateImpact(BattleOutcome outcome, Casualties casualties) {
        boolean attackerWon = outcome.victor() == Side.ATTACKERS;
        double locationShift = -Math.min(2.0, casualties.total() / 1000.0);
        return new BattleImpact(
                attackerWon ? VICTOR_FREQUENCY_SHIFT : LOSER_FREQUENCY_SHIFT,
                attackerWon ? LOSER_FREQUENCY_SHIFT : VICTOR_FREQUENCY_SHIFT,
                locationShift);
    }

    /**
     * Folds a resolved battle into its war. A declared war becomes active, the battle's
     * casualties join the war totals, each faction loses military strength equal to its
     * military casualties and has its collective frequency shifted by the battle impact.
     *
     * @throws IllegalArgumentException if the battle's factions are not on opposing sides of the war
     * @throws IllegalStateException    if the war has already moved past {@code ACTIVE}
     */
    public War recordBattle(War war, Battle battle, FactionLedger factions) {
        Side attackerSide = sideOf(war, battle.attackerFactionId());
        Side defenderSide = sideOf(war, battle.defenderFactionId());
        if (attackerSide == null || defenderSide == null || attackerSide == defenderSide) {
            throw new IllegalArgumentException("Battle " + battle.id() + " is not fought between opposing sides of war " + war.id());
        }

        War current = war.phase() == WarPhase.DECLARED ? war.advanceTo(WarPhase.ACTIVE) : war;
        if (current.phase() != WarPhase.ACTIVE) {
            throw new IllegalStateException("War " + war.id() + " is " + war.phase() + " and cannot take battles");
        }

        Casualties battleCasualties = battle.casualties();
        Casualties warCasualties = attackerSide == Side.ATTACKERS
                ? battleCasualties
                : new Casualties(battleCasualties.defenderMilitary(), battleCasualties.attackerMilitary(),
                battleCasualties.defenderCivilian(), battleCasualties.attackerCivilian());

        BattleImpact impact = battle.impact();
        factions.update(battle.attackerFactionId(), faction -> faction
                .withMilitaryStrength(faction.militaryStrength() - battleCasualties.attackerMilitary())
                .withCollectiveFrequency(faction.collectiveFrequency() + impact.attackerFrequency()));
        factions.update(battle.defenderFactionId(), faction -> faction
                .withMilitaryStrength(faction.militaryStrength() - battleCasualties.defenderMilitary())
                .withCollectiveFrequency(faction.collectiveFrequency() + impact.defenderFrequency()));

        return current.withBattle(battle.id(), warCasualties);
    }

    private static Side sideOf(War war, String factionId) {
        if (war.attackers().contains(factionId)) {
            return Side.ATTACKERS;
        }
        if (war.defenders().contains(factionId)) {
            return Side.DEFENDERS;
        }
        return null;
    }

    // ========== PROGRESSION ==========

    /**
     * One scheduler tick of a war: activates a declared war, accrues exhaustion,
     * recomputes momentum from faction strength and ends the war once
     * {@link #shouldEndWar} holds.
     *
     * @throws IllegalStateException if the war is no longer active
     */
    public War updateWar(War war, FactionLedger factions, long turn, EventSink events) {
        War current = war.phase() == WarPhase.DECLARED ? war.advanceTo(WarPhase.ACTIVE) : war;
        if (current.phase() != WarPhase.ACTIVE) {
            throw new IllegalStateException("War " + war.id() + " is " + war.phase() + " and cannot be updated");
        }

        Casualties casualties = current.casualties();
        double attackerExhaustion = current.attackerExhaustion()
                + config.baseExhaustion() + casualties.attackerMilitary() * config.casualtyExhaustionFactor();
        double defenderExhaustion = current.defenderExhaustion()
                + config.baseExhaustion() + casualties.defenderMilitary() * config.casualtyExhaustionFactor();

        current = current
                .withExhaustion(attackerExhaustion, defenderExhaustion)
                .withMomentum(momentum(current, factions));

        if (shouldEndWar(current, factions)) {
            return endWar(current, factions, turn, events);
        }
        return current;
    }

    /**
     * {@code clamp((attackerStrength / defenderStrength - 1) * 50, -100, 100)}. A side with
     * no strength left against a non-empty opponent gives full momentum to the opponent.
     */
    double momentum(War war, FactionLedger factions) {
        double attackerStrength = factions.totalMilitaryStrength(war.attackers());
        double defenderStrength = factions.totalMilitaryStrength(war.defenders());
        if (defenderStrength <= 0) {
            return attackerStrength > 0 ? War.MOMENTUM_LIMIT : 0.0;
        }
        double raw = (attackerStrength / defenderStrength - 1) * 50;
        return Math.max(-War.MOMENTUM_LIMIT, Math.min(War.MOMENTUM_LIMIT, raw));
    }

    /**
     * True when either side is exhausted, momentum is overwhelming, or every war goal is
     * achieved. Each condition alone is enough; a war without goals never ends by goals.
     */
    public boolean shouldEndWar(War war, FactionLedger factions) {
        if (war.attackerExhaustion() > config.exhaustionLimit() || war.defenderExhaustion() > config.exhaustionLimit()) {
            return true;
        }
        if (Math.abs(war.momentum()) > config.momentumEndThreshold()) {
            return true;
        }
        return !war.goals().isEmpty() && war.goals().stream().allMatch(goal -> goal.isAchieved(war, factions));
    }

    /**
     * Concludes an active war and applies its consequences to the factions.
     *
     * @throws IllegalStateException if the war is not active
     */
    public War endWar(War war, FactionLedger factions, long turn, EventSink events) {
        War resolving = war.advanceTo(WarPhase.RESOLUTION);
        WarOutcome outcome = determineVictor(resolving);

        applyEconomicDamage(resolving, factions);
        if (outcome == WarOutcome.STALEMATE) {
            for (String factionId : resolving.attackers()) {
                shiftFrequency(factions, factionId, STALEMATE_FREQUENCY_SHIFT);
            }
            for (String factionId : resolving.defenders()) {
                shiftFrequency(factions, factionId, STALEMATE_FREQUENCY_SHIFT);
            }
        } else {
            Side victor = outcome == WarOutcome.ATTACKERS ? Side.ATTACKERS : Side.DEFENDERS;
            List<String> winners = resolving.belligerents(victor);
            List<String> losers = resolving.belligerents(victor.opponent());
            transferTerritory(resolving, winners, losers, factions);
            for (String winner : winners) {
                for (String loser : losers) {
                    factions.update(winner, faction -> faction.withRelation(loser,
                            faction.relationTo(loser).adjust(VICTOR_OPINION_SHIFT, VICTOR_TRUST_SHIFT)));
                }
                shiftFrequency(factions, winner, VICTOR_FREQUENCY_SHIFT);
            }
            for (String loser : losers) {
                shiftFrequency(factions, loser, LOSER_FREQUENCY_SHIFT);
            }
        }

        War concluded = resolving.concluded(outcome, turn, config.exhaustionLimit());
        logger.info(() -> "War " + war.id() + " concluded at turn " + turn + ": " + outcome);
        events.publish(new HistoricalEvent(turn, HistoricalEventType.WAR_ENDED, war.id(),
                "War " + war.id() + " ended: " + outcome.name().toLowerCase(),
                outcome == WarOutcome.STALEMATE ? STALEMATE_FREQUENCY_SHIFT : 0.0));
        return concluded;
    }

    WarOutcome determineVictor(War war) {
        if (war.momentum() > config.victoryMomentum()) {
            return WarOutcome.ATTACKERS;
        }
        if (war.momentum() < -config.victoryMomentum()) {
            return WarOutcome.DEFENDERS;
        }
        return WarOutcome.STALEMATE;
    }

    private void applyEconomicDamage(War war, FactionLedger factions) {
        for (Side side : Side.values()) {
            double damage = Math.max(0.0, Math.min(1.0, war.exhaustion(side) * ECONOMIC_DAMAGE_FACTOR));
            for (String factionId : war.belligerents(side)) {
                factions.update(factionId, faction -> faction.withEconomy(faction.economy() * (1 - damage)));
            }
        }
    }

    /**
     * Territory goals pass from the losers to the first victor.
     */
    private void transferTerritory(War war, List<String> winners, List<String> losers, FactionLedger factions) {
        String recipient = winners.get(0);
        for (WarGoal goal : war.goals()) {
            if (!(goal instanceof WarGoal.Territory territoryGoal)) {
                continue;
            }
            String territory = territoryGoal.territory();
            for (String loser : losers) {
                factions.update(loser, faction -> faction.withoutTerritory(territory));
            }
            boolean alreadyHeld = winners.stream()
                    .flatMap(id -> factions.find(id).stream())
                    .anyMatch(faction -> faction.territories().contains(territory));
            if (!alreadyHeld) {
                factions.update(recipient, faction -> faction.withTerritory(territory));
            }
        }
    }

    private static void shiftFrequency(FactionLedger factions, String factionId, double shift) {
        factions.update(factionId, faction -> faction.withCollectiveFrequency(faction.collectiveFrequency() + shift));
    }

    // ========== DIPLOMACY AND POLITICS ==========

    /**
     * Shifts how {@code fromFactionId} regards {@code toFactionId}.
     *
     * @throws IllegalArgumentException if either faction is unknown
     */
    public Relation adjustRelation(FactionLedger factions, String fromFactionId, String toFactionId,
                                   double opinionDelta, double trustDelta) {
        Faction from = factions.get(fromFactionId);
        factions.get(toFactionId);
        Relation updated = from.relationTo(toFactionId).adjust(opinionDelta, trustDelta);
        factions.update(fromFactionId, faction -> faction.withRelation(toFactionId, updated));
        return updated;
    }

    /**
     * @throws IllegalArgumentException if the faction is unknown
     */
    public double adjustStability(FactionLedger factions, String factionId, double delta) {
        Faction faction = factions.get(factionId);
        Faction updated = faction.withStability(faction.stability() + delta);
        factions.update(factionId, ignored -> updated);
        return updated.stability();
    }

    private static String describe(Battle battle) {
        BattleOutcome outcome = battle.outcome();
        String winner = outcome.victor() == Side.ATTACKERS ? battle.attackerFactionId() : battle.defenderFactionId();
        return String.format("%s won %s battle at %s after %d rounds%s",
                winner,
                outcome.decisive() ? "a decisive" : "a",
                battle.location().nodeId(),
                outcome.roundsFought(),
                outcome.moraleBreak() ? " (rout)" : "");
    }
}
