package worldsim.conflict;

/**
 * Losses per side, split into military and civilian.
 */
public record Casualties(long attackerMilitary, long defenderMilitary, long attackerCivilian, long defenderCivilian) {

    public static final Casualties NONE = new Casualties(0, 0, 0, 0);

    public Casualties plus(Casualties other) {
        return new Casualties(
                attackerMilitary + other.attackerMilitary,
                defenderMilitary + other.defenderMilitary,
                attackerCivilian + other.attackerCivilian,
                defenderCivilian + other.defenderCivilian);
    }

    public long military(Side side) {
        return side == Side.ATTACKERS ? attackerMilitary : defenderMilitary;
    }

    public long total() {
        return attackerMilitary + defenderMilitary + attackerCivilian + defenderCivilian;
    }
}
