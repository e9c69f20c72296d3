package worldsim.encounter;

import worldsim.world.Attributes;

/**
 * Kind of encounter; decides which ability participants check with.
 */
public enum EncounterType {
    COMBAT(Attributes.STRENGTH),
    SOCIAL(Attributes.CHARISMA),
    EXPLORATION(Attributes.WISDOM),
    PUZZLE(Attributes.INTELLIGENCE),
    ENVIRONMENTAL(Attributes.CONSTITUTION);

    private final String checkedAttribute;

    EncounterType(String checkedAttribute) {
        this.checkedAttribute = checkedAttribute;
    }

    public String checkedAttribute() {
        return checkedAttribute;
    }
}
