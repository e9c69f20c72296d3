package worldsim.conflict;

/**
 * Leader whose check sets a force's tactics for the whole battle.
 */
public record Commander(String name, double charisma, double wisdom, double frequency, int warSkill) {
}
