package worldsim.conflict;

/**
 * Quality of a commander's plan, decided once per battle by a leadership check.
 */
public enum Tactics {
    BRILLIANT,
    COMPETENT,
    POOR
}
