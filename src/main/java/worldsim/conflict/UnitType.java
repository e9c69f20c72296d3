package worldsim.conflict;

public enum UnitType {
    INFANTRY,
    CAVALRY,
    ARCHERS
}
