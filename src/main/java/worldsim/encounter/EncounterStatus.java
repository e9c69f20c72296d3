package worldsim.encounter;

public enum EncounterStatus {
    ACTIVE,
    COMPLETED,
    ABORTED
}
