package worldsim.encounter;

/**
 * Result of starting an encounter: the definition with its trigger bookkeeping updated
 * and the new live instance.
 */
public record EncounterActivation(Encounter encounter, EncounterInstance instance) {
}
