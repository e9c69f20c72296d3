package worldsim.simulation;

import org.junit.jupiter.api.Test;
import worldsim.WorldFixtures;
import worldsim.world.Entity;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorldStateValidatorTest {

    private final WorldStateValidator validator = new WorldStateValidator(100.0);
    private final WorldState committed = WorldState.initial(WorldFixtures.village(), 100);

    private static WorldState at(WorldState state, long time, Map<String, Double> resources) {
        return new WorldState(state.worldName(), time, state.tickDelay(), state.nodes(), state.entities(),
                state.interactions(), resources, state.factions(), state.wars(), state.encounters(),
                state.activeEncounters());
    }

    @Test
    void shouldAcceptNextTurn() {
        WorldState candidate = at(committed, 1, committed.resources());

        assertTrue(validator.validate(committed, candidate).isEmpty());
    }

    @Test
    void shouldRequireTimeToAdvanceByOne() {
        assertEquals(1, validator.validate(committed, at(committed, 0, committed.resources())).size());
        assertEquals(1, validator.validate(committed, at(committed, 2, committed.resources())).size());
    }

    @Test
    void shouldRejectInvalidResourceAmounts() {
        // Given
        WorldState candidate = at(committed, 1, Map.of("grain", -1.0, "wood", Double.POSITIVE_INFINITY));

        // When
        List<String> violations = validator.validate(committed, candidate);

        // Then
        assertEquals(2, violations.size());
    }

    @Test
    void shouldRejectEntitiesOutOfBoundsOrOffTheMap() {
        // Given
        Entity lost = Entity.builder("ana", "Ana").nodeId("nowhere").interactions("chat").build();
        Entity broken = Entity.builder("bo", "Bo").nodeId("square").interactions("chat").mood(Double.NaN).build();
        WorldState candidate = at(committed, 1, committed.resources()).withEntities(List.of(lost, broken));

        // When
        List<String> violations = validator.validate(committed, candidate);

        // Then
        assertEquals(2, violations.size());
        assertTrue(violations.stream().anyMatch(violation -> violation.contains("unknown node nowhere")));
        assertTrue(violations.stream().anyMatch(violation -> violation.contains("bo is out of bounds")));
    }
}
