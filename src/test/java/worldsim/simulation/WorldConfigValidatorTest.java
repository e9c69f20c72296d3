package worldsim.simulation;

import org.junit.jupiter.api.Test;
import worldsim.WorldFixtures;
import worldsim.world.Entity;
import worldsim.world.Interaction;
import worldsim.world.Node;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorldConfigValidatorTest {

    @Test
    void shouldAcceptWellFormedWorld() {
        assertTrue(WorldConfigValidator.problems(WorldFixtures.village()).isEmpty());
        assertDoesNotThrow(() -> WorldConfigValidator.validate(WorldFixtures.villageWithFestival()));
    }

    @Test
    void shouldReportMissingSections() {
        List<String> problems = WorldConfigValidator.problems(
                new WorldConfig("", List.of(), List.of(), List.of(), List.of(), List.of()));

        assertTrue(problems.contains("world name is required"));
        assertTrue(problems.contains("at least one node is required"));
        assertTrue(problems.contains("at least one character is required"));
        assertTrue(problems.contains("at least one interaction is required"));
        assertEquals(List.of("world configuration is missing"), WorldConfigValidator.problems(null));
    }

    @Test
    void shouldReportDanglingReferences() {
        // Given
        Node camp = new Node("camp", "Camp", "wild", 0, false, Map.of(), List.of("ghost"));
        Entity dana = Entity.builder("dana", "Dana").interactions("dance").build();
        List<Node> nodes = List.of(WorldFixtures.nodes().get(0), camp);
        WorldConfig config = new WorldConfig("village", nodes, List.of(dana), List.of(WorldFixtures.chat()),
                List.of(), List.of());

        // When
        List<String> problems = WorldConfigValidator.problems(config);

        // Then
        assertTrue(problems.contains("node camp references unknown character ghost"));
        assertTrue(problems.contains("node square references unknown character ana"));
        assertTrue(problems.contains("character dana references unknown interaction dance"));
    }

    @Test
    void shouldRejectNodesWithoutCharactersAndInteractionsWithoutBranches() {
        // Given
        Node empty = new Node("ruins", "Ruins", "wild", 0, false, Map.of(), List.of());
        Interaction idle = new Interaction("idle", "Idle", "action", List.of(), List.of(), 0, true, null, null);
        List<Node> nodes = List.of(WorldFixtures.nodes().get(0), WorldFixtures.nodes().get(1), empty);
        WorldConfig config = new WorldConfig("village", nodes, WorldFixtures.characters(),
                List.of(WorldFixtures.chat(), WorldFixtures.gather(), idle), WorldFixtures.factions(), List.of());

        // When
        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> WorldConfigValidator.validate(config));

        // Then
        assertEquals(List.of("node ruins has no assigned characters", "interaction idle has no branches"),
                error.problems());
    }

    @Test
    void shouldRejectDuplicateIds() {
        List<Entity> twins = List.of(
                Entity.builder("ana", "Ana").interactions("chat").build(),
                Entity.builder("ana", "Ana again").interactions("chat").build());
        WorldConfig config = new WorldConfig("village", WorldFixtures.nodes(), twins,
                List.of(WorldFixtures.chat()), List.of(), List.of());

        assertTrue(WorldConfigValidator.problems(config).contains("duplicate character id ana"));
    }

    @Test
    void shouldRejectCoherenceOutsideUnitRange() {
        List<Entity> characters = List.of(
                Entity.builder("ana", "Ana").interactions("chat").coherence(1.5).build(),
                Entity.builder("bo", "Bo").interactions("chat").build(),
                Entity.builder("cy", "Cy").interactions("chat").build());
        WorldConfig config = new WorldConfig("village", WorldFixtures.nodes(), characters,
                List.of(WorldFixtures.chat()), List.of(), List.of());

        assertEquals(List.of("character ana coherence must be between 0 and 1"), WorldConfigValidator.problems(config));
    }
}
