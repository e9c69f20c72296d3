package worldsim.resolution;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class StochasticResolverTest {

    private StochasticResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new StochasticResolver(new Random(42L)); // Fixed seed for deterministic tests
    }

    @Test
    void shouldThrowExceptionForNullRandom() {
        assertThrows(IllegalArgumentException.class, () -> new StochasticResolver(null));
    }

    @Test
    void shouldConvergeToWeightProportions() {
        // Given
        List<String> candidates = List.of("a", "b", "c");
        Map<String, Double> weights = Map.of("a", 5.0, "b", 3.0, "c", 2.0);
        Map<String, Integer> counts = new HashMap<>();
        int draws = 10_000;

        // When
        for (int i = 0; i < draws; i++) {
            counts.merge(resolver.select(candidates, weights::get), 1, Integer::sum);
        }

        // Then
        assertEquals(0.50, counts.get("a") / (double) draws, 0.03);
        assertEquals(0.30, counts.get("b") / (double) draws, 0.03);
        assertEquals(0.20, counts.get("c") / (double) draws, 0.03);
    }

    @Test
    void shouldNeverSelectZeroWeightCandidateBeforeLast() {
        // Given
        List<String> candidates = List.of("never", "always");

        // When / Then
        for (int i = 0; i < 1000; i++) {
            assertEquals("always", resolver.select(candidates, c -> c.equals("never") ? 0.0 : 1.0));
        }
    }

    @Test
    void shouldRejectEmptyCandidatesAndNegativeWeights() {
        assertThrows(IllegalArgumentException.class, () -> resolver.select(List.of(), c -> 1.0));
        assertThrows(IllegalArgumentException.class, () -> resolver.select(List.of("x"), c -> -1.0));
        assertThrows(IllegalArgumentException.class, () -> resolver.select(List.of("x"), c -> Double.NaN));
    }

    @Test
    void shouldEvaluateSkillCheckWithModifiers() {
        // When
        SkillCheck check = resolver.skillCheck(15, List.of(3), 15);

        // Then
        assertEquals(15, check.roll());
        assertEquals(18, check.total());
        assertTrue(check.success());
        assertFalse(check.critical());
        assertEquals(3, check.margin());
    }

    @Test
    void shouldTreatNaturalTwentyAsCriticalRegardlessOfDifficulty() {
        // When
        SkillCheck check = resolver.skillCheck(20, List.of(-5), 30);

        // Then
        assertTrue(check.critical());
        assertFalse(check.success());
        assertEquals(15, check.total());
    }

    @Test
    void shouldRollWithinDieRange() {
        for (int i = 0; i < 1000; i++) {
            int roll = resolver.rollD20();
            assertTrue(roll >= 1 && roll <= 20, "roll out of range: " + roll);
        }
    }

    @Test
    void shouldRejectRollOutsideDie() {
        assertThrows(IllegalArgumentException.class, () -> SkillCheck.of(0, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> SkillCheck.of(21, 0, 10));
    }

    @Test
    void shouldProduceSameSequenceForSameSeed() {
        // Given
        StochasticResolver first = StochasticResolver.seeded(123L);
        StochasticResolver second = StochasticResolver.seeded(123L);

        // When / Then
        for (int i = 0; i < 100; i++) {
            assertEquals(first.rollD20(), second.rollD20());
        }
    }

    @Test
    void shouldComputeAbilityModifiers() {
        assertEquals(0, StochasticResolver.abilityModifier(10));
        assertEquals(0, StochasticResolver.abilityModifier(11));
        assertEquals(2, StochasticResolver.abilityModifier(14));
        assertEquals(-1, StochasticResolver.abilityModifier(9));
        assertEquals(-4, StochasticResolver.abilityModifier(3));
        assertEquals(5, StochasticResolver.abilityModifier(20));
    }

    @Test
    void shouldNeverSucceedChanceWithZeroProbability() {
        for (int i = 0; i < 100; i++) {
            assertFalse(resolver.chance(0.0));
            assertTrue(resolver.chance(1.0));
        }
    }
}
