package worldsim.conflict;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConflictConfigTest {

    @Test
    void shouldMapLeadershipToTactics() {
        ConflictConfig config = ConflictConfig.defaults();

        assertEquals(Tactics.BRILLIANT, config.tacticsFor(15));
        assertEquals(Tactics.COMPETENT, config.tacticsFor(10));
        assertEquals(Tactics.POOR, config.tacticsFor(9));
        assertEquals(1.5, config.multiplier(Tactics.BRILLIANT));
        assertEquals(0.7, config.multiplier(Tactics.POOR));
    }

    @Test
    void shouldApplyCustomThresholdsAndRatios() {
        ConflictConfig config = ConflictConfig.builder()
                .tacticThresholds(18, 12)
                .casualtyRatios(0.5, 0.1)
                .build();

        assertEquals(Tactics.COMPETENT, config.tacticsFor(17));
        assertEquals(Tactics.POOR, config.tacticsFor(11));
        assertEquals(0.5, config.loserCasualtyRatio());
        assertEquals(0.1, config.winnerCasualtyRatio());
    }

    @Test
    void shouldRejectInconsistentSettings() {
        assertThrows(IllegalArgumentException.class, () -> ConflictConfig.builder().maxRounds(0).build());
        assertThrows(IllegalArgumentException.class, () -> ConflictConfig.builder().moraleBreakChance(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> ConflictConfig.builder().tacticThresholds(10, 15).build());
        assertThrows(IllegalArgumentException.class, () -> ConflictConfig.builder().casualtyRatios(1.2, 0.2).build());
        assertThrows(IllegalArgumentException.class, () -> ConflictConfig.builder().roundDamageFraction(0).build());
        assertThrows(IllegalArgumentException.class, () -> ConflictConfig.builder().exhaustionLimit(0).build());
        assertThrows(IllegalArgumentException.class, () -> ConflictConfig.builder().victoryMomentum(150).build());
    }
}
