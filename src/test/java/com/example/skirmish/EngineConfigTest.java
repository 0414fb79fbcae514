package com.example.skirmish;

import com.example.skirmish.config.EngineConfig;
import com.example.skirmish.config.TurnOrderPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Engine configuration tests")
class EngineConfigTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty("skirmish.max-steps");
        System.clearProperty("skirmish.turn-order");
        System.clearProperty("skirmish.critical-multiplier");
        System.clearProperty("skirmish.morale-enabled");
    }

    @Test
    @DisplayName("Built-in defaults")
    void defaults() {
        EngineConfig config = EngineConfig.defaults();
        assertEquals(64, config.getMaxSteps());
        assertEquals(TurnOrderPolicy.ROSTER, config.getTurnOrder());
        assertTrue(config.isMoraleEnabled());
        assertEquals(1.5, config.getCriticalMultiplier(), 0.0001);
        assertTrue(config.isAutoAssignOppositionAi());
    }

    @Test
    @DisplayName("Bundled resource matches the defaults")
    void bundledResource() {
        EngineConfig config = EngineConfig.load();
        assertEquals(64, config.getMaxSteps());
        assertEquals(TurnOrderPolicy.ROSTER, config.getTurnOrder());
        assertTrue(config.isMoraleEnabled());
    }

    @Test
    @DisplayName("Missing resource falls back to defaults")
    void missingResource() {
        EngineConfig config = EngineConfig.load("/no-such-config.yaml");
        assertEquals(EngineConfig.DEFAULT_MAX_STEPS, config.getMaxSteps());
    }

    @Test
    @DisplayName("System properties override the resource")
    void systemPropertyOverrides() {
        System.setProperty("skirmish.max-steps", "200");
        System.setProperty("skirmish.turn-order", "initiative");
        System.setProperty("skirmish.morale-enabled", "false");

        EngineConfig config = EngineConfig.load();
        assertEquals(200, config.getMaxSteps());
        assertEquals(TurnOrderPolicy.INITIATIVE, config.getTurnOrder());
        assertFalse(config.isMoraleEnabled());
    }

    @Test
    @DisplayName("Malformed values are rejected")
    void malformedValues() {
        System.setProperty("skirmish.max-steps", "lots");
        assertThrows(IllegalArgumentException.class, EngineConfig::load);

        System.setProperty("skirmish.max-steps", "0");
        assertThrows(IllegalArgumentException.class, EngineConfig::load);

        System.clearProperty("skirmish.max-steps");
        System.setProperty("skirmish.turn-order", "sideways");
        assertThrows(IllegalArgumentException.class, EngineConfig::load);

        System.clearProperty("skirmish.turn-order");
        System.setProperty("skirmish.critical-multiplier", "0.5");
        assertThrows(IllegalArgumentException.class, EngineConfig::load);
    }

    @Test
    void testWithersLeaveOriginalUnchanged() {
        EngineConfig base = EngineConfig.defaults();
        EngineConfig changed = base.withMaxSteps(10).withTurnOrder(TurnOrderPolicy.INITIATIVE)
                .withMoraleEnabled(false).withAutoAssignOppositionAi(false);

        assertEquals(10, changed.getMaxSteps());
        assertEquals(TurnOrderPolicy.INITIATIVE, changed.getTurnOrder());
        assertFalse(changed.isMoraleEnabled());
        assertFalse(changed.isAutoAssignOppositionAi());
        assertEquals(64, base.getMaxSteps());
        assertThrows(IllegalArgumentException.class, () -> base.withMaxSteps(0));
    }
}
