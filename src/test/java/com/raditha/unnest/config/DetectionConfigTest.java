package com.raditha.unnest.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DetectionConfigTest {

    @Test
    void testPresets() {
        DetectionConfig defaults = DetectionConfig.defaults();
        assertEquals(3, defaults.depthThreshold());
        assertEquals(3, defaults.maxRepairAttempts());
        assertEquals(0.5, defaults.acceptanceConfidence());
        assertEquals(1, defaults.maxPasses());
        assertEquals(200, defaults.suggestionTimeoutMillis());

        assertEquals(2, DetectionConfig.strict().depthThreshold());
        assertEquals(0.7, DetectionConfig.strict().acceptanceConfidence());
        assertEquals(2, DetectionConfig.strict().maxPasses());
        assertEquals(4, DetectionConfig.lenient().depthThreshold());
        assertEquals(0.3, DetectionConfig.lenient().acceptanceConfidence());
    }

    @Test
    void testWithers() {
        DetectionConfig config = DetectionConfig.defaults()
                .withDepthThreshold(5)
                .withMaxRepairAttempts(0)
                .withAcceptanceConfidence(1.0)
                .withMaxPasses(3);

        assertEquals(5, config.depthThreshold());
        assertEquals(0, config.maxRepairAttempts());
        assertEquals(1.0, config.acceptanceConfidence());
        assertEquals(3, config.maxPasses());
        assertEquals(4, config.highSeverityDepth());
    }

    @Test
    void testValidation() {
        DetectionConfig defaults = DetectionConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> defaults.withDepthThreshold(1));
        assertThrows(IllegalArgumentException.class, () -> defaults.withMaxRepairAttempts(-1));
        assertThrows(IllegalArgumentException.class, () -> defaults.withAcceptanceConfidence(1.5));
        assertThrows(IllegalArgumentException.class, () -> defaults.withAcceptanceConfidence(-0.1));
        assertThrows(IllegalArgumentException.class, () -> defaults.withMaxPasses(0));
        assertThrows(IllegalArgumentException.class, () -> new DetectionConfig(3, 3, 0.5, 4, 4, 1, 200));
        assertThrows(IllegalArgumentException.class, () -> new DetectionConfig(3, 3, 0.5, 1, 4, 1, 200));
        assertThrows(IllegalArgumentException.class, () -> new DetectionConfig(3, 3, 0.5, 3, 4, 1, -1));
    }
}
