package com.taintgrep.engine;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EngineConfigTest {

    @Test
    void defaults() {
        EngineConfig config = EngineConfig.defaults();

        assertNull(config.getMaxDepth());
        assertTrue(config.isCaseSensitive());
        assertEquals(0.8, config.getSanitizerThreshold());
        assertEquals(100, config.getMaxIterations());
        assertTrue(config.getSensitiveKeywords().isEmpty());
    }

    @Test
    void readsProperties() {
        Properties properties = new Properties();
        properties.setProperty(EngineConfig.MAX_DEPTH, "12");
        properties.setProperty(EngineConfig.CASE_SENSITIVE, "false");
        properties.setProperty(EngineConfig.SANITIZER_THRESHOLD, "0.6");
        properties.setProperty(EngineConfig.MAX_ITERATIONS, " 5 ");
        properties.setProperty(EngineConfig.SENSITIVE_KEYWORDS, "salt, ,pin");

        EngineConfig config = EngineConfig.fromProperties(properties);

        assertEquals(Integer.valueOf(12), config.getMaxDepth());
        assertFalse(config.isCaseSensitive());
        assertEquals(0.6, config.getSanitizerThreshold());
        assertEquals(5, config.getMaxIterations());
        assertEquals(Arrays.asList("salt", "pin"), config.getSensitiveKeywords());
    }

    @Test
    void malformedNumbersAreIgnored() {
        Properties properties = new Properties();
        properties.setProperty(EngineConfig.MAX_DEPTH, "deep");
        properties.setProperty(EngineConfig.SANITIZER_THRESHOLD, "high");

        EngineConfig config = EngineConfig.fromProperties(properties);

        assertNull(config.getMaxDepth());
        assertEquals(0.8, config.getSanitizerThreshold());
    }

    @Test
    void settersValidateRanges() {
        EngineConfig config = EngineConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> config.setMaxDepth(-1));
        assertThrows(IllegalArgumentException.class, () -> config.setSanitizerThreshold(1.5));
        assertThrows(IllegalArgumentException.class, () -> config.setMaxIterations(0));
        assertEquals(Integer.valueOf(0), config.setMaxDepth(0).getMaxDepth());
    }
}
