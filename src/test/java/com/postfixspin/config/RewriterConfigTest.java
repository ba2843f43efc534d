package com.postfixspin.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RewriterConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        RewriterConfig config = RewriterConfig.defaults();

        assertNotNull(config);
        assertEquals(Constants.DEFAULT_MAX_REWRITES, config.getMaxRewrites());
        assertEquals(Constants.DEFAULT_MAX_PASSES, config.getMaxPasses());
        assertEquals(Constants.DEFAULT_MAX_DEPTH, config.getMaxDepth());
        assertTrue(config.isWrapCompoundOperands());
    }

    @Test
    void testSetters() {
        RewriterConfig config = new RewriterConfig();

        config.setMaxRewrites(5);
        config.setMaxPasses(3);
        config.setMaxDepth(8);
        config.setWrapCompoundOperands(false);

        assertEquals(5, config.getMaxRewrites());
        assertEquals(3, config.getMaxPasses());
        assertEquals(8, config.getMaxDepth());
        assertFalse(config.isWrapCompoundOperands());
    }

    @Test
    void testLoadPartialJsonKeepsDefaults() throws IOException {
        Path file = tempDir.resolve("spin.json");
        Files.writeString(file, "{\"maxRewrites\": 12, \"wrapCompoundOperands\": false}");

        RewriterConfig config = RewriterConfig.load(file);

        assertEquals(12, config.getMaxRewrites());
        assertEquals(Constants.DEFAULT_MAX_PASSES, config.getMaxPasses());
        assertFalse(config.isWrapCompoundOperands());
    }

    @Test
    void testLoadRejectsUnknownField() throws IOException {
        Path file = tempDir.resolve("typo.json");
        Files.writeString(file, "{\"maxRewrite\": 12}");

        assertThrows(IOException.class, () -> RewriterConfig.load(file));
    }
}
