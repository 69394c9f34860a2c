package org.dxworks.cobolframe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CobolframeConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        CobolframeConfig config = CobolframeConfig.load(tempDir.resolve("absent.yml"));

        assertTrue(config.isStructuralParserEnabled());
        assertEquals(64, config.getParallelThreshold());
    }

    @Test
    void readsStructuralParserAndThreshold() throws Exception {
        Path file = tempDir.resolve("cobolframe-config.yml");
        Files.writeString(file, "structuralParser: NONE\nparallelThreshold: 8\nunknownKey: ignored\n");

        CobolframeConfig config = CobolframeConfig.load(file);

        assertFalse(config.isStructuralParserEnabled());
        assertEquals(8, config.getParallelThreshold());
    }

    @Test
    void nonPositiveThresholdFallsBackToDefault() throws Exception {
        Path file = tempDir.resolve("cobolframe-config.yml");
        Files.writeString(file, "structuralParser: auto\nparallelThreshold: 0\n");

        CobolframeConfig config = CobolframeConfig.load(file);

        assertTrue(config.isStructuralParserEnabled());
        assertEquals(64, config.getParallelThreshold());
    }

    @Test
    void malformedFileGivesDefaults() throws Exception {
        Path file = tempDir.resolve("cobolframe-config.yml");
        Files.writeString(file, "structuralParser: [unclosed\n");

        CobolframeConfig config = CobolframeConfig.load(file);

        assertTrue(config.isStructuralParserEnabled());
        assertEquals(64, config.getParallelThreshold());
    }
}
