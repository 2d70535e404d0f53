package org.dxworks.markframe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MarkframeConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        MarkframeConfig config = MarkframeConfig.load(tempDir.resolve(MarkframeConfig.CONFIG_FILE_NAME));

        assertFalse(config.isInitialSourceView());
        assertTrue(config.isRenderInlineMath());
        assertTrue(config.isParseMarkdownOnPaste());
    }

    @Test
    void readsValuesAndDefaultsTheRest() throws IOException {
        Path file = tempDir.resolve(MarkframeConfig.CONFIG_FILE_NAME);
        Files.writeString(file, "initialSourceView: true\nrenderInlineMath: false\n");

        MarkframeConfig config = MarkframeConfig.load(file);

        assertTrue(config.isInitialSourceView());
        assertFalse(config.isRenderInlineMath());
        assertTrue(config.isParseMarkdownOnPaste());
    }

    @Test
    void unreadableFileFallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve(MarkframeConfig.CONFIG_FILE_NAME);
        Files.writeString(file, "unknownKey: 3\n");

        MarkframeConfig config = MarkframeConfig.load(file);

        assertFalse(config.isInitialSourceView());
        assertTrue(config.isRenderInlineMath());
    }
}
