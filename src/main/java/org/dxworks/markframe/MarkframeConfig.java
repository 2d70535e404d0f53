package org.dxworks.markframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class MarkframeConfig {

    private static final Logger logger = LogManager.getLogger(MarkframeConfig.class);

    public static final String CONFIG_FILE_NAME = "markframe-config.yml";
    private static final boolean DEFAULT_INITIAL_SOURCE_VIEW = false;
    private static final boolean DEFAULT_RENDER_INLINE_MATH = true;
    private static final boolean DEFAULT_PARSE_MARKDOWN_ON_PASTE = true;

    private final boolean initialSourceView;
    private final boolean renderInlineMath;
    private final boolean parseMarkdownOnPaste;

    private MarkframeConfig(boolean initialSourceView, boolean renderInlineMath, boolean parseMarkdownOnPaste) {
        this.initialSourceView = initialSourceView;
        this.renderInlineMath = renderInlineMath;
        this.parseMarkdownOnPaste = parseMarkdownOnPaste;
    }

    /** Whether a new session starts in source view. */
    public boolean isInitialSourceView() {
        return initialSourceView;
    }

    /** Whether inline math is replaced by rendered widgets when the cursor is elsewhere. */
    public boolean isRenderInlineMath() {
        return renderInlineMath;
    }

    /** Whether pasted plain text containing Markdown is parsed into blocks. */
    public boolean isParseMarkdownOnPaste() {
        return parseMarkdownOnPaste;
    }

    public static MarkframeConfig defaults() {
        return new MarkframeConfig(DEFAULT_INITIAL_SOURCE_VIEW, DEFAULT_RENDER_INLINE_MATH, DEFAULT_PARSE_MARKDOWN_ON_PASTE);
    }

    /** Loads {@value #CONFIG_FILE_NAME} from the working directory. */
    public static MarkframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static MarkframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                boolean effectiveInitialSourceView = yamlConfig.initialSourceView != null
                        ? yamlConfig.initialSourceView
                        : DEFAULT_INITIAL_SOURCE_VIEW;
                boolean effectiveRenderInlineMath = yamlConfig.renderInlineMath != null
                        ? yamlConfig.renderInlineMath
                        : DEFAULT_RENDER_INLINE_MATH;
                boolean effectiveParseOnPaste = yamlConfig.parseMarkdownOnPaste != null
                        ? yamlConfig.parseMarkdownOnPaste
                        : DEFAULT_PARSE_MARKDOWN_ON_PASTE;

                return new MarkframeConfig(effectiveInitialSourceView, effectiveRenderInlineMath, effectiveParseOnPaste);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static MarkframeConfig with(boolean initialSourceView, boolean renderInlineMath, boolean parseMarkdownOnPaste) {
        return new MarkframeConfig(initialSourceView, renderInlineMath, parseMarkdownOnPaste);
    }

    private static class YamlConfig {
        public Boolean initialSourceView;
        public Boolean renderInlineMath;
        public Boolean parseMarkdownOnPaste;
    }
}
