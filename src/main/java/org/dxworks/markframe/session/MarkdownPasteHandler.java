package org.dxworks.markframe.session;

import org.dxworks.markframe.MarkframeConfig;
import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.parser.MarkdownParser;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns pasted plain text into blocks when it looks like Markdown. Anything it declines is left to
 * the view's default paste, which inserts the text literally.
 */
public class MarkdownPasteHandler {

    private static final List<Pattern> MARKDOWN_HINTS = List.of(
            Pattern.compile("^#{1,6}\\s", Pattern.MULTILINE),
            Pattern.compile("\\*\\*[^*]+\\*\\*"),
            Pattern.compile("\\*[^*]+\\*"),
            Pattern.compile("~~[^~]+~~"),
            Pattern.compile("`[^`]+`"),
            Pattern.compile("^```", Pattern.MULTILINE),
            Pattern.compile("\\[[^\\]]+\\]\\([^)]*\\)"),
            Pattern.compile("!\\[[^\\]]*\\]\\([^)]+\\)"),
            Pattern.compile("^>\\s?", Pattern.MULTILINE),
            Pattern.compile("^[-*+]\\s", Pattern.MULTILINE),
            Pattern.compile("^\\d+\\.\\s", Pattern.MULTILINE),
            Pattern.compile("^[-*_]{3,}\\s*$", Pattern.MULTILINE),
            Pattern.compile("==[^=]+=="),
            Pattern.compile("^\\s*\\$\\$", Pattern.MULTILINE),
            Pattern.compile("\\$[^$]+\\$"),
            Pattern.compile("^- \\[[ xX]\\]", Pattern.MULTILINE),
            Pattern.compile("^\\|.+\\|$", Pattern.MULTILINE));

    private final MarkdownParser parser;
    private final boolean enabled;

    public MarkdownPasteHandler(MarkdownParser parser, MarkframeConfig config) {
        this.parser = parser;
        this.enabled = config.isParseMarkdownOnPaste();
    }

    /**
     * @param internalCopy whether the clipboard content was copied from the editor itself
     * @return the blocks to insert, or empty to let the default paste handle the text
     */
    public Optional<List<Node>> handlePaste(String text, boolean sourceView, boolean internalCopy) {
        if (!enabled || sourceView || internalCopy || text == null || text.isEmpty()) {
            return Optional.empty();
        }
        if (!containsMarkdownSyntax(text)) {
            return Optional.empty();
        }
        Node doc = parser.parse(text).getDocument();
        return doc.childCount() == 0 ? Optional.empty() : Optional.of(doc.getChildren());
    }

    public static boolean containsMarkdownSyntax(String text) {
        return MARKDOWN_HINTS.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }
}
