package org.dxworks.markframe.parser;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Line patterns of the block grammar. All are matched against a single line without its
 * line terminator.
 */
public final class BlockPatterns {

    private BlockPatterns() {
        // utility class
    }

    public static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.*)$");
    public static final Pattern CODE_BLOCK_START = Pattern.compile("^(\\s*)```([^\\s`]*)(.*)$");
    public static final Pattern CODE_BLOCK_END = Pattern.compile("^\\s*```\\s*$");
    public static final Pattern BLOCKQUOTE = Pattern.compile("^>\\s?(.*)$");
    public static final Pattern BULLET_LIST = Pattern.compile("^(\\s*)([-*+])\\s+(.*)$");
    public static final Pattern ORDERED_LIST = Pattern.compile("^(\\s*)(\\d+)\\.\\s+(.*)$");
    public static final Pattern TASK_ITEM = Pattern.compile("^(\\s*)[-*+]\\s+\\[([ xX]?)\\]\\s+(.*)$");
    public static final Pattern HORIZONTAL_RULE = Pattern.compile("^([-*_]){3,}\\s*$");
    public static final Pattern TABLE_ROW = Pattern.compile("^\\|(.+)\\|\\s*$");
    public static final Pattern TABLE_SEPARATOR = Pattern.compile("^\\|[-:\\s|]+\\|\\s*$");
    public static final Pattern MATH_BLOCK_DELIMITER = Pattern.compile("^\\s*\\$\\$\\s*$");
    public static final Pattern MATH_BLOCK_INLINE = Pattern.compile("^\\s*\\$\\$(.+)\\$\\$\\s*$");
    public static final Pattern IMAGE = Pattern.compile("^!\\[([^\\]]*)\\]\\((.+?)(?:\\s+\"([^\"]*)\")?\\)\\s*$");
    public static final Pattern CONTAINER_START = Pattern.compile("^:::(\\w+)(?:\\s+(.*))?$");
    public static final Pattern CONTAINER_END = Pattern.compile("^:::\\s*$");
    public static final Pattern HTML_BLOCK_START = Pattern.compile("^<([a-zA-Z][a-zA-Z0-9]*)");

    /** Items indented at least two columns continue a list item after a blank line. */
    static final Pattern INDENTED_CONTINUATION = Pattern.compile("^\\s{2,}");

    static final Set<String> VOID_ELEMENTS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input",
            "link", "meta", "param", "source", "track", "wbr");
}
