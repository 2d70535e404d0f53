package org.dxworks.markframe.parser;

import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.model.NodeAttrs;
import org.dxworks.markframe.model.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bullet, ordered and task lists. Item bodies are handed back to the block parser, so an item
 * may hold code blocks, quotes or further lists.
 */
final class ListParser {

    private static final String FENCE = "```";

    private enum ListKind {
        BULLET(NodeType.BULLET_LIST, BlockPatterns.BULLET_LIST),
        ORDERED(NodeType.ORDERED_LIST, BlockPatterns.ORDERED_LIST);

        private final NodeType nodeType;
        private final Pattern pattern;

        ListKind(NodeType nodeType, Pattern pattern) {
            this.nodeType = nodeType;
            this.pattern = pattern;
        }

        /** Column where continuation lines of an item start. */
        int continuationIndent(int indent, String marker) {
            return this == ORDERED ? indent + marker.length() + 2 : indent + 2;
        }
    }

    private final MarkdownParser blockParser;

    ListParser(MarkdownParser blockParser) {
        this.blockParser = blockParser;
    }

    BlockResult parseBulletList(List<String> lines, int startIndex) {
        return parseList(lines, startIndex, ListKind.BULLET);
    }

    BlockResult parseOrderedList(List<String> lines, int startIndex) {
        return parseList(lines, startIndex, ListKind.ORDERED);
    }

    private BlockResult parseList(List<String> lines, int startIndex, ListKind kind) {
        List<Node> items = new ArrayList<>();
        int endIndex = startIndex;
        int baseIndent = -1;
        int start = 1;

        while (endIndex < lines.size()) {
            String line = lines.get(endIndex);

            if (line.isBlank()) {
                if (endIndex + 1 < lines.size()) {
                    Matcher next = kind.pattern.matcher(lines.get(endIndex + 1));
                    if (next.matches() && (baseIndent == -1 || next.group(1).length() == baseIndent)) {
                        endIndex++;
                        continue;
                    }
                }
                break;
            }

            Matcher m = kind.pattern.matcher(line);
            if (!m.matches()) {
                break;
            }

            int indent = m.group(1).length();
            if (baseIndent == -1) {
                baseIndent = indent;
                if (kind == ListKind.ORDERED) {
                    start = parseStart(m.group(2));
                }
            }
            if (indent != baseIndent) {
                break;
            }

            String firstLine = m.group(3);
            List<String> itemLines = new ArrayList<>();
            itemLines.add(firstLine);
            int itemIndent = kind.continuationIndent(indent, m.group(2));
            int itemEnd = endIndex + 1;
            boolean inCodeBlock = firstLine.trim().startsWith(FENCE);

            while (itemEnd < lines.size()) {
                String next = lines.get(itemEnd);
                if (next.trim().startsWith(FENCE)) {
                    inCodeBlock = !inCodeBlock;
                }

                if (next.isBlank()) {
                    if (!inCodeBlock && itemEnd + 1 < lines.size()) {
                        String afterBlank = lines.get(itemEnd + 1);
                        if (kind.pattern.matcher(afterBlank).matches()
                                || !BlockPatterns.INDENTED_CONTINUATION.matcher(afterBlank).lookingAt()) {
                            break;
                        }
                    }
                    itemLines.add("");
                    itemEnd++;
                    continue;
                }

                if (!inCodeBlock && kind.pattern.matcher(next).matches()) {
                    break;
                }

                int lineIndent = leadingWhitespace(next);
                if (lineIndent >= itemIndent || inCodeBlock || next.trim().startsWith(FENCE)) {
                    itemLines.add(next.substring(Math.min(lineIndent, itemIndent)));
                    itemEnd++;
                } else {
                    break;
                }
            }

            List<Node> body = blockParser.parseBlocks(itemLines);
            items.add(Node.block(NodeType.LIST_ITEM, body.isEmpty() ? List.of(MarkdownParser.emptyParagraph()) : body));
            endIndex = itemEnd;
        }

        if (items.isEmpty()) {
            items.add(Node.block(NodeType.LIST_ITEM, List.of(MarkdownParser.emptyParagraph())));
        }
        Map<String, Object> attrs = kind == ListKind.ORDERED ? Map.of(NodeAttrs.START, start) : Map.of();
        return new BlockResult(Node.block(kind.nodeType, attrs, items), endIndex - 1);
    }

    /** Consecutive task items; a blank line or any other line ends the list. */
    BlockResult parseTaskList(List<String> lines, int startIndex, InlineParser inlineParser) {
        List<Node> items = new ArrayList<>();
        int endIndex = startIndex;

        while (endIndex < lines.size()) {
            String line = lines.get(endIndex);
            if (line.isBlank()) {
                break;
            }
            Matcher m = BlockPatterns.TASK_ITEM.matcher(line);
            if (!m.matches()) {
                break;
            }
            boolean checked = m.group(2).equalsIgnoreCase("x");
            Node paragraph = Node.block(NodeType.PARAGRAPH, inlineParser.parse(m.group(3)));
            items.add(Node.block(NodeType.TASK_ITEM, Map.of(NodeAttrs.CHECKED, checked), List.of(paragraph)));
            endIndex++;
        }

        if (items.isEmpty()) {
            items.add(Node.block(NodeType.TASK_ITEM, Map.of(NodeAttrs.CHECKED, false),
                    List.of(MarkdownParser.emptyParagraph())));
        }
        return new BlockResult(Node.block(NodeType.TASK_LIST, items), endIndex - 1);
    }

    private static int parseStart(String digits) {
        // clamped to int range
        if (digits.length() > 9) {
            return Integer.MAX_VALUE;
        }
        return Integer.parseInt(digits);
    }

    static int leadingWhitespace(String line) {
        int count = 0;
        while (count < line.length() && Character.isWhitespace(line.charAt(count))) {
            count++;
        }
        return count;
    }
}
