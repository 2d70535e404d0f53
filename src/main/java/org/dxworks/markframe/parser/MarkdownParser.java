package org.dxworks.markframe.parser;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.markframe.model.Mark;
import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.model.NodeAttrs;
import org.dxworks.markframe.model.NodeType;
import org.dxworks.markframe.model.SyntaxType;
import org.dxworks.markframe.region.RegionScanner;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Syntax-preserving Markdown parser. Delimiters stay in the tree as {@code syntax_marker}
 * runs, so the text of every paragraph equals its source line.
 * <p>
 * Blocks are recognized line by line in a fixed priority order: fenced code, single-line math,
 * math block, container, heading, image, horizontal rule, blockquote, task list, bullet list,
 * ordered list, table, HTML block and finally a paragraph per line. Malformed constructs never
 * fail the parse; they fall back to the next rule.
 */
public class MarkdownParser {

    private static final Logger logger = LogManager.getLogger(MarkdownParser.class);

    private final InlineParser inlineParser = new InlineParser();
    private final ListParser listParser = new ListParser(this);
    private final TableParser tableParser = new TableParser(inlineParser);

    public ParseResult parse(String markdown) {
        String normalized = markdown == null ? "" : markdown.replace("\r\n", "\n").replace('\r', '\n');
        List<String> lines = Arrays.asList(normalized.split("\n", -1));

        List<Node> blocks = parseBlocks(lines);
        Node doc = Node.doc(blocks.isEmpty() ? List.of(emptyParagraph()) : blocks);
        logger.debug("Parsed {} lines into {} top-level blocks", lines.size(), doc.childCount());
        return new ParseResult(doc, RegionScanner.findSyntaxMarkerRegions(doc));
    }

    static Node emptyParagraph() {
        return Node.block(NodeType.PARAGRAPH, List.of());
    }

    List<Node> parseBlocks(List<String> lines) {
        List<Node> blocks = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            if (lines.get(i).isBlank()) {
                int blankCount = 0;
                while (i < lines.size() && lines.get(i).isBlank()) {
                    blankCount++;
                    i++;
                }
                // the first blank line separates blocks, the rest are kept as empty paragraphs
                int extra = blocks.isEmpty() ? blankCount : blankCount - 1;
                for (int j = 0; j < extra; j++) {
                    // the empty string after a trailing newline is not a blank line
                    if (i >= lines.size() && j == extra - 1) {
                        break;
                    }
                    blocks.add(emptyParagraph());
                }
                continue;
            }

            BlockResult result = parseBlock(lines, i);
            blocks.add(result.getNode());
            i = result.getEndIndex() + 1;
        }
        return blocks;
    }

    private BlockResult parseBlock(List<String> lines, int i) {
        String line = lines.get(i);

        if (BlockPatterns.CODE_BLOCK_START.matcher(line).matches()) {
            BlockResult codeBlock = parseCodeBlock(lines, i);
            if (codeBlock != null) {
                return codeBlock;
            }
            logger.debug("Unterminated code fence at line {}, falling back", i + 1);
        }

        Matcher mathInline = BlockPatterns.MATH_BLOCK_INLINE.matcher(line);
        if (mathInline.matches()) {
            return new BlockResult(textblock(NodeType.MATH_BLOCK, Map.of(), mathInline.group(1)), i);
        }
        if (BlockPatterns.MATH_BLOCK_DELIMITER.matcher(line).matches()) {
            return parseMathBlock(lines, i);
        }

        Matcher container = BlockPatterns.CONTAINER_START.matcher(line);
        if (container.matches()) {
            return parseContainer(lines, i, container);
        }

        Matcher heading = BlockPatterns.HEADING.matcher(line);
        if (heading.matches()) {
            return new BlockResult(parseHeading(line, heading), i);
        }

        Matcher image = BlockPatterns.IMAGE.matcher(line);
        if (image.matches()) {
            return new BlockResult(Node.leaf(NodeType.IMAGE, imageAttrs(image)), i);
        }

        if (BlockPatterns.HORIZONTAL_RULE.matcher(line).matches()) {
            return new BlockResult(Node.leaf(NodeType.HORIZONTAL_RULE, Map.of()), i);
        }

        if (BlockPatterns.BLOCKQUOTE.matcher(line).matches()) {
            return parseBlockquote(lines, i);
        }
        if (BlockPatterns.TASK_ITEM.matcher(line).matches()) {
            return listParser.parseTaskList(lines, i, inlineParser);
        }
        if (BlockPatterns.BULLET_LIST.matcher(line).matches()) {
            return listParser.parseBulletList(lines, i);
        }
        if (BlockPatterns.ORDERED_LIST.matcher(line).matches()) {
            return listParser.parseOrderedList(lines, i);
        }

        if (BlockPatterns.TABLE_ROW.matcher(line).matches()) {
            BlockResult table = tableParser.parse(lines, i);
            if (table != null) {
                return table;
            }
        }

        Matcher html = BlockPatterns.HTML_BLOCK_START.matcher(line);
        if (html.lookingAt()) {
            return parseHtmlBlock(lines, i, html.group(1));
        }

        return new BlockResult(paragraph(line), i);
    }

    Node paragraph(String line) {
        return Node.block(NodeType.PARAGRAPH, inlineParser.parse(line));
    }

    /**
     * A fenced code block, or {@code null} when no closing fence follows. Inner fences that carry
     * an info string open a nested level closed by the next bare fence.
     */
    private BlockResult parseCodeBlock(List<String> lines, int startIndex) {
        Matcher opener = BlockPatterns.CODE_BLOCK_START.matcher(lines.get(startIndex));
        if (!opener.matches()) {
            return null;
        }
        int fenceIndent = opener.group(1).length();
        String language = opener.group(2);

        List<String> content = new ArrayList<>();
        int nested = 0;
        int endIndex = startIndex + 1;
        while (endIndex < lines.size()) {
            String line = lines.get(endIndex);
            boolean isEnd = BlockPatterns.CODE_BLOCK_END.matcher(line).matches();
            boolean isStart = !isEnd && BlockPatterns.CODE_BLOCK_START.matcher(line).matches();
            if (isStart) {
                nested++;
            } else if (isEnd) {
                if (nested == 0) {
                    break;
                }
                nested--;
            }
            content.add(fenceIndent > 0 && line.length() >= fenceIndent ? line.substring(fenceIndent) : line);
            endIndex++;
        }

        if (endIndex >= lines.size()) {
            return null;
        }
        return new BlockResult(textblock(NodeType.CODE_BLOCK, Map.of(NodeAttrs.LANGUAGE, language),
                String.join("\n", content)), endIndex);
    }

    /** Lines up to the closing {@code $$}, or to the end of input when there is none. */
    private BlockResult parseMathBlock(List<String> lines, int startIndex) {
        List<String> content = new ArrayList<>();
        int endIndex = startIndex + 1;
        while (endIndex < lines.size() && !BlockPatterns.MATH_BLOCK_DELIMITER.matcher(lines.get(endIndex)).matches()) {
            content.add(lines.get(endIndex));
            endIndex++;
        }
        return new BlockResult(textblock(NodeType.MATH_BLOCK, Map.of(), String.join("\n", content)), endIndex);
    }

    private BlockResult parseContainer(List<String> lines, int startIndex, Matcher opener) {
        List<String> content = new ArrayList<>();
        int endIndex = startIndex + 1;
        while (endIndex < lines.size() && !BlockPatterns.CONTAINER_END.matcher(lines.get(endIndex)).matches()) {
            content.add(lines.get(endIndex));
            endIndex++;
        }

        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put(NodeAttrs.CONTAINER_TYPE, opener.group(1));
        attrs.put(NodeAttrs.CONTAINER_TITLE, opener.group(2) == null ? "" : opener.group(2));
        return new BlockResult(Node.block(NodeType.CONTAINER, attrs, parseBlocks(content)), endIndex);
    }

    private Node parseHeading(String line, Matcher heading) {
        String hashes = heading.group(1);
        String content = heading.group(2);
        String separator = line.substring(hashes.length(), line.length() - content.length());

        List<Node> runs = new ArrayList<>();
        runs.add(Node.text(hashes, List.of(Mark.syntax(SyntaxType.HEADING))));
        runs.add(Node.text(separator));
        runs.addAll(inlineParser.parse(content));
        return Node.block(NodeType.HEADING, Map.of(NodeAttrs.LEVEL, hashes.length()), runs);
    }

    static Map<String, Object> imageAttrs(Matcher image) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put(NodeAttrs.SRC, image.group(2));
        attrs.put(NodeAttrs.ALT, image.group(1));
        attrs.put(NodeAttrs.TITLE, image.group(3) == null ? "" : image.group(3));
        return attrs;
    }

    /**
     * Consecutive quote lines. A blank line continues the quote only when a quote line follows.
     * Inner paragraphs get their {@code "> "} prefix back as a syntax-marker run.
     */
    private BlockResult parseBlockquote(List<String> lines, int startIndex) {
        List<String> content = new ArrayList<>();
        int endIndex = startIndex;
        while (endIndex < lines.size()) {
            String line = lines.get(endIndex);
            if (line.isBlank()) {
                if (endIndex + 1 < lines.size() && BlockPatterns.BLOCKQUOTE.matcher(lines.get(endIndex + 1)).matches()) {
                    content.add("");
                    endIndex++;
                    continue;
                }
                break;
            }
            Matcher m = BlockPatterns.BLOCKQUOTE.matcher(line);
            if (!m.matches()) {
                break;
            }
            content.add(m.group(1));
            endIndex++;
        }

        List<Node> quoted = new ArrayList<>();
        for (Node block : parseBlocks(content)) {
            if (block.getType() == NodeType.PARAGRAPH) {
                List<Node> runs = new ArrayList<>();
                runs.add(Node.text("> ", List.of(Mark.syntax(SyntaxType.BLOCKQUOTE))));
                runs.addAll(block.getChildren());
                quoted.add(block.withChildren(runs));
            } else {
                quoted.add(block);
            }
        }
        Node blockquote = Node.block(NodeType.BLOCKQUOTE, quoted.isEmpty() ? List.of(emptyParagraph()) : quoted);
        return new BlockResult(blockquote, endIndex - 1);
    }

    /**
     * Raw HTML. Void elements, self-closed tags and tags closed on the same line are one line;
     * otherwise same-name open and close tags are counted until they balance. Without a balancing
     * close tag the block runs to the end of input.
     */
    private BlockResult parseHtmlBlock(List<String> lines, int startIndex, String tagName) {
        String startLine = lines.get(startIndex);
        Pattern closeTag = Pattern.compile("</" + Pattern.quote(tagName) + "\\s*>", Pattern.CASE_INSENSITIVE);

        if (BlockPatterns.VOID_ELEMENTS.contains(tagName.toLowerCase())
                || startLine.stripTrailing().endsWith("/>")
                || closeTag.matcher(startLine).find()) {
            return new BlockResult(textblock(NodeType.HTML_BLOCK, Map.of(), startLine), startIndex);
        }

        Pattern openTag = Pattern.compile("<" + Pattern.quote(tagName) + "[\\s>/]", Pattern.CASE_INSENSITIVE);
        List<String> content = new ArrayList<>();
        content.add(startLine);
        int depth = 1;
        int endIndex = startIndex + 1;
        while (endIndex < lines.size()) {
            String line = lines.get(endIndex);
            content.add(line);
            if (openTag.matcher(line).find()) {
                depth++;
            }
            if (closeTag.matcher(line).find()) {
                depth--;
                if (depth <= 0) {
                    break;
                }
            }
            endIndex++;
        }
        if (depth > 0) {
            logger.debug("Unbalanced <{}> at line {}, HTML block runs to end of input", tagName, startIndex + 1);
        }
        return new BlockResult(textblock(NodeType.HTML_BLOCK, Map.of(), String.join("\n", content)), endIndex);
    }

    private static Node textblock(NodeType type, Map<String, Object> attrs, String content) {
        List<Node> runs = content.isEmpty() ? List.of() : List.of(Node.text(content));
        return Node.block(type, attrs, runs);
    }
}
