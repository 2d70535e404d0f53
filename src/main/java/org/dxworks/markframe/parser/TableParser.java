package org.dxworks.markframe.parser;

import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.model.NodeAttrs;
import org.dxworks.markframe.model.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pipe tables: a header row, an alignment separator (directly below or after one blank line)
 * and data rows, which may be separated by blank lines.
 */
final class TableParser {

    private final InlineParser inlineParser;

    TableParser(InlineParser inlineParser) {
        this.inlineParser = inlineParser;
    }

    /** @return the table, or {@code null} when the header has no separator row */
    BlockResult parse(List<String> lines, int startIndex) {
        int separatorIndex = startIndex + 1;
        if (separatorIndex < lines.size() && lines.get(separatorIndex).isBlank()) {
            separatorIndex++;
        }
        if (separatorIndex >= lines.size()
                || !BlockPatterns.TABLE_SEPARATOR.matcher(lines.get(separatorIndex)).matches()) {
            return null;
        }

        List<String> alignments = parseAlignments(lines.get(separatorIndex));
        List<Node> rows = new ArrayList<>();
        rows.add(Node.block(NodeType.TABLE_ROW, parseRow(lines.get(startIndex), NodeType.TABLE_HEADER, alignments)));

        int endIndex = separatorIndex + 1;
        while (endIndex < lines.size()) {
            String line = lines.get(endIndex);
            if (line.isBlank()) {
                endIndex++;
                continue;
            }
            if (!BlockPatterns.TABLE_ROW.matcher(line).matches()) {
                break;
            }
            rows.add(Node.block(NodeType.TABLE_ROW, parseRow(line, NodeType.TABLE_CELL, alignments)));
            endIndex++;
        }
        return new BlockResult(Node.block(NodeType.TABLE, rows), endIndex - 1);
    }

    static List<String> parseAlignments(String separatorLine) {
        List<String> alignments = new ArrayList<>();
        for (String column : splitCells(separatorLine)) {
            String trimmed = column.trim();
            boolean left = trimmed.startsWith(":");
            boolean right = trimmed.endsWith(":");
            if (left && right) {
                alignments.add("center");
            } else if (right) {
                alignments.add("right");
            } else if (left) {
                alignments.add("left");
            } else {
                alignments.add(null);
            }
        }
        return alignments;
    }

    private List<Node> parseRow(String line, NodeType cellType, List<String> alignments) {
        List<Node> cells = new ArrayList<>();
        String[] contents = splitCells(line);
        for (int i = 0; i < contents.length; i++) {
            String align = i < alignments.size() ? alignments.get(i) : null;
            Map<String, Object> attrs = align == null ? Map.of() : Map.of(NodeAttrs.ALIGN, align);
            cells.add(Node.block(cellType, attrs, inlineParser.parse(contents[i].trim())));
        }
        return cells;
    }

    /** Cell texts between the outer pipes; escaped pipes are not special. */
    private static String[] splitCells(String line) {
        String stripped = line.stripTrailing();
        if (stripped.length() < 2) {
            return new String[]{""};
        }
        return stripped.substring(1, stripped.length() - 1).split("\\|", -1);
    }
}
