package org.dxworks.markframe.transform;

import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.model.NodeAttrs;
import org.dxworks.markframe.model.NodeType;
import org.dxworks.markframe.parser.MarkdownParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Pipe tables: one paragraph per row plus the alignment separator after the header. Restoring
 * re-parses the joined lines, so edited cells get their inline syntax back. The group is restored
 * only when the lines parse to exactly one table.
 */
public class TableCodec extends LineGroupCodec {

    private final MarkdownParser parser;

    public TableCodec(MarkdownParser parser) {
        this.parser = parser;
    }

    @Override
    public NodeType blockType() {
        return NodeType.TABLE;
    }

    @Override
    public String groupIdAttr() {
        return NodeAttrs.TABLE_ID;
    }

    @Override
    public String idPrefix() {
        return "tb_";
    }

    @Override
    protected String sourceLines(Node table) {
        List<String> lines = new ArrayList<>();
        for (int rowIndex = 0; rowIndex < table.childCount(); rowIndex++) {
            Node row = table.child(rowIndex);
            StringJoiner cells = new StringJoiner(" | ", "| ", " |");
            StringJoiner separators = new StringJoiner(" | ", "| ", " |");
            for (Node cell : row.getChildren()) {
                cells.add(cell.textContent());
                separators.add(separator(cell.stringAttr(NodeAttrs.ALIGN)));
            }
            lines.add(cells.toString());
            if (rowIndex == 0) {
                lines.add(separators.toString());
            }
        }
        return String.join("\n", lines);
    }

    private static String separator(String align) {
        if (align == null) {
            return "---";
        }
        return switch (align) {
            case "center" -> ":---:";
            case "right" -> "---:";
            case "left" -> ":---";
            default -> "---";
        };
    }

    @Override
    public Optional<Node> restore(List<Node> paragraphs) {
        if (paragraphs.size() < 2) {
            return Optional.empty();
        }
        Node doc = parser.parse(joinLines(paragraphs)).getDocument();
        // lines that no longer belong to the table keep the whole group as paragraphs
        if (doc.childCount() != 1 || doc.child(0).getType() != NodeType.TABLE) {
            return Optional.empty();
        }
        return Optional.of(doc.child(0));
    }
}
