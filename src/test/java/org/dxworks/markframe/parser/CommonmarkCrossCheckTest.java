package org.dxworks.markframe.parser;

import org.commonmark.ext.gfm.tables.TableCell;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Heading;
import org.commonmark.parser.Parser;
import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.model.NodeAttrs;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Checks block attributes against a CommonMark reference parser for inputs where both grammars agree.
 */
class CommonmarkCrossCheckTest {

    private final Parser reference = Parser.builder()
            .extensions(List.of(TablesExtension.create()))
            .build();
    private final MarkdownParser parser = new MarkdownParser();

    @Test
    void headingLevelsAgree() {
        for (int level = 1; level <= 6; level++) {
            String markdown = "#".repeat(level) + " Title";
            org.commonmark.node.Node heading = reference.parse(markdown).getFirstChild();

            assertEquals(((Heading) heading).getLevel(),
                    parser.parse(markdown).getDocument().child(0).attr(NodeAttrs.LEVEL));
        }
    }

    @Test
    void fencedCodeInfoAndLiteralAgree() {
        String markdown = "```python\ndef f():\n    return 1\n```";
        FencedCodeBlock expected = (FencedCodeBlock) reference.parse(markdown).getFirstChild();
        Node actual = parser.parse(markdown).getDocument().child(0);

        assertEquals(expected.getInfo(), actual.attr(NodeAttrs.LANGUAGE));
        assertEquals(expected.getLiteral().stripTrailing(), actual.textContent());
    }

    @Test
    void tableAlignmentsAgree() {
        String markdown = "| a | b | c | d |\n|:--|--:|:-:|---|\n| 1 | 2 | 3 | 4 |";
        List<String> expected = new ArrayList<>();
        collectAlignments(reference.parse(markdown), expected);

        Node headerRow = parser.parse(markdown).getDocument().child(0).child(0);
        List<String> actual = new ArrayList<>();
        for (Node cell : headerRow.getChildren()) {
            actual.add(cell.stringAttr(NodeAttrs.ALIGN));
        }

        assertEquals(expected.subList(0, 4), actual);
    }

    private static void collectAlignments(org.commonmark.node.Node node, List<String> out) {
        if (node instanceof TableCell cell) {
            out.add(cell.getAlignment() == null ? null : cell.getAlignment().name().toLowerCase(Locale.ROOT));
        }
        for (org.commonmark.node.Node child = node.getFirstChild(); child != null; child = child.getNext()) {
            collectAlignments(child, out);
        }
    }
}
