package org.dxworks.markframe.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    private static Node sampleDoc() {
        return Node.doc(List.of(
                Node.block(NodeType.PARAGRAPH, List.of(Node.text("hello"))),
                Node.block(NodeType.HEADING, Map.of(NodeAttrs.LEVEL, 1), List.of(Node.text("x")))));
    }

    @Test
    void sizesFollowEditorPositions() {
        Node doc = sampleDoc();

        assertEquals(10, doc.contentSize());
        assertEquals(7, doc.child(0).nodeSize());
        assertEquals(1, Node.leaf(NodeType.IMAGE, Map.of()).nodeSize());
    }

    @Test
    void resolveFindsInnermostTextblock() {
        Node doc = sampleDoc();

        ResolvedPos inParagraph = doc.resolve(1);
        assertEquals(NodeType.PARAGRAPH, inParagraph.getParent().getType());
        assertEquals(1, inParagraph.start());
        assertEquals(6, inParagraph.end());
        assertEquals(1, inParagraph.getDepth());

        assertEquals(NodeType.DOC, doc.resolve(0).getParent().getType());
        assertEquals(NodeType.DOC, doc.resolve(7).getParent().getType());
        assertEquals(NodeType.HEADING, doc.resolve(8).getParent().getType());
        assertEquals(8, doc.resolve(8).start());
    }

    @Test
    void resolveRejectsPositionsOutsideDocument() {
        Node doc = sampleDoc();

        assertThrows(IllegalArgumentException.class, () -> doc.resolve(11));
        assertThrows(IllegalArgumentException.class, () -> doc.resolve(-1));
    }

    @Test
    void textBetweenSkipsBlockBoundaries() {
        Node doc = sampleDoc();

        assertEquals("hellox", doc.textBetween(0, 10));
        assertEquals("el", doc.textBetween(2, 4));
        assertEquals("hellox", doc.textContent());
    }

    @Test
    void adjacentRunsWithEqualMarksAreMerged() {
        List<Mark> strong = List.of(Mark.of(MarkType.STRONG));
        Node paragraph = Node.block(NodeType.PARAGRAPH, List.of(
                Node.text("a"), Node.text("b"), Node.text("c", strong), Node.text("d", strong)));

        assertEquals(2, paragraph.childCount());
        assertEquals("ab", paragraph.child(0).getText());
        assertEquals("cd", paragraph.child(1).getText());
    }

    @Test
    void marksAreSortedByRank() {
        Node run = Node.text("x", List.of(Mark.syntax(SyntaxType.STRONG), Mark.of(MarkType.STRONG)));

        assertEquals(List.of(Mark.of(MarkType.STRONG), Mark.syntax(SyntaxType.STRONG)), run.getMarks());
        assertTrue(run.hasMark(MarkType.SYNTAX_MARKER));
        assertEquals(SyntaxType.STRONG, run.findMark(MarkType.SYNTAX_MARKER).getSyntaxType());
    }

    @Test
    void invalidContentIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Node.text(""));
        assertThrows(IllegalArgumentException.class,
                () -> Node.block(NodeType.PARAGRAPH, List.of(Node.block(NodeType.PARAGRAPH, List.of()))));
        assertThrows(IllegalArgumentException.class,
                () -> Node.block(NodeType.BLOCKQUOTE, List.of(Node.text("loose"))));
        assertThrows(IllegalArgumentException.class, () -> Node.leaf(NodeType.PARAGRAPH, Map.of()));
        assertThrows(IllegalStateException.class, () -> Node.text("t").withChildren(List.of()));
    }

    @Test
    void structuralEditsReturnNewNodes() {
        Node doc = sampleDoc();
        Node rule = Node.leaf(NodeType.HORIZONTAL_RULE, Map.of());

        Node inserted = doc.insertChild(1, rule);
        assertEquals(3, inserted.childCount());
        assertEquals(2, doc.childCount());

        assertEquals(doc, inserted.removeChild(1));
        assertEquals(rule, doc.replaceChild(0, rule).child(0));
    }
}
