package org.dxworks.markframe.session;

import org.dxworks.markframe.MarkframeConfig;
import org.dxworks.markframe.decoration.Decoration;
import org.dxworks.markframe.decoration.DecorationState;
import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.model.NodeAttrs;
import org.dxworks.markframe.model.NodeType;
import org.dxworks.markframe.parser.MarkdownParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EditorSessionTest {

    private static EditorSession open(String markdown) {
        return EditorSession.open(markdown, formula -> "<math>" + formula + "</math>", MarkframeConfig.defaults());
    }

    @Test
    void selectionMovesDecorations() {
        EditorSession session = open("Hello **bold**");
        assertTrue(session.getDecorations().getDecorations().stream()
                .allMatch(d -> Decoration.SYNTAX_HIDDEN.equals(d.getCssClass())));

        session.dispatch(Transaction.empty().withSelection(10));

        assertEquals(10, session.getSelection());
        assertTrue(session.getDecorations().getDecorations().stream()
                .allMatch(d -> Decoration.SYNTAX_VISIBLE.equals(d.getCssClass())));
    }

    @Test
    void selectionIsClampedToTheDocument() {
        EditorSession session = open("Hello **bold**");

        session.dispatch(Transaction.empty().withSelection(999));
        assertEquals(16, session.getSelection());

        session.dispatch(Transaction.empty().withSelection(-4));
        assertEquals(0, session.getSelection());
    }

    @Test
    void emptyTransactionKeepsState() {
        EditorSession session = open("Hello **bold**");
        DecorationState before = session.getDecorationState();

        session.dispatch(Transaction.empty());
        session.dispatch(Transaction.empty().withSelection(0));

        assertSame(before, session.getDecorationState());
    }

    @Test
    void toggleFlattensAndRestoresTheDocument() {
        EditorSession session = open("Text\n\n```js\nx\n```");
        Node structured = session.getDocument();

        session.toggleSourceView();
        assertTrue(session.isSourceView());
        assertEquals(4, session.getDocument().childCount());
        assertNotNull(session.getDocument().child(1).attr(NodeAttrs.CODE_BLOCK_ID));

        session.toggleSourceView();
        assertFalse(session.isSourceView());
        assertEquals(structured, session.getDocument());
    }

    @Test
    void sourceViewShowsAllMarkers() {
        EditorSession session = open("**a** and $x$");

        session.setSourceView(true);

        assertTrue(session.getDecorations().widgets().isEmpty());
        assertTrue(session.getDecorations().getDecorations().stream()
                .allMatch(d -> Decoration.SYNTAX_VISIBLE.equals(d.getCssClass())));
    }

    @Test
    void listenersHearModeChanges() {
        EditorSession session = open("text");
        List<Boolean> heard = new ArrayList<>();

        Runnable unsubscribe = session.subscribe(heard::add);
        session.setSourceView(true);
        session.setSourceView(true);
        unsubscribe.run();
        session.setSourceView(false);

        assertEquals(List.of(false, true), heard);
    }

    @Test
    void initialSourceViewFlattensOnOpen() {
        EditorSession session = EditorSession.open("```js\nx\n```", null, MarkframeConfig.with(true, true, true));

        assertTrue(session.isSourceView());
        assertEquals(3, session.getDocument().childCount());
        assertEquals(NodeType.PARAGRAPH, session.getDocument().child(0).getType());
    }

    @Test
    void reloadRespectsCurrentMode() {
        EditorSession session = open("old");
        session.setSourceView(true);

        session.reload("$$\na\n$$");

        assertEquals(3, session.getDocument().childCount());
        assertNotNull(session.getDocument().child(0).attr(NodeAttrs.MATH_BLOCK_ID));
    }

    @Test
    void incomingStructuredBlocksAreFlattenedInSourceView() {
        EditorSession session = open("text");
        session.setSourceView(true);
        Node withTable = session.getDocument().insertChild(1,
                new MarkdownParser().parse("| A |\n| --- |\n| 1 |").getDocument().child(0));

        session.dispatch(Transaction.empty().withDocument(withTable));

        Node document = session.getDocument();
        assertEquals(4, document.childCount());
        assertTrue(document.getChildren().stream().noneMatch(block -> block.getType() == NodeType.TABLE));
        assertNotNull(document.child(1).attr(NodeAttrs.TABLE_ID));
    }

    @Test
    void incomingDocumentStaysStructuredInRichView() {
        EditorSession session = open("text");
        Node withCode = session.getDocument().insertChild(1,
                new MarkdownParser().parse("```\nx\n```").getDocument().child(0));

        session.dispatch(Transaction.empty().withDocument(withCode));

        assertEquals(withCode, session.getDocument());
    }

    @Test
    void pasteIsParsedOnlyInRichView() {
        EditorSession session = open("");

        assertTrue(session.preparePaste("**bold** text", false).isPresent());
        assertTrue(session.preparePaste("**bold** text", true).isEmpty());
        assertTrue(session.preparePaste("plain words", false).isEmpty());

        session.setSourceView(true);
        assertTrue(session.preparePaste("**bold** text", false).isEmpty());
    }
}
