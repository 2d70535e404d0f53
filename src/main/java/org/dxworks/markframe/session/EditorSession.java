package org.dxworks.markframe.session;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.markframe.MarkframeConfig;
import org.dxworks.markframe.decoration.DecorationEngine;
import org.dxworks.markframe.decoration.DecorationSet;
import org.dxworks.markframe.decoration.DecorationState;
import org.dxworks.markframe.decoration.MathRenderer;
import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.parser.MarkdownParser;
import org.dxworks.markframe.transform.SourceViewTransform;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * State of one open document: the tree, the selection head, the decoration state and the
 * source-view listeners. Every change goes through {@link #dispatch(Transaction)}.
 * <p>
 * Not thread-safe; a session is driven from the view's thread.
 */
public class EditorSession {

    private static final Logger logger = LogManager.getLogger(EditorSession.class);

    private final MarkdownParser parser;
    private final SourceViewTransform transform;
    private final DecorationEngine engine;
    private final MarkdownPasteHandler pasteHandler;
    private final Set<SourceViewListener> listeners = new LinkedHashSet<>();

    private Node document;
    private int selection;
    private DecorationState decorationState;

    public EditorSession(MarkdownParser parser, SourceViewTransform transform, DecorationEngine engine,
                         MarkframeConfig config, String markdown) {
        this.parser = parser;
        this.transform = transform;
        this.engine = engine;
        this.pasteHandler = new MarkdownPasteHandler(parser, config);

        boolean sourceView = config.isInitialSourceView();
        Node parsed = parser.parse(markdown).getDocument();
        this.document = sourceView ? transform.toFlattened(parsed) : parsed;
        this.selection = 0;
        this.decorationState = DecorationState.init(engine, document, selection, sourceView);
    }

    public static EditorSession open(String markdown, MathRenderer mathRenderer, MarkframeConfig config) {
        MarkdownParser parser = new MarkdownParser();
        return new EditorSession(parser, new SourceViewTransform(parser),
                new DecorationEngine(mathRenderer, config), config, markdown);
    }

    public Node getDocument() {
        return document;
    }

    public int getSelection() {
        return selection;
    }

    public DecorationState getDecorationState() {
        return decorationState;
    }

    public DecorationSet getDecorations() {
        return decorationState.getDecorations();
    }

    public boolean isSourceView() {
        return decorationState.isSourceView();
    }

    /**
     * Applies a transaction. While the session is (or is switching to) source view, any structured
     * block in an incoming document is flattened first.
     */
    public void dispatch(Transaction transaction) {
        if (transaction.isEmpty()) {
            return;
        }
        boolean docChanged = transaction.getDocument().isPresent();
        Boolean sourceViewFlag = transaction.getSourceView().orElse(null);
        boolean targetSourceView = sourceViewFlag != null ? sourceViewFlag : isSourceView();
        Node newDocument = transaction.getDocument().orElse(document);
        if (docChanged && targetSourceView) {
            // structured blocks brought in while in source view are shown as source right away
            newDocument = transform.toFlattened(newDocument);
        }
        int newSelection = clamp(transaction.getSelection().orElse(selection), newDocument);
        boolean selectionChanged = newSelection != selection;

        document = newDocument;
        selection = newSelection;
        decorationState = decorationState.apply(engine, document, selection, docChanged, selectionChanged, sourceViewFlag);
    }

    public void toggleSourceView() {
        setSourceView(!isSourceView());
    }

    /**
     * Switches the view mode. The document is flattened or restored in the same transaction that
     * carries the mode flag.
     */
    public void setSourceView(boolean enabled) {
        if (enabled == isSourceView()) {
            return;
        }
        Node transformed = enabled ? transform.toFlattened(document) : transform.toStructured(document);
        dispatch(Transaction.empty().withDocument(transformed).withSourceView(enabled));
        logger.debug("Source view {}", enabled ? "enabled" : "disabled");
        notifyListeners(enabled);
    }

    /** Replaces the document with freshly parsed Markdown, flattened when in source view. */
    public void reload(String markdown) {
        dispatch(Transaction.empty().withDocument(parser.parse(markdown).getDocument()));
    }

    /**
     * Blocks to insert for pasted plain text, or empty when the view should paste it literally.
     */
    public Optional<List<Node>> preparePaste(String text, boolean internalCopy) {
        return pasteHandler.handlePaste(text, isSourceView(), internalCopy);
    }

    /**
     * Registers a listener and immediately reports the current mode to it.
     *
     * @return a handle that unregisters the listener
     */
    public Runnable subscribe(SourceViewListener listener) {
        listeners.add(listener);
        listener.onSourceViewChanged(isSourceView());
        return () -> listeners.remove(listener);
    }

    private void notifyListeners(boolean sourceView) {
        for (SourceViewListener listener : new ArrayList<>(listeners)) {
            listener.onSourceViewChanged(sourceView);
        }
    }

    private static int clamp(int pos, Node doc) {
        return Math.max(0, Math.min(pos, doc.contentSize()));
    }
}
