package org.dxworks.markframe.session;

import org.dxworks.markframe.model.Node;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * One atomic change to an {@link EditorSession}: an optional replacement document, an optional
 * new selection head and an optional source-view flag. Immutable.
 */
public final class Transaction {

    private static final Transaction EMPTY = new Transaction(null, null, null);

    private final Node document;
    private final Integer selection;
    private final Boolean sourceView;

    private Transaction(Node document, Integer selection, Boolean sourceView) {
        this.document = document;
        this.selection = selection;
        this.sourceView = sourceView;
    }

    public static Transaction empty() {
        return EMPTY;
    }

    public Transaction withDocument(Node newDocument) {
        return new Transaction(newDocument, selection, sourceView);
    }

    public Transaction withSelection(int head) {
        return new Transaction(document, head, sourceView);
    }

    public Transaction withSourceView(boolean enabled) {
        return new Transaction(document, selection, enabled);
    }

    /** Present when the transaction replaces the document ("document changed"). */
    public Optional<Node> getDocument() {
        return Optional.ofNullable(document);
    }

    public OptionalInt getSelection() {
        return selection == null ? OptionalInt.empty() : OptionalInt.of(selection);
    }

    /** Present when the transaction sets the view mode ("mode toggled"). */
    public Optional<Boolean> getSourceView() {
        return Optional.ofNullable(sourceView);
    }

    public boolean isEmpty() {
        return document == null && selection == null && sourceView == null;
    }
}
