package org.dxworks.markframe.parser;

import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.region.SyntaxMarkerRegion;

import java.util.List;

public final class ParseResult {

    private final Node document;
    private final List<SyntaxMarkerRegion> markers;

    public ParseResult(Node document, List<SyntaxMarkerRegion> markers) {
        this.document = document;
        this.markers = List.copyOf(markers);
    }

    public Node getDocument() {
        return document;
    }

    /** Syntax-marker regions of {@link #getDocument()}, in document order. */
    public List<SyntaxMarkerRegion> getMarkers() {
        return markers;
    }
}
