package org.dxworks.markframe.parser;

import org.dxworks.markframe.model.Node;

/** A parsed block and the index of the last line it consumed. */
final class BlockResult {

    private final Node node;
    private final int endIndex;

    BlockResult(Node node, int endIndex) {
        this.node = node;
        this.endIndex = endIndex;
    }

    Node getNode() {
        return node;
    }

    int getEndIndex() {
        return endIndex;
    }
}
