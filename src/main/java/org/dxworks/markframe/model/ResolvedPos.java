package org.dxworks.markframe.model;

/**
 * A document position resolved to the innermost node whose content contains it.
 */
public final class ResolvedPos {

    private final int pos;
    private final Node parent;
    private final int start;
    private final int depth;

    ResolvedPos(int pos, Node parent, int start, int depth) {
        this.pos = pos;
        this.parent = parent;
        this.start = start;
        this.depth = depth;
    }

    public int getPos() {
        return pos;
    }

    public Node getParent() {
        return parent;
    }

    /** Position where the parent's content starts. */
    public int start() {
        return start;
    }

    /** Position where the parent's content ends. */
    public int end() {
        return start + parent.contentSize();
    }

    public int getDepth() {
        return depth;
    }
}
