package org.dxworks.markframe.model;

@FunctionalInterface
public interface NodeVisitor {

    /**
     * @param node a descendant
     * @param pos  the absolute position right before {@code node}
     * @return whether to descend into the node's children
     */
    boolean visit(Node node, int pos);
}
