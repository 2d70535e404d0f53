package org.dxworks.markframe.transform;

import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.model.NodeType;

import java.util.List;
import java.util.Optional;

/**
 * Converts one kind of multi-line structured block to a group of raw line paragraphs and back.
 * Every paragraph of a group carries the group id under {@link #groupIdAttr()}.
 */
public interface BlockGroupCodec {

    NodeType blockType();

    /** Paragraph attribute holding the group id, e.g. {@code codeBlockId}. */
    String groupIdAttr();

    /** Prefix of generated group ids, e.g. {@code cb_}. */
    String idPrefix();

    List<Node> flatten(Node block, String groupId);

    /**
     * Rebuilds the block from the (possibly edited) paragraphs of one group.
     *
     * @return empty when the joined text is no longer a valid block of this kind
     */
    Optional<Node> restore(List<Node> paragraphs);
}
