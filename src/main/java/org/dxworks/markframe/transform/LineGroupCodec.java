package org.dxworks.markframe.transform;

import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.model.NodeAttrs;
import org.dxworks.markframe.model.NodeType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shared plumbing for codecs that lay a block out as one unmarked paragraph per source line.
 */
abstract class LineGroupCodec implements BlockGroupCodec {

    @Override
    public List<Node> flatten(Node block, String groupId) {
        String[] lines = sourceLines(block).split("\n", -1);
        List<Node> paragraphs = new ArrayList<>(lines.length);
        for (int i = 0; i < lines.length; i++) {
            Map<String, Object> attrs = new LinkedHashMap<>();
            attrs.put(groupIdAttr(), groupId);
            attrs.put(NodeAttrs.LINE_INDEX, i);
            attrs.put(NodeAttrs.TOTAL_LINES, lines.length);
            attrs.putAll(extraAttrs(block));
            paragraphs.add(Node.block(NodeType.PARAGRAPH, attrs,
                    lines[i].isEmpty() ? List.of() : List.of(Node.text(lines[i]))));
        }
        return paragraphs;
    }

    /** The Markdown source of the block, lines separated by {@code \n}. */
    protected abstract String sourceLines(Node block);

    protected Map<String, Object> extraAttrs(Node block) {
        return Map.of();
    }

    static String joinLines(List<Node> paragraphs) {
        return paragraphs.stream().map(Node::textContent).collect(Collectors.joining("\n"));
    }

    static Node textblock(NodeType type, Map<String, Object> attrs, String content) {
        return Node.block(type, attrs, content.isEmpty() ? List.of() : List.of(Node.text(content)));
    }
}
