package org.dxworks.markframe.transform;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.model.NodeAttrs;
import org.dxworks.markframe.model.NodeType;
import org.dxworks.markframe.parser.MarkdownParser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites a document between its structured form and source view, where code blocks, tables,
 * HTML blocks, math blocks, images and rules are shown as raw Markdown paragraphs.
 * <p>
 * Multi-line blocks become groups of paragraphs sharing a group id. On the way back each group
 * is validated; a group the user broke stays as plain paragraphs with its group attributes, so
 * it is retried on the next toggle. Both directions return a new document.
 */
public class SourceViewTransform {

    private static final Logger logger = LogManager.getLogger(SourceViewTransform.class);

    private static final Pattern IMAGE_SOURCE = Pattern.compile("^!\\[([^\\]]*)\\]\\((.+?)(?:\\s+\"([^\"]*)\")?\\)$");
    private static final Pattern RULE_SOURCE = Pattern.compile("^[-*_]{3,}$");
    private static final String RULE_TEXT = "---";

    private final BlockGroupRegistry registry;
    private final GroupIdGenerator idGenerator;

    public SourceViewTransform(MarkdownParser parser) {
        this(parser, GroupIdGenerator.random());
    }

    public SourceViewTransform(MarkdownParser parser, GroupIdGenerator idGenerator) {
        this.registry = new BlockGroupRegistry(parser);
        this.idGenerator = idGenerator;
    }

    public Node toFlattened(Node doc) {
        Node flattened = doc.withChildren(flattenChildren(doc));
        logger.debug("Flattened document: {} -> {} top-level blocks", doc.childCount(), flattened.childCount());
        return flattened;
    }

    private List<Node> flattenChildren(Node parent) {
        List<Node> result = new ArrayList<>();
        for (Node child : parent.getChildren()) {
            Optional<BlockGroupCodec> codec = registry.forBlock(child.getType());
            if (codec.isPresent()) {
                String groupId = idGenerator.nextId(codec.get().idPrefix());
                result.addAll(codec.get().flatten(child, groupId));
            } else if (child.getType() == NodeType.IMAGE) {
                result.add(imageToParagraph(child));
            } else if (child.getType() == NodeType.HORIZONTAL_RULE) {
                result.add(Node.block(NodeType.PARAGRAPH, Map.of(NodeAttrs.HR_SOURCE, true), List.of(Node.text(RULE_TEXT))));
            } else if (hasBlockChildren(child)) {
                result.add(child.withChildren(flattenChildren(child)));
            } else {
                result.add(child);
            }
        }
        return result;
    }

    private static Node imageToParagraph(Node image) {
        String src = attrOrEmpty(image, NodeAttrs.SRC);
        String alt = attrOrEmpty(image, NodeAttrs.ALT);
        String title = attrOrEmpty(image, NodeAttrs.TITLE);
        String source = "![" + alt + "](" + src + (title.isEmpty() ? "" : " \"" + title + "\"") + ")";

        Map<String, Object> imageAttrs = new LinkedHashMap<>();
        imageAttrs.put(NodeAttrs.SRC, src);
        imageAttrs.put(NodeAttrs.ALT, alt);
        imageAttrs.put(NodeAttrs.TITLE, title);
        return Node.block(NodeType.PARAGRAPH, Map.of(NodeAttrs.IMAGE_ATTRS, imageAttrs), List.of(Node.text(source)));
    }

    public Node toStructured(Node doc) {
        Node structured = doc.withChildren(restoreChildren(doc));
        logger.debug("Restored document: {} -> {} top-level blocks", doc.childCount(), structured.childCount());
        return structured;
    }

    private List<Node> restoreChildren(Node parent) {
        List<Node> result = new ArrayList<>();
        GroupBuffer group = new GroupBuffer(result);

        for (Node child : parent.getChildren()) {
            Optional<BlockGroupCodec> codec = registry.forParagraph(child);
            if (codec.isPresent()) {
                group.add(codec.get(), child);
                continue;
            }
            group.flush();
            if (child.getType() == NodeType.PARAGRAPH) {
                result.add(restoreSingleLine(child));
            } else if (hasBlockChildren(child)) {
                result.add(child.withChildren(restoreChildren(child)));
            } else {
                result.add(child);
            }
        }
        group.flush();
        return result;
    }

    private static Node restoreSingleLine(Node paragraph) {
        if (paragraph.attr(NodeAttrs.IMAGE_ATTRS) != null) {
            Matcher m = IMAGE_SOURCE.matcher(paragraph.textContent());
            if (m.matches()) {
                Map<String, Object> attrs = new LinkedHashMap<>();
                attrs.put(NodeAttrs.SRC, m.group(2));
                attrs.put(NodeAttrs.ALT, m.group(1));
                attrs.put(NodeAttrs.TITLE, m.group(3) == null ? "" : m.group(3));
                return Node.leaf(NodeType.IMAGE, attrs);
            }
            logger.debug("Image source no longer valid, keeping paragraph");
        } else if (paragraph.attr(NodeAttrs.HR_SOURCE) != null) {
            if (RULE_SOURCE.matcher(paragraph.textContent().trim()).matches()) {
                return Node.leaf(NodeType.HORIZONTAL_RULE, Map.of());
            }
            logger.debug("Rule source no longer valid, keeping paragraph");
        }
        return paragraph;
    }

    private static boolean hasBlockChildren(Node node) {
        return !node.isText() && !node.isTextblock() && !node.isLeaf();
    }

    private static String attrOrEmpty(Node node, String key) {
        String value = node.stringAttr(key);
        return value == null ? "" : value;
    }

    /** Collects consecutive paragraphs of one group and emits the rebuilt block on flush. */
    private static final class GroupBuffer {

        private final List<Node> out;
        private final List<Node> paragraphs = new ArrayList<>();
        private BlockGroupCodec codec;
        private Object groupId;

        GroupBuffer(List<Node> out) {
            this.out = out;
        }

        void add(BlockGroupCodec paragraphCodec, Node paragraph) {
            Object paragraphGroupId = paragraph.attr(paragraphCodec.groupIdAttr());
            if (codec != paragraphCodec || !paragraphGroupId.equals(groupId)) {
                flush();
                codec = paragraphCodec;
                groupId = paragraphGroupId;
            }
            paragraphs.add(paragraph);
        }

        void flush() {
            if (paragraphs.isEmpty()) {
                return;
            }
            Optional<Node> block = codec.restore(paragraphs);
            if (block.isPresent()) {
                out.add(block.get());
            } else {
                logger.debug("Group {} is no longer a valid {}, keeping {} paragraphs",
                        groupId, codec.blockType().getName(), paragraphs.size());
                out.addAll(paragraphs);
            }
            paragraphs.clear();
            codec = null;
            groupId = null;
        }
    }
}
