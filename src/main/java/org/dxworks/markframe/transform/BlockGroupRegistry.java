package org.dxworks.markframe.transform;

import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.model.NodeType;
import org.dxworks.markframe.parser.MarkdownParser;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class BlockGroupRegistry {

    private static final List<NodeType> GROUPED_TYPES = List.of(
            NodeType.CODE_BLOCK, NodeType.TABLE, NodeType.HTML_BLOCK, NodeType.MATH_BLOCK);

    private final Map<NodeType, BlockGroupCodec> codecs;

    public BlockGroupRegistry(MarkdownParser parser) {
        Map<NodeType, BlockGroupCodec> byType = new EnumMap<>(NodeType.class);
        for (NodeType type : GROUPED_TYPES) {
            byType.put(type, createCodec(type, parser));
        }
        this.codecs = Collections.unmodifiableMap(byType);
    }

    private static BlockGroupCodec createCodec(NodeType type, MarkdownParser parser) {
        return switch (type) {
            case CODE_BLOCK -> new CodeBlockCodec();
            case TABLE -> new TableCodec(parser);
            case HTML_BLOCK -> new HtmlBlockCodec();
            case MATH_BLOCK -> new MathBlockCodec();
            default -> throw new IllegalArgumentException(type.getName() + " is not a grouped block");
        };
    }

    public Optional<BlockGroupCodec> forBlock(NodeType type) {
        return Optional.ofNullable(codecs.get(type));
    }

    /** The codec whose group id attribute the paragraph carries, if any. */
    public Optional<BlockGroupCodec> forParagraph(Node paragraph) {
        if (paragraph.getType() != NodeType.PARAGRAPH) {
            return Optional.empty();
        }
        for (BlockGroupCodec codec : codecs.values()) {
            if (paragraph.attr(codec.groupIdAttr()) != null) {
                return Optional.of(codec);
            }
        }
        return Optional.empty();
    }
}
