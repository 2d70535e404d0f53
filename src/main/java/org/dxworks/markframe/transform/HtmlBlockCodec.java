package org.dxworks.markframe.transform;

import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.model.NodeAttrs;
import org.dxworks.markframe.model.NodeType;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/** Raw HTML, one paragraph per line. */
public class HtmlBlockCodec extends LineGroupCodec {

    private static final Pattern STARTS_WITH_TAG = Pattern.compile("^<[a-zA-Z]");

    @Override
    public NodeType blockType() {
        return NodeType.HTML_BLOCK;
    }

    @Override
    public String groupIdAttr() {
        return NodeAttrs.HTML_BLOCK_ID;
    }

    @Override
    public String idPrefix() {
        return "hb_";
    }

    @Override
    protected String sourceLines(Node block) {
        return block.textContent();
    }

    @Override
    public Optional<Node> restore(List<Node> paragraphs) {
        String content = joinLines(paragraphs);
        if (!STARTS_WITH_TAG.matcher(content).lookingAt()) {
            return Optional.empty();
        }
        return Optional.of(textblock(NodeType.HTML_BLOCK, Map.of(), content));
    }
}
