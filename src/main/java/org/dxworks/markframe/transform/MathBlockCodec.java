package org.dxworks.markframe.transform;

import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.model.NodeAttrs;
import org.dxworks.markframe.model.NodeType;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Display math between two {@code $$} lines. */
public class MathBlockCodec extends LineGroupCodec {

    private static final String DELIMITER = "$$";
    private static final Pattern DELIMITED = Pattern.compile("^\\$\\$\\n([\\s\\S]*?)\\n\\$\\$$");

    @Override
    public NodeType blockType() {
        return NodeType.MATH_BLOCK;
    }

    @Override
    public String groupIdAttr() {
        return NodeAttrs.MATH_BLOCK_ID;
    }

    @Override
    public String idPrefix() {
        return "mb_";
    }

    @Override
    protected String sourceLines(Node block) {
        return DELIMITER + "\n" + block.textContent() + "\n" + DELIMITER;
    }

    @Override
    public Optional<Node> restore(List<Node> paragraphs) {
        Matcher m = DELIMITED.matcher(joinLines(paragraphs));
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(textblock(NodeType.MATH_BLOCK, Map.of(), m.group(1)));
    }
}
