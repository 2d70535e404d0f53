package org.dxworks.markframe.transform;

import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.model.NodeAttrs;
import org.dxworks.markframe.model.NodeType;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Fenced code: opening fence with language, content lines, closing fence. */
public class CodeBlockCodec extends LineGroupCodec {

    private static final String FENCE = "```";
    private static final Pattern FENCED = Pattern.compile("^```([^\\n]*?)\\n([\\s\\S]*?)\\n```$");

    @Override
    public NodeType blockType() {
        return NodeType.CODE_BLOCK;
    }

    @Override
    public String groupIdAttr() {
        return NodeAttrs.CODE_BLOCK_ID;
    }

    @Override
    public String idPrefix() {
        return "cb_";
    }

    @Override
    protected String sourceLines(Node block) {
        return FENCE + language(block) + "\n" + block.textContent() + "\n" + FENCE;
    }

    @Override
    protected Map<String, Object> extraAttrs(Node block) {
        return Map.of(NodeAttrs.LANGUAGE, language(block));
    }

    @Override
    public Optional<Node> restore(List<Node> paragraphs) {
        Matcher m = FENCED.matcher(joinLines(paragraphs));
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(textblock(NodeType.CODE_BLOCK, Map.of(NodeAttrs.LANGUAGE, m.group(1)), m.group(2)));
    }

    private static String language(Node block) {
        String language = block.stringAttr(NodeAttrs.LANGUAGE);
        return language == null ? "" : language;
    }
}
