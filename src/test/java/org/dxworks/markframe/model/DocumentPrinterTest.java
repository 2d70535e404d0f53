package org.dxworks.markframe.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DocumentPrinterTest {

    @Test
    void printsAttributesInKeyOrderAndEscapesText() {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("title", "");
        attrs.put("src", "a.png");
        attrs.put("alt", "A");
        Node doc = Node.doc(List.of(
                Node.leaf(NodeType.IMAGE, attrs),
                Node.block(NodeType.CODE_BLOCK, Map.of(NodeAttrs.LANGUAGE, "sh"), List.of(Node.text("echo \"hi\"\nls")))));

        String expected = String.join("\n",
                "doc",
                "  image {alt=A, src=a.png, title=}",
                "  code_block {language=sh}",
                "    \"echo \\\"hi\\\"\\nls\"");
        assertEquals(expected, DocumentPrinter.print(doc));
    }
}
