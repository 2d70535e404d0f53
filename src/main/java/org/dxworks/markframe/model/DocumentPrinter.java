package org.dxworks.markframe.model;

import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Renders a document tree as an indented outline, one node per line. Attributes are printed
 * in key order so the output is stable.
 */
public final class DocumentPrinter {

    private static final String INDENT = "  ";

    private DocumentPrinter() {
        // utility class
    }

    public static String print(Node node) {
        StringBuilder sb = new StringBuilder();
        print(node, 0, sb);
        return sb.toString();
    }

    private static void print(Node node, int depth, StringBuilder sb) {
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append(INDENT.repeat(depth));
        if (node.isText()) {
            sb.append('"').append(escape(node.getText())).append('"');
            if (!node.getMarks().isEmpty()) {
                StringJoiner marks = new StringJoiner(", ", " [", "]");
                for (Mark mark : node.getMarks()) {
                    marks.add(formatMark(mark));
                }
                sb.append(marks);
            }
            return;
        }
        sb.append(node.getType().getName());
        if (!node.getAttrs().isEmpty()) {
            sb.append(' ').append(formatAttrs(node.getAttrs()));
        }
        for (Node child : node.getChildren()) {
            print(child, depth + 1, sb);
        }
    }

    private static String formatMark(Mark mark) {
        if (mark.isSyntaxMarker()) {
            return mark.getType().getName() + "(" + mark.getSyntaxType().getName() + ")";
        }
        if (mark.getAttrs().isEmpty()) {
            return mark.getType().getName();
        }
        return mark.getType().getName() + formatAttrs(mark.getAttrs());
    }

    private static String formatAttrs(Map<String, Object> attrs) {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (Map.Entry<String, Object> entry : new TreeMap<>(attrs).entrySet()) {
            Object value = entry.getValue();
            String rendered = value instanceof Map<?, ?> nested
                    ? new TreeMap<>(nested).toString()
                    : String.valueOf(value);
            joiner.add(entry.getKey() + "=" + rendered);
        }
        return joiner.toString();
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\n", "\\n").replace("\"", "\\\"");
    }
}
