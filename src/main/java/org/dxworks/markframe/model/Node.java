package org.dxworks.markframe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable document tree node.
 * <p>
 * Positions follow the editor-view convention: a text run occupies one position per char,
 * a leaf block occupies one position and every other node occupies its content plus an
 * opening and a closing token. Content of the root starts at position 0.
 * <p>
 * Textblock content is normalized on construction: empty runs are dropped and adjacent runs
 * carrying the same marks are merged.
 */
public final class Node {

    private final NodeType type;
    private final Map<String, Object> attrs;
    private final List<Node> children;
    private final String text;
    private final List<Mark> marks;
    private final int contentSize;

    private Node(NodeType type, Map<String, Object> attrs, List<Node> children, String text, List<Mark> marks) {
        this.type = type;
        this.attrs = attrs;
        this.children = children;
        this.text = text;
        this.marks = marks;
        int size = 0;
        for (Node child : children) {
            size += child.nodeSize();
        }
        this.contentSize = size;
    }

    public static Node text(String text) {
        return text(text, List.of());
    }

    public static Node text(String text, List<Mark> marks) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Empty text runs are not allowed");
        }
        return new Node(NodeType.TEXT, Map.of(), List.of(), text, Mark.normalize(marks));
    }

    public static Node doc(List<Node> blocks) {
        return block(NodeType.DOC, Map.of(), blocks);
    }

    public static Node block(NodeType type, List<Node> content) {
        return block(type, Map.of(), content);
    }

    public static Node block(NodeType type, Map<String, Object> attrs, List<Node> content) {
        if (type.isText()) {
            throw new IllegalArgumentException("Use Node.text for text runs");
        }
        List<Node> safeContent = content == null ? List.of() : content;
        if (type.isLeaf() && !safeContent.isEmpty()) {
            throw new IllegalArgumentException(type.getName() + " cannot have content");
        }
        List<Node> normalized = type.isTextblock() ? mergeRuns(safeContent) : checkBlocks(type, safeContent);
        return new Node(type, copyAttrs(attrs), normalized, null, List.of());
    }

    public static Node leaf(NodeType type, Map<String, Object> attrs) {
        if (!type.isLeaf()) {
            throw new IllegalArgumentException(type.getName() + " is not a leaf block");
        }
        return new Node(type, copyAttrs(attrs), List.of(), null, List.of());
    }

    private static Map<String, Object> copyAttrs(Map<String, Object> attrs) {
        if (attrs == null || attrs.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
    }

    private static List<Node> checkBlocks(NodeType type, List<Node> content) {
        for (Node child : content) {
            if (child.isText()) {
                throw new IllegalArgumentException(type.getName() + " cannot hold text runs directly");
            }
        }
        return List.copyOf(content);
    }

    private static List<Node> mergeRuns(List<Node> content) {
        List<Node> merged = new ArrayList<>();
        for (Node child : content) {
            if (!child.isText()) {
                throw new IllegalArgumentException("Textblocks only hold text runs, got " + child.type.getName());
            }
            if (!merged.isEmpty()) {
                Node last = merged.get(merged.size() - 1);
                if (last.marks.equals(child.marks)) {
                    merged.set(merged.size() - 1, new Node(NodeType.TEXT, Map.of(), List.of(),
                            last.text + child.text, last.marks));
                    continue;
                }
            }
            merged.add(child);
        }
        return List.copyOf(merged);
    }

    public NodeType getType() {
        return type;
    }

    public Map<String, Object> getAttrs() {
        return attrs;
    }

    public Object attr(String key) {
        return attrs.get(key);
    }

    public String stringAttr(String key) {
        Object value = attrs.get(key);
        return value == null ? null : value.toString();
    }

    public List<Node> getChildren() {
        return children;
    }

    public int childCount() {
        return children.size();
    }

    public Node child(int index) {
        return children.get(index);
    }

    /** Text of a text run, {@code null} for other nodes. */
    public String getText() {
        return text;
    }

    public List<Mark> getMarks() {
        return marks;
    }

    public boolean isText() {
        return type.isText();
    }

    public boolean isTextblock() {
        return type.isTextblock();
    }

    public boolean isLeaf() {
        return type.isLeaf();
    }

    public boolean hasMark(MarkType markType) {
        return findMark(markType) != null;
    }

    public Mark findMark(MarkType markType) {
        for (Mark mark : marks) {
            if (mark.getType() == markType) {
                return mark;
            }
        }
        return null;
    }

    public int nodeSize() {
        if (isText()) {
            return text.length();
        }
        if (isLeaf()) {
            return 1;
        }
        return contentSize + 2;
    }

    public int contentSize() {
        return contentSize;
    }

    /** Concatenated text of all descendant runs. */
    public String textContent() {
        if (isText()) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        appendText(this, sb);
        return sb.toString();
    }

    private static void appendText(Node node, StringBuilder sb) {
        for (Node child : node.children) {
            if (child.isText()) {
                sb.append(child.text);
            } else {
                appendText(child, sb);
            }
        }
    }

    /**
     * Walks all descendants in document order, reporting each with its absolute position
     * (relative to this node's content start).
     */
    public void descendants(NodeVisitor visitor) {
        walk(this, 0, visitor);
    }

    private static void walk(Node parent, int contentStart, NodeVisitor visitor) {
        int pos = contentStart;
        for (Node child : parent.children) {
            boolean descend = visitor.visit(child, pos);
            if (descend && !child.children.isEmpty()) {
                walk(child, pos + 1, visitor);
            }
            pos += child.nodeSize();
        }
    }

    public ResolvedPos resolve(int pos) {
        if (pos < 0 || pos > contentSize) {
            throw new IllegalArgumentException("Position " + pos + " out of range [0, " + contentSize + "]");
        }
        Node parent = this;
        int start = 0;
        int depth = 0;
        boolean descended = true;
        while (descended) {
            descended = false;
            int offset = start;
            for (Node child : parent.children) {
                int end = offset + child.nodeSize();
                if (pos > offset && pos < end && !child.isText() && !child.isLeaf()) {
                    parent = child;
                    start = offset + 1;
                    depth++;
                    descended = true;
                    break;
                }
                if (end > pos) {
                    break;
                }
                offset = end;
            }
        }
        return new ResolvedPos(pos, parent, start, depth);
    }

    /** Text of the runs between two positions; block boundaries contribute nothing. */
    public String textBetween(int from, int to) {
        StringBuilder sb = new StringBuilder();
        descendants((node, pos) -> {
            if (node.isText()) {
                int start = Math.max(from, pos);
                int end = Math.min(to, pos + node.text.length());
                if (start < end) {
                    sb.append(node.text, start - pos, end - pos);
                }
                return false;
            }
            return pos < to && pos + node.nodeSize() > from;
        });
        return sb.toString();
    }

    public Node withAttrs(Map<String, Object> newAttrs) {
        if (isText()) {
            throw new IllegalStateException("Text runs carry marks, not attributes");
        }
        return isLeaf() ? leaf(type, newAttrs) : block(type, newAttrs, children);
    }

    public Node withChildren(List<Node> newChildren) {
        if (isText() || isLeaf()) {
            throw new IllegalStateException(type.getName() + " has no children");
        }
        return block(type, attrs, newChildren);
    }

    public Node replaceChild(int index, Node replacement) {
        List<Node> copy = new ArrayList<>(children);
        copy.set(index, replacement);
        return withChildren(copy);
    }

    public Node insertChild(int index, Node child) {
        List<Node> copy = new ArrayList<>(children);
        copy.add(index, child);
        return withChildren(copy);
    }

    public Node removeChild(int index) {
        List<Node> copy = new ArrayList<>(children);
        copy.remove(index);
        return withChildren(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node other)) return false;
        return type == other.type
                && attrs.equals(other.attrs)
                && children.equals(other.children)
                && Objects.equals(text, other.text)
                && marks.equals(other.marks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, attrs, children, text, marks);
    }

    @Override
    public String toString() {
        return DocumentPrinter.print(this);
    }
}
