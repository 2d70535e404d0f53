package org.dxworks.markframe.region;

import org.dxworks.markframe.model.Mark;
import org.dxworks.markframe.model.MarkType;
import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.model.NodeType;
import org.dxworks.markframe.model.ResolvedPos;
import org.dxworks.markframe.model.SyntaxType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Flat region extraction over a document tree. All scans are pure functions of the tree;
 * callers cache the full-document results until the document changes.
 */
public final class RegionScanner {

    private RegionScanner() {
        // utility class
    }

    /**
     * One region per syntax-marker run. Adjacent runs with equal marks are merged by the tree,
     * so each run is already a maximal span.
     */
    public static List<SyntaxMarkerRegion> findSyntaxMarkerRegions(Node doc) {
        List<SyntaxMarkerRegion> regions = new ArrayList<>();
        doc.descendants((node, pos) -> {
            if (node.isText()) {
                Mark syntaxMark = node.findMark(MarkType.SYNTAX_MARKER);
                if (syntaxMark != null) {
                    regions.add(new SyntaxMarkerRegion(pos, pos + node.nodeSize(), syntaxMark.getSyntaxType()));
                }
            }
            return true;
        });
        return regions;
    }

    public static List<MathInlineRegion> findMathInlineRegions(Node doc) {
        List<MathInlineRegion> regions = new ArrayList<>();
        doc.descendants((node, pos) -> {
            if (node.isTextblock()) {
                collectMathRegions(node, pos + 1, regions);
                return false;
            }
            return true;
        });
        return regions;
    }

    private static void collectMathRegions(Node textblock, int contentStart, List<MathInlineRegion> out) {
        MathAccumulator current = null;
        int offset = contentStart;
        for (Node child : textblock.getChildren()) {
            int childStart = offset;
            int childEnd = offset + child.nodeSize();

            if (child.hasMark(MarkType.MATH_INLINE)) {
                if (current == null) {
                    current = new MathAccumulator(childStart, childEnd);
                } else {
                    current.to = childEnd;
                }
                if (!isSyntaxOf(child, SyntaxType.MATH_INLINE)) {
                    if (current.content.length() == 0) {
                        current.contentFrom = childStart;
                    }
                    current.content.append(child.getText());
                    current.contentTo = childEnd;
                }
            } else if (current != null) {
                out.add(current.toRegion());
                current = null;
            }
            offset = childEnd;
        }
        if (current != null) {
            out.add(current.toRegion());
        }
    }

    private static boolean isSyntaxOf(Node run, SyntaxType syntaxType) {
        Mark mark = run.findMark(MarkType.SYNTAX_MARKER);
        return mark != null && mark.getSyntaxType() == syntaxType;
    }

    /**
     * Semantic regions covering {@code pos}: one per semantic mark carried by a run touching
     * the position, widened to the full contiguous run of that mark.
     */
    public static List<SemanticRegion> findSemanticRegionsAt(Node doc, int pos) {
        ResolvedPos resolved = doc.resolve(pos);
        Node parent = resolved.getParent();
        if (!parent.isTextblock()) {
            return List.of();
        }

        int parentStart = resolved.start();
        List<SemanticRegion> regions = new ArrayList<>();
        Set<MarkType> foundTypes = new HashSet<>();
        int offset = parentStart;

        for (Node child : parent.getChildren()) {
            int childStart = offset;
            int childEnd = offset + child.nodeSize();
            if (pos >= childStart && pos <= childEnd) {
                for (Mark mark : child.getMarks()) {
                    MarkType type = mark.getType();
                    if (type.isSemantic() && !foundTypes.contains(type)) {
                        SemanticRegion region = findFullMarkRegion(parent, type, childStart, parentStart);
                        if (region != null) {
                            regions.add(region);
                            foundTypes.add(type);
                        }
                    }
                }
            }
            offset = childEnd;
        }
        return regions;
    }

    private static SemanticRegion findFullMarkRegion(Node parent, MarkType markType, int startHint, int parentStart) {
        List<int[]> spans = new ArrayList<>();
        int[] current = null;
        int offset = parentStart;

        for (Node child : parent.getChildren()) {
            int childStart = offset;
            int childEnd = offset + child.nodeSize();
            if (child.hasMark(markType)) {
                if (current == null) {
                    current = new int[]{childStart, childEnd};
                } else {
                    current[1] = childEnd;
                }
            } else if (current != null) {
                spans.add(current);
                current = null;
            }
            offset = childEnd;
        }
        if (current != null) {
            spans.add(current);
        }

        for (int[] span : spans) {
            if (startHint >= span[0] && startHint <= span[1]) {
                return new SemanticRegion(markType.getName(), span[0], span[1]);
            }
        }
        return spans.isEmpty() ? null : new SemanticRegion(markType.getName(), spans.get(0)[0], spans.get(0)[1]);
    }

    /**
     * Inline semantic regions at the cursor plus, when the cursor is inside a heading,
     * a region spanning the heading's whole content.
     */
    public static List<SemanticRegion> getActiveSemanticRegions(Node doc, int cursorPos) {
        List<SemanticRegion> regions = new ArrayList<>(findSemanticRegionsAt(doc, cursorPos));
        ResolvedPos resolved = doc.resolve(cursorPos);
        if (resolved.getParent().getType() == NodeType.HEADING) {
            regions.add(new SemanticRegion(SemanticRegion.HEADING, resolved.start(), resolved.end()));
        }
        return regions;
    }

    private static final class MathAccumulator {
        final int from;
        int to;
        final StringBuilder content = new StringBuilder();
        int contentFrom;
        int contentTo;

        MathAccumulator(int from, int to) {
            this.from = from;
            this.to = to;
            this.contentFrom = from;
            this.contentTo = to;
        }

        MathInlineRegion toRegion() {
            return new MathInlineRegion(from, to, content.toString(), contentFrom, contentTo);
        }
    }
}
