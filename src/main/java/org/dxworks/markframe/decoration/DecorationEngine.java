package org.dxworks.markframe.decoration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.markframe.MarkframeConfig;
import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.model.SyntaxType;
import org.dxworks.markframe.region.MathInlineRegion;
import org.dxworks.markframe.region.RegionScanner;
import org.dxworks.markframe.region.SemanticRegion;
import org.dxworks.markframe.region.SyntaxMarkerRegion;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides, for a cursor position, which syntax markers are shown and which inline formulas are
 * replaced by rendered widgets.
 * <p>
 * A marker is shown when the view is in source mode, when the cursor touches it, or when the
 * cursor is inside the semantic span the marker delimits. Escape backslashes are also shown while
 * the cursor is on the escaped character.
 */
public class DecorationEngine {

    private static final Logger logger = LogManager.getLogger(DecorationEngine.class);

    private final MathRenderer mathRenderer;
    private final boolean renderInlineMath;

    public DecorationEngine(MathRenderer mathRenderer, MarkframeConfig config) {
        this.mathRenderer = mathRenderer;
        this.renderInlineMath = config.isRenderInlineMath() && mathRenderer != null;
    }

    public DecorationResult computeDecorations(Node doc, int cursorPos, boolean sourceView) {
        return computeDecorations(doc, cursorPos, sourceView, null, null);
    }

    /**
     * @param cachedSyntaxRegions regions of {@code doc} from an earlier scan, or {@code null} to rescan
     * @param cachedMathRegions   inline-math regions of {@code doc}, or {@code null} to rescan
     */
    public DecorationResult computeDecorations(Node doc, int cursorPos, boolean sourceView,
                                               List<SyntaxMarkerRegion> cachedSyntaxRegions,
                                               List<MathInlineRegion> cachedMathRegions) {
        List<SyntaxMarkerRegion> syntaxRegions = cachedSyntaxRegions;
        if (syntaxRegions == null) {
            syntaxRegions = List.copyOf(RegionScanner.findSyntaxMarkerRegions(doc));
        }
        List<MathInlineRegion> mathRegions = cachedMathRegions;
        if (mathRegions == null) {
            mathRegions = List.copyOf(RegionScanner.findMathInlineRegions(doc));
        }
        if (cachedSyntaxRegions == null || cachedMathRegions == null) {
            logger.debug("Scanned {} syntax regions and {} math regions", syntaxRegions.size(), mathRegions.size());
        }

        List<Decoration> decorations = new ArrayList<>();
        List<SemanticRegion> activeSemantic = sourceView ? List.of() : RegionScanner.getActiveSemanticRegions(doc, cursorPos);

        for (SyntaxMarkerRegion region : syntaxRegions) {
            if (sourceView || isShown(region, cursorPos, activeSemantic)) {
                decorations.add(Decoration.inline(region.getFrom(), region.getTo(), Decoration.SYNTAX_VISIBLE));
            } else {
                decorations.add(hiddenDecoration(doc, region));
            }
        }

        if (!sourceView && renderInlineMath) {
            for (MathInlineRegion math : mathRegions) {
                if (math.contains(cursorPos) || math.getContent().isBlank()) {
                    continue;
                }
                decorations.add(Decoration.inline(math.getFrom(), math.getTo(), Decoration.MATH_SOURCE_HIDDEN));
                decorations.add(Decoration.mathWidget(math.getTo(), math.getContent(), mathRenderer));
            }
        }

        List<SyntaxMarkerRegion> activeRegions = syntaxRegions.stream()
                .filter(region -> region.contains(cursorPos))
                .collect(Collectors.toList());
        return new DecorationResult(DecorationSet.create(decorations), activeRegions, syntaxRegions, mathRegions);
    }

    private static boolean isShown(SyntaxMarkerRegion region, int cursorPos, List<SemanticRegion> activeSemantic) {
        if (region.contains(cursorPos)) {
            return true;
        }
        if (region.getSyntaxType() == SyntaxType.ESCAPE) {
            // the backslash and the escaped character
            return cursorPos >= region.getFrom() && cursorPos <= region.getTo() + 1;
        }
        for (SemanticRegion semantic : activeSemantic) {
            if (region.getSyntaxType().isRelatedTo(semantic.getType()) && semantic.encloses(region)) {
                return true;
            }
        }
        return false;
    }

    /** Hidden heading markers followed by other characters hide only the leading {@code #} run. */
    private static Decoration hiddenDecoration(Node doc, SyntaxMarkerRegion region) {
        if (region.getSyntaxType() == SyntaxType.HEADING) {
            String text = doc.textBetween(region.getFrom(), region.getTo());
            int hashEnd = 0;
            while (hashEnd < text.length() && text.charAt(hashEnd) == '#') {
                hashEnd++;
            }
            if (hashEnd > 0 && hashEnd < text.length()) {
                return Decoration.inline(region.getFrom(), region.getFrom() + hashEnd, Decoration.SYNTAX_HIDDEN);
            }
        }
        return Decoration.inline(region.getFrom(), region.getTo(), Decoration.SYNTAX_HIDDEN);
    }
}
