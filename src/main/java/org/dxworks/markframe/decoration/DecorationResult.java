package org.dxworks.markframe.decoration;

import org.dxworks.markframe.region.MathInlineRegion;
import org.dxworks.markframe.region.SyntaxMarkerRegion;

import java.util.List;

public final class DecorationResult {

    private final DecorationSet decorations;
    private final List<SyntaxMarkerRegion> activeRegions;
    private final List<SyntaxMarkerRegion> syntaxRegions;
    private final List<MathInlineRegion> mathInlineRegions;

    DecorationResult(DecorationSet decorations, List<SyntaxMarkerRegion> activeRegions,
                     List<SyntaxMarkerRegion> syntaxRegions, List<MathInlineRegion> mathInlineRegions) {
        this.decorations = decorations;
        this.activeRegions = activeRegions;
        this.syntaxRegions = syntaxRegions;
        this.mathInlineRegions = mathInlineRegions;
    }

    public DecorationSet getDecorations() {
        return decorations;
    }

    /** Syntax regions containing the cursor. */
    public List<SyntaxMarkerRegion> getActiveRegions() {
        return activeRegions;
    }

    public List<SyntaxMarkerRegion> getSyntaxRegions() {
        return syntaxRegions;
    }

    public List<MathInlineRegion> getMathInlineRegions() {
        return mathInlineRegions;
    }
}
