package org.dxworks.markframe.decoration;

import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.region.MathInlineRegion;
import org.dxworks.markframe.region.SyntaxMarkerRegion;

import java.util.List;

/**
 * Decorations of one editor session together with the region caches they were computed from.
 * Instances are immutable; {@link #apply} returns the state after a transaction.
 */
public final class DecorationState {

    private final DecorationSet decorations;
    private final List<SyntaxMarkerRegion> activeRegions;
    private final boolean sourceView;
    private final List<SyntaxMarkerRegion> cachedSyntaxRegions;
    private final List<MathInlineRegion> cachedMathRegions;

    private DecorationState(DecorationResult result, boolean sourceView) {
        this.decorations = result.getDecorations();
        this.activeRegions = result.getActiveRegions();
        this.sourceView = sourceView;
        this.cachedSyntaxRegions = result.getSyntaxRegions();
        this.cachedMathRegions = result.getMathInlineRegions();
    }

    public static DecorationState init(DecorationEngine engine, Node doc, int cursorPos, boolean sourceView) {
        return new DecorationState(engine.computeDecorations(doc, cursorPos, sourceView), sourceView);
    }

    /**
     * @param sourceViewFlag the mode flag carried by the transaction, {@code null} when absent
     * @return this state when nothing changed, otherwise a recomputed state. Regions are rescanned
     * only when the document changed or the mode flag is present.
     */
    public DecorationState apply(DecorationEngine engine, Node doc, int cursorPos,
                                 boolean docChanged, boolean selectionChanged, Boolean sourceViewFlag) {
        if (!docChanged && !selectionChanged && sourceViewFlag == null) {
            return this;
        }
        boolean newSourceView = sourceViewFlag != null ? sourceViewFlag : sourceView;
        boolean rescan = docChanged || sourceViewFlag != null;
        DecorationResult result = engine.computeDecorations(doc, cursorPos, newSourceView,
                rescan ? null : cachedSyntaxRegions,
                rescan ? null : cachedMathRegions);
        return new DecorationState(result, newSourceView);
    }

    public DecorationSet getDecorations() {
        return decorations;
    }

    public List<SyntaxMarkerRegion> getActiveRegions() {
        return activeRegions;
    }

    public boolean isSourceView() {
        return sourceView;
    }

    public List<SyntaxMarkerRegion> getCachedSyntaxRegions() {
        return cachedSyntaxRegions;
    }

    public List<MathInlineRegion> getCachedMathRegions() {
        return cachedMathRegions;
    }
}
