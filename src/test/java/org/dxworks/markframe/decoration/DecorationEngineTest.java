package org.dxworks.markframe.decoration;

import org.dxworks.markframe.MarkframeConfig;
import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.parser.MarkdownParser;
import org.dxworks.markframe.region.MathInlineRegion;
import org.dxworks.markframe.region.RegionScanner;
import org.dxworks.markframe.region.SyntaxMarkerRegion;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DecorationEngineTest {

    private final AtomicInteger renderCalls = new AtomicInteger();
    private final MathRenderer countingRenderer = formula -> {
        renderCalls.incrementAndGet();
        return "<span class=\"katex\">" + formula + "</span>";
    };
    private final DecorationEngine engine = new DecorationEngine(countingRenderer, MarkframeConfig.defaults());

    private static Node parse(String markdown) {
        return new MarkdownParser().parse(markdown).getDocument();
    }

    private static Decoration hidden(int from, int to) {
        return Decoration.inline(from, to, Decoration.SYNTAX_HIDDEN);
    }

    private static Decoration visible(int from, int to) {
        return Decoration.inline(from, to, Decoration.SYNTAX_VISIBLE);
    }

    @Test
    void hidesMarkersAwayFromCursor() {
        Node doc = parse("Hello **bold** world");

        assertEquals(List.of(hidden(7, 9), hidden(13, 15)),
                engine.computeDecorations(doc, 3, false).getDecorations().getDecorations());
        assertEquals(List.of(hidden(7, 9), hidden(13, 15)),
                engine.computeDecorations(doc, 18, false).getDecorations().getDecorations());
    }

    @Test
    void showsBothMarkersWhenCursorIsInsideTheSpan() {
        Node doc = parse("Hello **bold** world");

        DecorationResult result = engine.computeDecorations(doc, 10, false);

        assertEquals(List.of(visible(7, 9), visible(13, 15)), result.getDecorations().getDecorations());
        assertTrue(result.getActiveRegions().isEmpty());
    }

    @Test
    void cursorOnMarkerMakesItActive() {
        Node doc = parse("Hello **bold** world");

        DecorationResult result = engine.computeDecorations(doc, 7, false);

        assertEquals(1, result.getActiveRegions().size());
        assertEquals(7, result.getActiveRegions().get(0).getFrom());
        assertEquals(visible(7, 9), result.getDecorations().getDecorations().get(0));
    }

    @Test
    void strongEmphasisMarkersShowInsideTheirSpan() {
        Node doc = parse("***xy***");

        assertEquals(List.of(visible(1, 4), visible(6, 9)),
                engine.computeDecorations(doc, 5, false).getDecorations().getDecorations());
    }

    @Test
    void nestedSpansShowTheMarkersOfEveryEnclosingMark() {
        Node doc = parse("**a *bc* d**");

        assertEquals(List.of(visible(1, 3), visible(5, 6), visible(8, 9), visible(11, 13)),
                engine.computeDecorations(doc, 7, false).getDecorations().getDecorations());
        assertEquals(List.of(visible(1, 3), hidden(5, 6), hidden(8, 9), visible(11, 13)),
                engine.computeDecorations(doc, 4, false).getDecorations().getDecorations());
    }

    @Test
    void escapeBackslashStaysVisibleOverEscapedCharacter() {
        Node doc = parse("a\\*b");

        assertEquals(List.of(visible(2, 3)), engine.computeDecorations(doc, 4, false).getDecorations().getDecorations());
        assertEquals(List.of(hidden(2, 3)), engine.computeDecorations(doc, 5, false).getDecorations().getDecorations());
        assertEquals(List.of(hidden(2, 3)), engine.computeDecorations(doc, 1, false).getDecorations().getDecorations());
    }

    @Test
    void headingMarkerIsShownWhileCursorIsInHeading() {
        Node doc = parse("# Title\n\nbody");

        assertEquals(List.of(hidden(1, 2)), engine.computeDecorations(doc, 12, false).getDecorations().getDecorations());
        assertEquals(List.of(visible(1, 2)), engine.computeDecorations(doc, 5, false).getDecorations().getDecorations());
    }

    @Test
    void inlineMathIsReplacedByLazyWidget() {
        Node doc = parse("Sum $x^2$ here");

        DecorationSet decorations = engine.computeDecorations(doc, 13, false).getDecorations();

        assertTrue(decorations.inline().contains(Decoration.inline(5, 10, Decoration.MATH_SOURCE_HIDDEN)));
        List<Decoration> widgets = decorations.widgets();
        assertEquals(1, widgets.size());
        Decoration widget = widgets.get(0);
        assertEquals(10, widget.getFrom());
        assertEquals(-1, widget.getSide());
        assertEquals("x^2", widget.getFormula());
        assertFalse(widget.isRendered());
        assertEquals(0, renderCalls.get());

        assertEquals(Optional.of("<span class=\"katex\">x^2</span>"), widget.getHtml());
        widget.getHtml();
        assertEquals(1, renderCalls.get());
    }

    @Test
    void cursorInsideMathShowsSource() {
        Node doc = parse("Sum $x^2$ here");

        DecorationSet decorations = engine.computeDecorations(doc, 7, false).getDecorations();

        assertTrue(decorations.widgets().isEmpty());
        assertEquals(List.of(visible(5, 6), visible(9, 10)), decorations.inline());
    }

    @Test
    void blankFormulaGetsNoWidget() {
        Node doc = parse("a $ $ b");

        assertTrue(engine.computeDecorations(doc, 1, false).getDecorations().widgets().isEmpty());
    }

    @Test
    void disabledMathRenderingProducesNoWidgets() {
        DecorationEngine plain = new DecorationEngine(countingRenderer, MarkframeConfig.with(false, false, true));

        assertTrue(plain.computeDecorations(parse("Sum $x^2$ here"), 13, false).getDecorations().widgets().isEmpty());
        assertTrue(new DecorationEngine(null, MarkframeConfig.defaults())
                .computeDecorations(parse("Sum $x^2$ here"), 13, false).getDecorations().widgets().isEmpty());
    }

    @Test
    void failingRendererYieldsEmptyHtml() {
        DecorationEngine failing = new DecorationEngine(formula -> {
            throw new IllegalStateException("bad formula");
        }, MarkframeConfig.defaults());

        Decoration widget = failing.computeDecorations(parse("Sum $x^2$ here"), 13, false)
                .getDecorations().widgets().get(0);

        assertEquals(Optional.empty(), widget.getHtml());
        assertTrue(widget.isRendered());
    }

    @Test
    void sourceViewShowsEverything() {
        Node doc = parse("**a** and $x$");

        DecorationSet decorations = engine.computeDecorations(doc, 0, true).getDecorations();

        assertTrue(decorations.widgets().isEmpty());
        assertTrue(decorations.getDecorations().stream()
                .allMatch(d -> Decoration.SYNTAX_VISIBLE.equals(d.getCssClass())));
        assertEquals(4, decorations.size());
    }

    @Test
    void cachedRegionsAreReusedAsGiven() {
        Node doc = parse("Hello **bold** and $m$");
        List<SyntaxMarkerRegion> syntax = List.copyOf(RegionScanner.findSyntaxMarkerRegions(doc));
        List<MathInlineRegion> math = List.copyOf(RegionScanner.findMathInlineRegions(doc));

        DecorationResult cached = engine.computeDecorations(doc, 10, false, syntax, math);
        DecorationResult fresh = engine.computeDecorations(doc, 10, false);

        assertSame(syntax, cached.getSyntaxRegions());
        assertSame(math, cached.getMathInlineRegions());
        assertEquals(fresh.getDecorations().getDecorations(), cached.getDecorations().getDecorations());
    }

    @Test
    void stateIsKeptWhenTransactionChangesNothing() {
        Node doc = parse("Hello **bold** world");
        DecorationState state = DecorationState.init(engine, doc, 3, false);

        assertSame(state, state.apply(engine, doc, 3, false, false, null));

        DecorationState moved = state.apply(engine, doc, 10, false, true, null);
        assertSame(state.getCachedSyntaxRegions(), moved.getCachedSyntaxRegions());
        assertEquals(List.of(visible(7, 9), visible(13, 15)), moved.getDecorations().getDecorations());

        DecorationState source = moved.apply(engine, doc, 10, false, false, true);
        assertTrue(source.isSourceView());
        assertNotSame(moved.getCachedSyntaxRegions(), source.getCachedSyntaxRegions());
    }
}
