package org.dxworks.markframe.decoration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * A view instruction over a document range. Inline decorations attach a CSS class to
 * {@code [from, to)}; widget decorations place rendered content at a single position.
 * <p>
 * Widget HTML is produced on the first call to {@link #getHtml()} and memoized, so computing
 * decorations never waits for the math renderer.
 */
public final class Decoration {

    private static final Logger logger = LogManager.getLogger(Decoration.class);

    public enum Kind { INLINE, WIDGET }

    public static final String SYNTAX_VISIBLE = "mf-syntax-visible";
    public static final String SYNTAX_HIDDEN = "mf-syntax-hidden";
    public static final String MATH_SOURCE_HIDDEN = "mf-math-source-hidden";
    public static final String MATH_RENDERED = "mf-math-rendered";

    private final Kind kind;
    private final int from;
    private final int to;
    private final String cssClass;
    private final int side;
    private final String formula;
    private final MathRenderer renderer;

    private boolean rendered;
    private String html;

    private Decoration(Kind kind, int from, int to, String cssClass, int side, String formula, MathRenderer renderer) {
        this.kind = kind;
        this.from = from;
        this.to = to;
        this.cssClass = cssClass;
        this.side = side;
        this.formula = formula;
        this.renderer = renderer;
    }

    public static Decoration inline(int from, int to, String cssClass) {
        if (from > to) {
            throw new IllegalArgumentException("Inline decoration range is reversed: " + from + " > " + to);
        }
        return new Decoration(Kind.INLINE, from, to, cssClass, 0, null, null);
    }

    /** A rendered-formula widget placed before position {@code pos} (side -1). */
    public static Decoration mathWidget(int pos, String formula, MathRenderer renderer) {
        return new Decoration(Kind.WIDGET, pos, pos, MATH_RENDERED, -1, formula, Objects.requireNonNull(renderer));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isInline() {
        return kind == Kind.INLINE;
    }

    public boolean isWidget() {
        return kind == Kind.WIDGET;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    public String getCssClass() {
        return cssClass;
    }

    public int getSide() {
        return side;
    }

    /** The formula of a math widget, {@code null} for inline decorations. */
    public String getFormula() {
        return formula;
    }

    /** Whether the widget HTML has been requested already. */
    public boolean isRendered() {
        return rendered;
    }

    /**
     * Widget HTML, rendered on first request. Empty for inline decorations, and for widgets whose
     * renderer failed or produced nothing.
     */
    public Optional<String> getHtml() {
        if (kind != Kind.WIDGET) {
            return Optional.empty();
        }
        if (!rendered) {
            rendered = true;
            try {
                html = renderer.renderInline(formula);
            } catch (RuntimeException e) {
                logger.warn("Failed to render inline math '{}': {}", formula, e.getMessage());
                html = null;
            }
        }
        return html == null || html.isEmpty() ? Optional.empty() : Optional.of(html);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Decoration other)) return false;
        return kind == other.kind && from == other.from && to == other.to && side == other.side
                && Objects.equals(cssClass, other.cssClass) && Objects.equals(formula, other.formula);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, from, to, cssClass, side, formula);
    }

    @Override
    public String toString() {
        return kind == Kind.INLINE
                ? cssClass + "[" + from + ", " + to + ")"
                : "widget@" + from + " " + formula;
    }
}
