package org.dxworks.markframe.model;

/**
 * Mark types, in rank order. Mark lists on a text run are kept sorted by this order.
 */
public enum MarkType {
    STRONG("strong"),
    EMPHASIS("emphasis"),
    CODE_INLINE("code_inline"),
    STRIKETHROUGH("strikethrough"),
    HIGHLIGHT("highlight"),
    LINK("link"),
    MATH_INLINE("math_inline"),
    SYNTAX_MARKER("syntax_marker");

    private final String name;

    MarkType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /** Semantic marks describe rendered meaning; only {@link #SYNTAX_MARKER} is structural. */
    public boolean isSemantic() {
        return this != SYNTAX_MARKER;
    }
}
