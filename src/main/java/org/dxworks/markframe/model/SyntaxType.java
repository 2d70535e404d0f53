package org.dxworks.markframe.model;

import java.util.List;

/**
 * The kind of literal delimiter a {@code syntax_marker} run stands for.
 */
public enum SyntaxType {
    STRONG_EMPHASIS("strong_emphasis", List.of("strong", "emphasis")),
    STRONG("strong", List.of("strong", "strong_emphasis")),
    EMPHASIS("emphasis", List.of("emphasis", "strong_emphasis")),
    CODE_INLINE("code_inline", List.of("code_inline")),
    STRIKETHROUGH("strikethrough", List.of("strikethrough")),
    HIGHLIGHT("highlight", List.of("highlight")),
    LINK("link", List.of("link")),
    MATH_INLINE("math_inline", List.of("math_inline")),
    HEADING("heading", List.of("heading")),
    ESCAPE("escape", List.of("escape")),
    BLOCKQUOTE("blockquote", List.of("blockquote"));

    private final String name;
    private final List<String> relatedRegionTypes;

    SyntaxType(String name, List<String> relatedRegionTypes) {
        this.name = name;
        this.relatedRegionTypes = relatedRegionTypes;
    }

    public String getName() {
        return name;
    }

    /**
     * Whether a marker of this type belongs to a semantic region of the given type,
     * e.g. a {@code strong} marker inside a combined strong+emphasis region.
     */
    public boolean isRelatedTo(String regionType) {
        return relatedRegionTypes.contains(regionType);
    }

    public static SyntaxType fromName(String name) {
        for (SyntaxType type : values()) {
            if (type.name.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown syntax type: " + name);
    }
}
