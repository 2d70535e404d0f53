package org.dxworks.markframe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A tag on a text run. Immutable; equal when type and attributes are equal.
 */
public final class Mark {

    public static final String SYNTAX_TYPE = "syntaxType";
    public static final String HREF = "href";
    public static final String TITLE = "title";
    public static final String CONTENT = "content";

    private final MarkType type;
    private final Map<String, Object> attrs;

    private Mark(MarkType type, Map<String, Object> attrs) {
        this.type = type;
        this.attrs = Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
    }

    public static Mark of(MarkType type) {
        return new Mark(type, Map.of());
    }

    public static Mark of(MarkType type, Map<String, Object> attrs) {
        return new Mark(type, attrs == null ? Map.of() : attrs);
    }

    public static Mark syntax(SyntaxType syntaxType) {
        return new Mark(MarkType.SYNTAX_MARKER, Map.of(SYNTAX_TYPE, syntaxType));
    }

    public MarkType getType() {
        return type;
    }

    public Map<String, Object> getAttrs() {
        return attrs;
    }

    public Object attr(String key) {
        return attrs.get(key);
    }

    public boolean isSyntaxMarker() {
        return type == MarkType.SYNTAX_MARKER;
    }

    /** The delimiter kind of a syntax marker, {@code null} for semantic marks. */
    public SyntaxType getSyntaxType() {
        return isSyntaxMarker() ? (SyntaxType) attrs.get(SYNTAX_TYPE) : null;
    }

    /**
     * Normalizes a mark list: a later mark replaces an earlier one of the same type,
     * and the result is sorted by mark rank.
     */
    public static List<Mark> normalize(List<Mark> marks) {
        if (marks == null || marks.isEmpty()) {
            return List.of();
        }
        Map<MarkType, Mark> byType = new LinkedHashMap<>();
        for (Mark mark : marks) {
            byType.put(mark.type, mark);
        }
        List<Mark> result = new ArrayList<>(byType.values());
        result.sort(Comparator.comparing(Mark::getType));
        return List.copyOf(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Mark other)) return false;
        return type == other.type && attrs.equals(other.attrs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, attrs);
    }

    @Override
    public String toString() {
        if (isSyntaxMarker()) {
            return type.getName() + "(" + getSyntaxType().getName() + ")";
        }
        if (attrs.isEmpty()) {
            return type.getName();
        }
        return type.getName() + attrs;
    }
}
