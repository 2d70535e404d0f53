package org.dxworks.markframe.region;

import java.util.Objects;

/**
 * A maximal run sharing one semantic mark ({@code strong}, {@code link}, ...), or a whole
 * heading, identified by type name.
 */
public final class SemanticRegion {

    public static final String HEADING = "heading";

    private final String type;
    private final int from;
    private final int to;

    public SemanticRegion(String type, int from, int to) {
        this.type = type;
        this.from = from;
        this.to = to;
    }

    public String getType() {
        return type;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    public boolean encloses(SyntaxMarkerRegion region) {
        return region.getFrom() >= from && region.getTo() <= to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SemanticRegion other)) return false;
        return from == other.from && to == other.to && type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, from, to);
    }

    @Override
    public String toString() {
        return type + "[" + from + ", " + to + "]";
    }
}
