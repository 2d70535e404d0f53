package org.dxworks.markframe.region;

import org.dxworks.markframe.model.SyntaxType;

import java.util.Objects;

/**
 * A maximal contiguous run carrying one {@code syntax_marker} type.
 */
public final class SyntaxMarkerRegion {

    private final int from;
    private final int to;
    private final SyntaxType syntaxType;

    public SyntaxMarkerRegion(int from, int to, SyntaxType syntaxType) {
        this.from = from;
        this.to = to;
        this.syntaxType = syntaxType;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    public SyntaxType getSyntaxType() {
        return syntaxType;
    }

    public boolean contains(int pos) {
        return pos >= from && pos <= to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxMarkerRegion other)) return false;
        return from == other.from && to == other.to && syntaxType == other.syntaxType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, syntaxType);
    }

    @Override
    public String toString() {
        return syntaxType.getName() + "[" + from + ", " + to + "]";
    }
}
