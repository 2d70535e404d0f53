package org.dxworks.markframe.region;

import java.util.Objects;

/**
 * One inline-math span: the whole {@code $...$} source plus the formula between the delimiters.
 */
public final class MathInlineRegion {

    private final int from;
    private final int to;
    private final String content;
    private final int contentFrom;
    private final int contentTo;

    public MathInlineRegion(int from, int to, String content, int contentFrom, int contentTo) {
        this.from = from;
        this.to = to;
        this.content = content;
        this.contentFrom = contentFrom;
        this.contentTo = contentTo;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    public String getContent() {
        return content;
    }

    public int getContentFrom() {
        return contentFrom;
    }

    public int getContentTo() {
        return contentTo;
    }

    public boolean contains(int pos) {
        return pos >= from && pos <= to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MathInlineRegion other)) return false;
        return from == other.from && to == other.to && contentFrom == other.contentFrom
                && contentTo == other.contentTo && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, content, contentFrom, contentTo);
    }

    @Override
    public String toString() {
        return "math[" + from + ", " + to + "] " + content;
    }
}
