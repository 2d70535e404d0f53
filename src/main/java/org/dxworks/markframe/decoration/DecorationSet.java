package org.dxworks.markframe.decoration;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable, position-sorted collection of decorations handed to the view.
 */
public final class DecorationSet {

    public static final DecorationSet EMPTY = new DecorationSet(List.of());

    private static final Comparator<Decoration> BY_POSITION = Comparator
            .comparingInt(Decoration::getFrom)
            .thenComparingInt(Decoration::getTo)
            .thenComparingInt(Decoration::getSide);

    private final List<Decoration> decorations;

    private DecorationSet(List<Decoration> decorations) {
        this.decorations = decorations;
    }

    public static DecorationSet create(List<Decoration> decorations) {
        if (decorations.isEmpty()) {
            return EMPTY;
        }
        List<Decoration> sorted = new ArrayList<>(decorations);
        sorted.sort(BY_POSITION);
        return new DecorationSet(List.copyOf(sorted));
    }

    public List<Decoration> getDecorations() {
        return decorations;
    }

    /** Decorations touching {@code [from, to]}. */
    public List<Decoration> find(int from, int to) {
        return decorations.stream()
                .filter(d -> d.getFrom() <= to && d.getTo() >= from)
                .collect(Collectors.toList());
    }

    public List<Decoration> inline() {
        return decorations.stream().filter(Decoration::isInline).collect(Collectors.toList());
    }

    public List<Decoration> widgets() {
        return decorations.stream().filter(Decoration::isWidget).collect(Collectors.toList());
    }

    public int size() {
        return decorations.size();
    }

    public boolean isEmpty() {
        return decorations.isEmpty();
    }

    @Override
    public String toString() {
        return decorations.toString();
    }
}
