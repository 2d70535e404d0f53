package org.dxworks.markframe.parser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Collects every inline candidate in a text and reduces the candidates to a set of
 * non-overlapping outermost matches.
 */
final class InlineTokenizer {

    private static final Comparator<InlineMatch> OUTERMOST_FIRST = Comparator
            .comparingInt(InlineMatch::getStart)
            .thenComparing(Comparator.comparingInt(InlineMatch::getEnd).reversed());

    private InlineTokenizer() {
        // utility class
    }

    static List<InlineMatch> tokenize(String text) {
        List<InlineMatch> candidates = new ArrayList<>();
        for (InlineSyntax syntax : InlineSyntax.values()) {
            Matcher m = syntax.getPattern().matcher(text);
            while (m.find()) {
                String prefix = syntax.prefix(m);
                String content = syntax.content(m);
                if (prefix.isEmpty() || content.isEmpty()) {
                    continue;
                }
                candidates.add(new InlineMatch(syntax, m.start(), m.end(), prefix, content,
                        syntax.suffix(m, prefix), syntax.attrs(m)));
            }
        }
        return candidates;
    }

    /**
     * Sorts by start ascending, longer first on ties, then keeps greedily every match that
     * starts at or after the end of the previously kept one. The result is pairwise disjoint.
     */
    static List<InlineMatch> selectOutermost(List<InlineMatch> candidates) {
        List<InlineMatch> sorted = new ArrayList<>(candidates);
        sorted.sort(OUTERMOST_FIRST);
        List<InlineMatch> kept = new ArrayList<>();
        int lastEnd = 0;
        for (InlineMatch match : sorted) {
            if (match.getStart() >= lastEnd) {
                kept.add(match);
                lastEnd = match.getEnd();
            }
        }
        return kept;
    }

    /** Ranges of link and inline-math candidates, inside which backslashes are not escapes. */
    static List<int[]> protectedRanges(String text) {
        List<int[]> ranges = new ArrayList<>();
        for (InlineSyntax syntax : List.of(InlineSyntax.LINK, InlineSyntax.MATH_INLINE)) {
            Matcher m = syntax.getPattern().matcher(text);
            while (m.find()) {
                ranges.add(new int[]{m.start(), m.end()});
            }
        }
        return ranges;
    }
}
