package org.dxworks.markframe.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InlineTokenizerTest {

    @Test
    void findsCandidatesOfEveryConstruct() {
        List<InlineMatch> matches = InlineTokenizer.tokenize("**a** `b` ~~c~~ ==d== $e$");

        assertTrue(matches.stream().anyMatch(m -> m.getSyntax() == InlineSyntax.STRONG && m.getStart() == 0 && m.getEnd() == 5));
        assertTrue(matches.stream().anyMatch(m -> m.getSyntax() == InlineSyntax.CODE_INLINE && m.getStart() == 6));
        assertTrue(matches.stream().anyMatch(m -> m.getSyntax() == InlineSyntax.STRIKETHROUGH));
        assertTrue(matches.stream().anyMatch(m -> m.getSyntax() == InlineSyntax.HIGHLIGHT));
        assertTrue(matches.stream().anyMatch(m -> m.getSyntax() == InlineSyntax.MATH_INLINE));
    }

    @Test
    void keptMatchesArePairwiseDisjoint() {
        List<InlineMatch> kept = InlineTokenizer.selectOutermost(
                InlineTokenizer.tokenize("**a *b* c** and ~~x `y` z~~ then ***q***"));

        for (int i = 1; i < kept.size(); i++) {
            assertTrue(kept.get(i - 1).getEnd() <= kept.get(i).getStart(), () -> "overlap in " + kept);
        }
        assertEquals(3, kept.size());
        assertEquals(InlineSyntax.STRONG, kept.get(0).getSyntax());
        assertEquals(InlineSyntax.STRIKETHROUGH, kept.get(1).getSyntax());
        assertEquals(InlineSyntax.STRONG_EMPHASIS, kept.get(2).getSyntax());
    }

    @Test
    void linkSuffixKeepsTheSourceText() {
        InlineMatch link = InlineTokenizer.tokenize("[docs](http://a.b \"Docs\")").get(0);

        assertEquals("[", link.getPrefix());
        assertEquals("docs", link.getContent());
        assertEquals("](http://a.b \"Docs\")", link.getSuffix());
        assertEquals("http://a.b", link.getAttrs().get("href"));
    }

    @Test
    void imagesAreNotLinks() {
        assertTrue(InlineTokenizer.tokenize("![alt](x.png)").stream()
                .noneMatch(m -> m.getSyntax() == InlineSyntax.LINK));
    }

    @Test
    void protectedRangesCoverLinksAndMath() {
        List<int[]> ranges = InlineTokenizer.protectedRanges("[a](b) $x$");

        assertEquals(2, ranges.size());
        assertArrayEquals(new int[]{0, 6}, ranges.get(0));
        assertArrayEquals(new int[]{7, 10}, ranges.get(1));
    }
}
