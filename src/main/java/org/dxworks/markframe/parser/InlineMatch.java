package org.dxworks.markframe.parser;

import java.util.Map;

/**
 * A candidate inline construct found by {@link InlineTokenizer}: source span
 * {@code [start, end)} split into prefix, content and suffix.
 */
final class InlineMatch {

    private final InlineSyntax syntax;
    private final int start;
    private final int end;
    private final String prefix;
    private final String content;
    private final String suffix;
    private final Map<String, Object> attrs;

    InlineMatch(InlineSyntax syntax, int start, int end, String prefix, String content, String suffix,
                Map<String, Object> attrs) {
        this.syntax = syntax;
        this.start = start;
        this.end = end;
        this.prefix = prefix;
        this.content = content;
        this.suffix = suffix;
        this.attrs = attrs;
    }

    InlineSyntax getSyntax() {
        return syntax;
    }

    int getStart() {
        return start;
    }

    int getEnd() {
        return end;
    }

    String getPrefix() {
        return prefix;
    }

    String getContent() {
        return content;
    }

    String getSuffix() {
        return suffix;
    }

    Map<String, Object> getAttrs() {
        return attrs;
    }

    @Override
    public String toString() {
        return syntax.getSyntaxType().getName() + "[" + start + ", " + end + ")";
    }
}
