package org.dxworks.markframe.parser;

import org.dxworks.markframe.model.Mark;
import org.dxworks.markframe.model.MarkType;
import org.dxworks.markframe.model.SyntaxType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inline constructs recognized by the tokenizer. Each constant owns its pattern and knows how
 * to cut a match into prefix, content and suffix. Constructs with two alternatives (e.g.
 * {@code **x**} and {@code __x__}) put the second alternative's groups two places further.
 */
enum InlineSyntax {

    STRONG_EMPHASIS(SyntaxType.STRONG_EMPHASIS,
            "(\\*\\*\\*|___)(.+?)\\1", 1, 2, null),

    STRONG(SyntaxType.STRONG,
            "(?<!\\*)(\\*\\*)(?!\\*)(.+?)(?<!\\*)\\1(?!\\*)|(?<!_)(__)(?!_)(.+?)(?<!_)\\3(?!_)", 1, 2, null),

    EMPHASIS(SyntaxType.EMPHASIS,
            "(?<![*_\\w])(\\*)(?![*\\s])(.+?)(?<![*\\s])\\1(?![*])"
                    + "|(?<![*_])(_)(?![_\\s])(?=\\S)(.+?)(?<=\\S)(?<![_\\s])\\3(?![_\\w])", 1, 2, null),

    CODE_INLINE(SyntaxType.CODE_INLINE, "`([^`]+)`", 0, 1, "`"),

    STRIKETHROUGH(SyntaxType.STRIKETHROUGH, "~~(.+?)~~", 0, 1, "~~"),

    HIGHLIGHT(SyntaxType.HIGHLIGHT, "==(.+?)==", 0, 1, "=="),

    LINK(SyntaxType.LINK,
            "(?<!!)\\[([^\\]]+)\\]\\(((?:[^)\\s\\\\]|\\\\.)+)(?:\\s+\"([^\"]*)\")?\\)", 0, 1, "[") {
        @Override
        String suffix(Matcher m, String prefix) {
            // everything after "[text" is kept literally so the run text matches the source
            return m.group().substring(prefix.length() + m.group(1).length());
        }

        @Override
        Map<String, Object> attrs(Matcher m) {
            Map<String, Object> attrs = new LinkedHashMap<>();
            attrs.put(Mark.HREF, m.group(2).replaceAll("\\\\([()])", "$1"));
            attrs.put(Mark.TITLE, m.group(3) == null ? "" : m.group(3));
            return attrs;
        }
    },

    MATH_INLINE(SyntaxType.MATH_INLINE, "(?<!\\$)\\$(?!\\$)([^$]+)\\$(?!\\$)", 0, 1, "$") {
        @Override
        Map<String, Object> attrs(Matcher m) {
            return Map.of(Mark.CONTENT, m.group(1));
        }
    };

    private final SyntaxType syntaxType;
    private final Pattern pattern;
    private final int delimiterGroup;
    private final int contentGroup;
    private final String fixedDelimiter;

    InlineSyntax(SyntaxType syntaxType, String regex, int delimiterGroup, int contentGroup, String fixedDelimiter) {
        this.syntaxType = syntaxType;
        this.pattern = Pattern.compile(regex);
        this.delimiterGroup = delimiterGroup;
        this.contentGroup = contentGroup;
        this.fixedDelimiter = fixedDelimiter;
    }

    SyntaxType getSyntaxType() {
        return syntaxType;
    }

    Pattern getPattern() {
        return pattern;
    }

    String prefix(Matcher m) {
        if (fixedDelimiter != null) {
            return fixedDelimiter;
        }
        return firstPresent(m, delimiterGroup);
    }

    String suffix(Matcher m, String prefix) {
        return prefix;
    }

    String content(Matcher m) {
        return firstPresent(m, contentGroup);
    }

    Map<String, Object> attrs(Matcher m) {
        return Map.of();
    }

    /** Semantic marks applied to the content (and carried by the delimiters). */
    List<Mark> semanticMarks(Map<String, Object> attrs) {
        return switch (this) {
            case STRONG_EMPHASIS -> List.of(Mark.of(MarkType.STRONG), Mark.of(MarkType.EMPHASIS));
            case STRONG -> List.of(Mark.of(MarkType.STRONG));
            case EMPHASIS -> List.of(Mark.of(MarkType.EMPHASIS));
            case CODE_INLINE -> List.of(Mark.of(MarkType.CODE_INLINE));
            case STRIKETHROUGH -> List.of(Mark.of(MarkType.STRIKETHROUGH));
            case HIGHLIGHT -> List.of(Mark.of(MarkType.HIGHLIGHT));
            case LINK -> List.of(Mark.of(MarkType.LINK, attrs));
            case MATH_INLINE -> List.of(Mark.of(MarkType.MATH_INLINE, attrs));
        };
    }

    private static String firstPresent(Matcher m, int group) {
        String value = m.group(group);
        if (value == null && group + 2 <= m.groupCount()) {
            value = m.group(group + 2);
        }
        return value == null ? "" : value;
    }
}
