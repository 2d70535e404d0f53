package org.dxworks.markframe.parser;

import org.dxworks.markframe.model.Mark;
import org.dxworks.markframe.model.Node;
import org.dxworks.markframe.model.SyntaxType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one line of inline Markdown into text runs, keeping every delimiter as a
 * {@code syntax_marker} run. Concatenating the produced runs gives back the input.
 */
final class InlineParser {

    private static final Pattern ESCAPE = Pattern.compile("\\\\([\\\\`*_{}\\[\\]()#+\\-.!|~=$>])");

    List<Node> parse(String text) {
        return parse(text, List.of());
    }

    /**
     * @param inherited marks of the enclosing constructs; every produced run carries them
     */
    List<Node> parse(String text, List<Mark> inherited) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Integer> escapes = findEscapes(text);
        if (!escapes.isEmpty()) {
            return parseWithEscapes(text, inherited, escapes);
        }

        List<Node> nodes = new ArrayList<>();
        int pos = 0;
        for (InlineMatch match : InlineTokenizer.selectOutermost(InlineTokenizer.tokenize(text))) {
            if (match.getStart() > pos) {
                nodes.add(Node.text(text.substring(pos, match.getStart()), inherited));
            }
            appendMatch(match, inherited, nodes);
            pos = match.getEnd();
        }
        if (pos < text.length()) {
            nodes.add(Node.text(text.substring(pos), inherited));
        }
        return nodes;
    }

    private void appendMatch(InlineMatch match, List<Mark> inherited, List<Node> nodes) {
        InlineSyntax syntax = match.getSyntax();
        List<Mark> semantic = syntax.semanticMarks(match.getAttrs());

        List<Mark> contentMarks = new ArrayList<>(inherited);
        contentMarks.addAll(semantic);

        List<Mark> delimiterMarks = new ArrayList<>(inherited);
        delimiterMarks.add(Mark.syntax(syntax.getSyntaxType()));
        delimiterMarks.addAll(semantic);

        nodes.add(Node.text(match.getPrefix(), delimiterMarks));
        nodes.addAll(parse(match.getContent(), contentMarks));
        nodes.add(Node.text(match.getSuffix(), delimiterMarks));
    }

    /** Start offsets of backslash escapes that are not inside a link or inline math span. */
    private List<Integer> findEscapes(String text) {
        if (text.indexOf('\\') < 0) {
            return List.of();
        }
        List<int[]> protectedRanges = InlineTokenizer.protectedRanges(text);
        List<Integer> escapes = new ArrayList<>();
        Matcher m = ESCAPE.matcher(text);
        while (m.find()) {
            int index = m.start();
            boolean isProtected = protectedRanges.stream()
                    .anyMatch(range -> index >= range[0] && index + 2 <= range[1]);
            if (!isProtected) {
                escapes.add(index);
            }
        }
        return escapes;
    }

    private List<Node> parseWithEscapes(String text, List<Mark> inherited, List<Integer> escapes) {
        List<Node> nodes = new ArrayList<>();
        List<Mark> backslashMarks = new ArrayList<>(inherited);
        backslashMarks.add(Mark.syntax(SyntaxType.ESCAPE));

        int pos = 0;
        for (int index : escapes) {
            if (index > pos) {
                nodes.addAll(parse(text.substring(pos, index), inherited));
            }
            nodes.add(Node.text("\\", backslashMarks));
            nodes.add(Node.text(text.substring(index + 1, index + 2), inherited));
            pos = index + 2;
        }
        if (pos < text.length()) {
            nodes.addAll(parse(text.substring(pos), inherited));
        }
        return nodes;
    }
}
