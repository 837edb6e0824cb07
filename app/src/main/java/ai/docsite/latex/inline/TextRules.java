package ai.docsite.latex.inline;

import ai.docsite.latex.ast.CustomMarker;
import ai.docsite.latex.ast.Inline;
import ai.docsite.latex.ast.LineBreak;
import ai.docsite.latex.ast.Text;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last inline stage, applied to plain text left over after code, math, bracket and emphasis resolution: custom
 * markers and line breaks. An escaped dollar stays escaped.
 */
final class TextRules {

    private static final Pattern HTML_BREAK = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern HARD_BREAK = Pattern.compile(" {2,}(?=\\n)");

    private final List<String> markerSymbols;

    TextRules(Map<String, String> customMarkers) {
        this.markerSymbols = customMarkers.keySet().stream()
                .filter(symbol -> !symbol.isEmpty())
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .toList();
    }

    List<Inline> apply(String text) {
        List<Inline> result = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        int index = 0;
        while (index < text.length()) {
            char ch = text.charAt(index);
            if (ch == '\\' && index + 1 < text.length() && text.charAt(index + 1) == '$') {
                pending.append("\\$");
                index += 2;
                continue;
            }
            Token token = markerAt(text, index);
            if (token == null) {
                token = lineBreakAt(text, index);
            }
            if (token == null) {
                pending.append(ch);
                index++;
                continue;
            }
            flush(pending, result);
            result.add(token.inline());
            index = token.end();
        }
        flush(pending, result);
        return result;
    }

    private record Token(int end, Inline inline) {
    }

    private Token markerAt(String text, int index) {
        for (String symbol : markerSymbols) {
            if (!text.startsWith(symbol, index)) {
                continue;
            }
            int contentStart = index + symbol.length();
            int close = text.indexOf(symbol, contentStart + 1);
            if (close < 0) {
                continue;
            }
            String content = text.substring(contentStart, close);
            if (content.indexOf('\n') >= 0) {
                continue;
            }
            return new Token(close + symbol.length(), new CustomMarker(symbol, content));
        }
        return null;
    }

    private static Token lineBreakAt(String text, int index) {
        char ch = text.charAt(index);
        if (ch == '<') {
            Matcher matcher = HTML_BREAK.matcher(text).region(index, text.length());
            return matcher.lookingAt() ? new Token(matcher.end(), new LineBreak()) : null;
        }
        if (ch == ' ' && (index == 0 || text.charAt(index - 1) != ' ')) {
            Matcher matcher = HARD_BREAK.matcher(text).region(index, text.length());
            matcher.useTransparentBounds(true);
            return matcher.lookingAt() ? new Token(matcher.end(), new LineBreak()) : null;
        }
        return null;
    }

    private static void flush(StringBuilder pending, List<Inline> result) {
        if (pending.length() > 0) {
            result.add(new Text(pending.toString()));
            pending.setLength(0);
        }
    }
}
