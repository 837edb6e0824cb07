package ai.docsite.latex.inline;

import ai.docsite.latex.ast.MathSpan;
import java.util.Optional;

/**
 * Recognizes {@code $…$}, {@code \(…\)} and {@code $$…$$} spans. Their content is kept verbatim, so nothing inside
 * is read as emphasis, links or markers.
 */
final class MathSpans {

    record Match(int end, MathSpan span) {
    }

    private MathSpans() {
    }

    static boolean mayStart(String text, int index) {
        char ch = text.charAt(index);
        return ch == '$' || (ch == '\\' && text.startsWith("\\(", index));
    }

    static Optional<Match> at(String text, int index) {
        if (text.startsWith("\\(", index)) {
            int close = text.indexOf("\\)", index + 2);
            return close > index + 2
                    ? Optional.of(new Match(close + 2, new MathSpan(true, text.substring(index + 2, close))))
                    : Optional.empty();
        }
        if (text.startsWith("$$", index)) {
            int close = text.indexOf("$$", index + 2);
            return close > index + 2
                    ? Optional.of(new Match(close + 2, new MathSpan(false, text.substring(index + 2, close).strip())))
                    : Optional.empty();
        }
        if (text.charAt(index) == '$') {
            int close = closingDollar(text, index + 1);
            if (close > index + 1) {
                return Optional.of(new Match(close + 1, new MathSpan(true, text.substring(index + 1, close))));
            }
        }
        return Optional.empty();
    }

    // single-dollar math never spans lines and never closes on an escaped or doubled dollar
    private static int closingDollar(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\n') {
                return -1;
            }
            if (ch == '\\' && i + 1 < text.length() && text.charAt(i + 1) == '$') {
                i++;
                continue;
            }
            if (ch == '$') {
                boolean doubled = i + 1 < text.length() && text.charAt(i + 1) == '$';
                return doubled ? -1 : i;
            }
        }
        return -1;
    }
}
