package ai.docsite.latex.inline;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds inline code spans. A run of backticks is closed by the next run of exactly the same length; an unclosed run
 * is ordinary text.
 */
final class CodeSpans {

    record Span(int start, int end, String literal) {

        boolean startsInside(int from, int to) {
            return start > from && start < to;
        }
    }

    private CodeSpans() {
    }

    static List<Span> find(String run) {
        List<Span> spans = new ArrayList<>();
        int index = 0;
        while (index < run.length()) {
            char ch = run.charAt(index);
            if (ch == '\\' && index + 1 < run.length()) {
                index += 2;
                continue;
            }
            if (ch != '`') {
                index++;
                continue;
            }
            int length = runLength(run, index);
            int close = findClosing(run, index + length, length);
            if (close < 0) {
                index += length;
                continue;
            }
            spans.add(new Span(index, close + length, literal(run.substring(index + length, close))));
            index = close + length;
        }
        return spans;
    }

    private static int findClosing(String run, int from, int length) {
        int index = from;
        while (index < run.length()) {
            if (run.charAt(index) == '`') {
                int candidate = runLength(run, index);
                if (candidate == length) {
                    return index;
                }
                index += candidate;
            } else {
                index++;
            }
        }
        return -1;
    }

    private static int runLength(String run, int start) {
        int end = start;
        while (end < run.length() && run.charAt(end) == '`') {
            end++;
        }
        return end - start;
    }

    private static String literal(String raw) {
        String content = raw.replace('\n', ' ');
        if (content.length() >= 2 && content.startsWith(" ") && content.endsWith(" ") && !content.isBlank()) {
            return content.substring(1, content.length() - 1);
        }
        return content;
    }
}
