package ai.docsite.latex.parse;

import ai.docsite.latex.diagnostics.DiagnosticKind;
import ai.docsite.latex.diagnostics.Diagnostics;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls {@code [^id]: text} definitions out of the line stream so the block parser never sees them. Lines inside
 * fenced code are left alone. Container bodies (callouts, quotes, list items) are run through here again once their
 * markers are stripped, so every level feeds the same side-table.
 */
final class FootnoteExtractor {

    private static final Pattern DEFINITION = Pattern.compile("^\\[\\^([^\\]\\s]+)\\]:[ \\t]?(.*)$");
    private static final int CONTINUATION_INDENT = 4;

    record RawFootnote(String id, String text, int line) {
    }

    private FootnoteExtractor() {
    }

    /**
     * Moves every definition found in {@code lines} into {@code footnotes} and returns the lines that are left.
     */
    static List<SourceLine> extract(List<SourceLine> lines, Map<String, RawFootnote> footnotes, boolean strict,
                                    Diagnostics diagnostics) {
        List<SourceLine> remaining = new ArrayList<>(lines.size());
        FenceTracker fences = new FenceTracker();
        int index = 0;
        while (index < lines.size()) {
            SourceLine line = lines.get(index);
            if (fences.update(line.text())) {
                remaining.add(line);
                index++;
                continue;
            }
            Matcher matcher = DEFINITION.matcher(line.text());
            if (!matcher.matches()) {
                remaining.add(line);
                index++;
                continue;
            }
            List<String> body = new ArrayList<>();
            body.add(matcher.group(2).strip());
            index = collectContinuation(lines, index + 1, body);
            RawFootnote footnote = new RawFootnote(matcher.group(1), String.join("\n", body).strip(), line.number());
            register(footnote, footnotes, strict, diagnostics);
        }
        return remaining;
    }

    private static int collectContinuation(List<SourceLine> lines, int start, List<String> body) {
        int index = start;
        while (index < lines.size()) {
            String text = lines.get(index).text();
            if (text.isBlank()) {
                int next = index;
                while (next < lines.size() && lines.get(next).isBlank()) {
                    next++;
                }
                if (next < lines.size() && isContinuation(lines.get(next).text())) {
                    index = next;
                    continue;
                }
                return index;
            }
            if (!isContinuation(text)) {
                return index;
            }
            body.add(LineClassifier.dedent(text, CONTINUATION_INDENT).strip());
            index++;
        }
        return index;
    }

    private static boolean isContinuation(String text) {
        return !text.isBlank() && LineClassifier.indentWidth(text) >= CONTINUATION_INDENT;
    }

    private static void register(RawFootnote footnote, Map<String, RawFootnote> footnotes, boolean strict,
                                 Diagnostics diagnostics) {
        RawFootnote existing = footnotes.get(footnote.id());
        if (existing == null) {
            footnotes.put(footnote.id(), footnote);
            return;
        }
        String message = "footnote '" + footnote.id() + "' is already defined on line " + existing.line();
        if (strict) {
            throw new MarkdownParseException("footnote", footnote.line(), message);
        }
        diagnostics.report(DiagnosticKind.DUPLICATE_FOOTNOTE, "line " + footnote.line(), message);
    }

    /**
     * Tracks whether the current line belongs to a fenced code block.
     */
    static final class FenceTracker {
        private String openFence;

        /**
         * @return true when {@code text} is a fence line or lies inside a fence
         */
        boolean update(String text) {
            Matcher matcher = LineClassifier.FENCE.matcher(text);
            if (openFence == null) {
                if (matcher.matches()) {
                    openFence = matcher.group("fence");
                    return true;
                }
                return false;
            }
            if (closes(openFence, text)) {
                openFence = null;
            }
            return true;
        }

        static boolean closes(String fence, String text) {
            String stripped = text.strip();
            if (stripped.length() < fence.length()) {
                return false;
            }
            char symbol = fence.charAt(0);
            for (int i = 0; i < stripped.length(); i++) {
                if (stripped.charAt(i) != symbol) {
                    return false;
                }
            }
            return true;
        }
    }
}
