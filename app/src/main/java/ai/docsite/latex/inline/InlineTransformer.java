package ai.docsite.latex.inline;

import ai.docsite.latex.ast.Inline;
import ai.docsite.latex.ast.InlineCode;
import ai.docsite.latex.config.ConversionConfig;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a run of Markdown text into inline nodes.
 *
 * <p>Precedence is fixed: code spans and math spans are resolved first and never reinterpreted, then bracketed forms
 * (wiki links, footnote references, citations, links, autolinks), then emphasis, and finally custom markers and line
 * breaks on whatever plain text remains. Link text goes through every stage except the bracket stage.
 */
public final class InlineTransformer {

    private static final char RESOLVED = '\uFFFC';

    private final BracketRules brackets;
    private final EmphasisResolver emphasis;

    public InlineTransformer(ConversionConfig config) {
        Objects.requireNonNull(config, "config");
        TextRules textRules = new TextRules(config.inline().customMarkers());
        this.emphasis = new EmphasisResolver(textRules::apply);
        this.brackets = new BracketRules(config, this::transformLinkText);
    }

    public static List<Inline> transform(String run, ConversionConfig config) {
        return new InlineTransformer(config).transform(run);
    }

    public List<Inline> transform(String run) {
        return resolve(Objects.requireNonNull(run, "run"), true);
    }

    private List<Inline> transformLinkText(String text) {
        return resolve(text, false);
    }

    private List<Inline> resolve(String run, boolean withBrackets) {
        List<CodeSpans.Span> spans = CodeSpans.find(run);
        Map<Integer, CodeSpans.Span> spansByStart = new HashMap<>();
        spans.forEach(span -> spansByStart.put(span.start(), span));

        StringBuilder flat = new StringBuilder(run.length());
        Map<Integer, Inline> resolved = new HashMap<>();
        int index = 0;
        while (index < run.length()) {
            CodeSpans.Span span = spansByStart.get(index);
            if (span != null) {
                resolved.put(flat.length(), new InlineCode(span.literal()));
                flat.append(RESOLVED);
                index = span.end();
                continue;
            }
            if (MathSpans.mayStart(run, index)) {
                Optional<MathSpans.Match> math = mathAt(run, index, spans);
                if (math.isPresent()) {
                    resolved.put(flat.length(), math.get().span());
                    flat.append(RESOLVED);
                    index = math.get().end();
                    continue;
                }
            }
            char ch = run.charAt(index);
            if (ch == '\\' && index + 1 < run.length() && isEscapable(run.charAt(index + 1))) {
                flat.append(ch).append(run.charAt(index + 1));
                index += 2;
                continue;
            }
            if (withBrackets && BracketRules.mayStart(ch)) {
                Optional<BracketRules.Match> match = bracketAt(run, index, spans);
                if (match.isPresent()) {
                    resolved.put(flat.length(), match.get().inline());
                    flat.append(RESOLVED);
                    index = match.get().end();
                    continue;
                }
            }
            flat.append(ch);
            index++;
        }
        return emphasis.resolve(flat.toString(), resolved);
    }

    private static boolean isEscapable(char ch) {
        return ch == '$' || BracketRules.mayStart(ch);
    }

    // a math span may not swallow the start of a code span
    private static Optional<MathSpans.Match> mathAt(String run, int start, List<CodeSpans.Span> spans) {
        return MathSpans.at(run, start)
                .filter(match -> spans.stream().noneMatch(span -> span.startsInside(start, match.end())));
    }

    private Optional<BracketRules.Match> bracketAt(String run, int start, List<CodeSpans.Span> spans) {
        return brackets.longestAt(run, start)
                .filter(match -> spans.stream().noneMatch(
                        span -> span.startsInside(start, match.end()) && span.end() > match.end()));
    }
}
