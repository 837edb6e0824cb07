package ai.docsite.latex.inline;

import ai.docsite.latex.ast.Citation;
import ai.docsite.latex.ast.CitationEntry;
import ai.docsite.latex.ast.FootnoteRef;
import ai.docsite.latex.ast.Inline;
import ai.docsite.latex.ast.Link;
import ai.docsite.latex.ast.LinkTarget;
import ai.docsite.latex.config.ConversionConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bracketed inline forms. Every rule is tried at a start offset; the longest match wins and equal lengths go to the
 * rule declared first.
 */
final class BracketRules {

    private static final Pattern WIKI_LINK = Pattern.compile("\\[\\[([^\\[\\]\\n]+)\\]\\]");
    private static final Pattern FOOTNOTE_REF = Pattern.compile("\\[\\^([^\\]\\s]+)\\]");
    private static final Pattern CITATION = Pattern.compile("\\[(@[^\\]\\n]+)\\]");
    private static final Pattern LINK = Pattern.compile(
            "\\[([^\\]\\n]+)\\]\\([ \\t]*(<[^>\\n]*>|[^)\\s]+)(?:[ \\t]+\"[^\"\\n]*\")?[ \\t]*\\)");
    private static final Pattern AUTOLINK = Pattern.compile(
            "<([A-Za-z][A-Za-z0-9+.-]*://[^>\\s]+|mailto:[^>\\s]+)>");

    record Match(int end, Inline inline) {
    }

    private interface Builder {
        Optional<Inline> build(String run, Matcher matcher);
    }

    private record Rule(Pattern pattern, Builder builder) {
    }

    private final ConversionConfig config;
    private final Function<String, List<Inline>> linkText;
    private final List<Rule> rules;

    BracketRules(ConversionConfig config, Function<String, List<Inline>> linkText) {
        this.config = Objects.requireNonNull(config, "config");
        this.linkText = Objects.requireNonNull(linkText, "linkText");
        this.rules = List.of(
                new Rule(WIKI_LINK, (run, matcher) -> Optional.of(wikiLink(matcher.group(1)))),
                new Rule(FOOTNOTE_REF, (run, matcher) -> Optional.of(new FootnoteRef(matcher.group(1)))),
                new Rule(CITATION, (run, matcher) -> citation(matcher.group(1))),
                new Rule(LINK, this::link),
                new Rule(AUTOLINK, (run, matcher) -> Optional.of(
                        new Link(LinkTarget.external(matcher.group(1)), List.of()))));
    }

    static boolean mayStart(char ch) {
        return ch == '[' || ch == '<';
    }

    Optional<Match> longestAt(String run, int start) {
        Match best = null;
        for (Rule rule : rules) {
            Matcher matcher = rule.pattern().matcher(run);
            matcher.region(start, run.length());
            if (!matcher.lookingAt()) {
                continue;
            }
            if (best != null && matcher.end() <= best.end()) {
                continue;
            }
            Optional<Inline> inline = rule.builder().build(run, matcher);
            if (inline.isPresent()) {
                best = new Match(matcher.end(), inline.get());
            }
        }
        return Optional.ofNullable(best);
    }

    private Inline wikiLink(String raw) {
        int bar = raw.indexOf('|');
        String title = (bar < 0 ? raw : raw.substring(0, bar)).strip();
        String display = bar < 0 ? title : raw.substring(bar + 1).strip();
        String slug = Slugs.slugify(title, config.wikiLinks().labelSeparator());
        return new Link(LinkTarget.wiki(slug), display.isEmpty() ? List.of() : linkText.apply(display));
    }

    private static Optional<Inline> citation(String raw) {
        List<CitationEntry> entries = new ArrayList<>();
        for (String part : raw.split(";")) {
            String trimmed = part.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (!trimmed.startsWith("@")) {
                // every entry names its key with @, otherwise the brackets are plain text
                return Optional.empty();
            }
            int comma = trimmed.indexOf(',');
            String key = (comma < 0 ? trimmed.substring(1) : trimmed.substring(1, comma)).strip();
            if (key.isEmpty() || key.chars().anyMatch(Character::isWhitespace)) {
                return Optional.empty();
            }
            Optional<String> locator = comma < 0
                    ? Optional.empty()
                    : Optional.of(trimmed.substring(comma + 1).strip());
            entries.add(new CitationEntry(key, locator));
        }
        return entries.isEmpty() ? Optional.empty() : Optional.of(new Citation(entries));
    }

    private Optional<Inline> link(String run, Matcher matcher) {
        if (matcher.start() > 0 && run.charAt(matcher.start() - 1) == '!') {
            // inline images are not links
            return Optional.empty();
        }
        String destination = matcher.group(2);
        if (destination.startsWith("<") && destination.endsWith(">")) {
            destination = destination.substring(1, destination.length() - 1).strip();
        }
        if (destination.isEmpty()) {
            return Optional.empty();
        }
        List<Inline> children = linkText.apply(matcher.group(1));
        if (destination.startsWith("#")) {
            ConversionConfig.LabelRules labels = config.labels();
            String label = labels.qualify(Slugs.label(destination.substring(1), labels.separator()));
            return Optional.of(new Link(LinkTarget.internal(label), children));
        }
        return Optional.of(new Link(LinkTarget.external(destination), children));
    }
}
