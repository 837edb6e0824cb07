package ai.docsite.latex.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable, fully merged formatting rules for one conversion call.
 *
 * <p>Instances are produced by {@link ConversionConfigResolver}; the nested rule records only hold values that have
 * already been validated there.
 */
public record ConversionConfig(
        HeadingRules headings,
        LabelRules labels,
        InlineRules inline,
        LinkRules links,
        WikiLinkRules wikiLinks,
        CitationRules citations,
        FootnoteRules footnotes,
        ImageRules images,
        ListRules lists,
        CodeBlockRules codeBlocks,
        CalloutRules callouts,
        TableRules tables,
        ParsingRules parsing,
        MathRules math,
        String horizontalRule
) {

    public ConversionConfig {
        Objects.requireNonNull(headings, "headings");
        Objects.requireNonNull(labels, "labels");
        Objects.requireNonNull(inline, "inline");
        Objects.requireNonNull(links, "links");
        Objects.requireNonNull(wikiLinks, "wikiLinks");
        Objects.requireNonNull(citations, "citations");
        Objects.requireNonNull(footnotes, "footnotes");
        Objects.requireNonNull(images, "images");
        Objects.requireNonNull(lists, "lists");
        Objects.requireNonNull(codeBlocks, "codeBlocks");
        Objects.requireNonNull(callouts, "callouts");
        Objects.requireNonNull(tables, "tables");
        Objects.requireNonNull(parsing, "parsing");
        Objects.requireNonNull(math, "math");
        Objects.requireNonNull(horizontalRule, "horizontalRule");
    }

    /**
     * Configuration with every default and no overrides.
     */
    public static ConversionConfig defaults() {
        return new ConversionConfigResolver().resolve(Map.of(), Map.of());
    }

    public record HeadingRules(int anchorLevel, Map<Integer, String> commands, String fallbackCommand) {

        public HeadingRules {
            commands = Collections.unmodifiableMap(new TreeMap<>(commands));
        }

        /**
         * Sectioning command for a Markdown heading level. The anchor level maps to the first command; shallower
         * headings are clamped to it and levels past the table use the fallback command.
         */
        public String commandFor(int markdownLevel) {
            int relative = Math.max(1, markdownLevel - anchorLevel + 1);
            return commands.getOrDefault(relative, fallbackCommand);
        }
    }

    public record LabelRules(boolean autoLabelHeadings, String prefix, String separator, String template) {

        public String qualify(String slug) {
            if (prefix.isEmpty()) {
                return slug;
            }
            return slug.isEmpty() ? prefix : prefix + separator + slug;
        }
    }

    public record InlineRules(
            String boldCommand,
            String italicCommand,
            String codeCommand,
            String lineBreakCommand,
            Map<Character, String> codeEscapes,
            Map<String, String> characterNormalization,
            Map<String, String> customMarkers,
            boolean escapeSpecialCharacters
    ) {

        public InlineRules {
            codeEscapes = Collections.unmodifiableMap(new LinkedHashMap<>(codeEscapes));
            characterNormalization = Collections.unmodifiableMap(new LinkedHashMap<>(characterNormalization));
            customMarkers = Collections.unmodifiableMap(new LinkedHashMap<>(customMarkers));
        }
    }

    public record LinkRules(
            String externalTemplate,
            String urlOnlyTemplate,
            String autolinkTemplate,
            String internalTemplate,
            boolean checkInternalTargets
    ) {
    }

    public record WikiLinkRules(String template, String labelSeparator) {
    }

    public record CitationRules(
            String citeTemplate,
            String citeWithLocatorTemplate,
            String keySeparator,
            String multiCiteSeparator
    ) {
    }

    public record FootnoteRules(String template) {
    }

    public record ImageRules(
            String includeCommand,
            String pathTemplate,
            String widthUnit,
            String environment,
            Optional<String> baseDir,
            boolean validatePaths
    ) {

        public ImageRules {
            baseDir = baseDir == null ? Optional.empty() : baseDir.filter(value -> !value.isBlank());
        }
    }

    public record ListRules(String unorderedEnvironment, String orderedEnvironment) {
    }

    public record CodeBlockRules(String environment, String optionsTemplate, Set<String> languages) {

        public CodeBlockRules {
            languages = Set.copyOf(languages);
        }

        /**
         * An empty language set accepts every language.
         */
        public boolean supports(String language) {
            return languages.isEmpty() || languages.contains(language.toLowerCase(Locale.ROOT));
        }
    }

    public record CalloutRules(
            Map<String, String> environments,
            String fallbackEnvironment,
            String titleTemplate,
            KindNormalization kindNormalization
    ) {

        public CalloutRules {
            environments = Collections.unmodifiableMap(new LinkedHashMap<>(environments));
        }

        public String normalizeKind(String kind) {
            return kindNormalization.apply(kind);
        }

        public Optional<String> environmentFor(String kind) {
            String normalized = normalizeKind(kind);
            String environment = environments.get(normalized);
            if (environment == null) {
                environment = environments.get(kind);
            }
            return Optional.ofNullable(environment);
        }
    }

    public enum KindNormalization {
        LOWER,
        UPPER,
        NONE;

        public String apply(String kind) {
            return switch (this) {
                case LOWER -> kind.toLowerCase(Locale.ROOT);
                case UPPER -> kind.toUpperCase(Locale.ROOT);
                case NONE -> kind;
            };
        }

        static KindNormalization from(String raw) {
            for (KindNormalization value : values()) {
                if (value.name().equalsIgnoreCase(raw.trim())) {
                    return value;
                }
            }
            throw new IllegalArgumentException("expected one of lower, upper, none but was '" + raw + "'");
        }
    }

    public record TableRules(String environment, boolean includeHlines, String multicolumnAlign, String multirowCommand) {
    }

    public record ParsingRules(boolean stripFrontMatter, boolean strict) {
    }

    public record MathRules(BlockStyle blockStyle, String inlineTemplate) {
    }

    public enum BlockStyle {
        DOLLARS,
        BRACKETS;

        static BlockStyle from(String raw) {
            for (BlockStyle value : values()) {
                if (value.name().equalsIgnoreCase(raw.trim())) {
                    return value;
                }
            }
            throw new IllegalArgumentException("expected dollars or brackets but was '" + raw + "'");
        }
    }

    /**
     * Languages understood by the listings package, compared case-insensitively.
     */
    static final List<String> LISTINGS_LANGUAGES = List.of(
            "abap", "ada", "assembler", "awk", "bash", "basic", "c", "c++", "caml", "cobol", "csh", "delphi",
            "eiffel", "erlang", "fortran", "gnuplot", "haskell", "html", "java", "ksh", "lisp", "lua", "make",
            "mathematica", "matlab", "ml", "octave", "pascal", "perl", "php", "prolog", "python", "r", "ruby",
            "scilab", "sh", "sql", "tcl", "tex", "vbscript", "verilog", "vhdl", "xml");
}
