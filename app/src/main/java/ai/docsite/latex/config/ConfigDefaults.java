package ai.docsite.latex.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Default rule values, shaped like the override maps accepted by {@link ConversionConfigResolver}.
 */
final class ConfigDefaults {

    /**
     * Keys whose values are free-form mappings; their entries are not checked against the defaults.
     */
    static final Set<String> OPEN_MAPPINGS = Set.of(
            "headings.commands",
            "inline.code_escapes",
            "inline.character_normalization",
            "inline.custom_markers",
            "callouts.environments");

    static final Map<String, Object> VALUES = build();

    private ConfigDefaults() {
    }

    private static Map<String, Object> build() {
        Map<String, Object> root = new LinkedHashMap<>();

        Map<String, Object> commands = new LinkedHashMap<>();
        commands.put("1", "section");
        commands.put("2", "subsection");
        commands.put("3", "subsubsection");
        commands.put("4", "paragraph");
        root.put("headings", section(
                "anchor_level", 1,
                "commands", commands,
                "fallback_command", "paragraph"));

        root.put("labels", section(
                "auto_label_headings", false,
                "label_prefix", "",
                "label_separator", "-",
                "label_template", "\\label{{label}}"));

        Map<String, Object> codeEscapes = new LinkedHashMap<>();
        codeEscapes.put("\\", "\\textbackslash{}");
        codeEscapes.put("{", "\\{");
        codeEscapes.put("}", "\\}");
        codeEscapes.put("#", "\\#");
        codeEscapes.put("$", "\\$");
        codeEscapes.put("%", "\\%");
        codeEscapes.put("&", "\\&");
        codeEscapes.put("_", "\\_");
        codeEscapes.put("~", "\\textasciitilde{}");
        codeEscapes.put("^", "\\textasciicircum{}");
        Map<String, Object> normalization = new LinkedHashMap<>();
        normalization.put("’", "'");
        normalization.put("≤", "\\leq");
        normalization.put("≥", "\\geq");
        normalization.put("œ", "oe");
        normalization.put("–", "-");
        root.put("inline", section(
                "bold_command", "textbf",
                "italic_command", "textit",
                "code_command", "texttt",
                "line_break_command", "newline",
                "code_escapes", codeEscapes,
                "character_normalization", normalization,
                "custom_markers", new LinkedHashMap<String, Object>(),
                "escape_special_characters", false));

        root.put("links", section(
                "external_template", "\\href{{url}}{{text}}",
                "url_only_template", "\\url{{url}}",
                "autolink_template", "\\url{{url}}",
                "internal_template", "\\ref{{label}}",
                "check_internal_targets", false));

        root.put("wiki_links", section(
                "template", "\\hyperref[{label}]{{text}}",
                "label_separator", "-"));

        root.put("citations", section(
                "cite_template", "\\cite{{keys}}",
                "cite_with_locator_template", "\\cite[{locator}]{{keys}}",
                "key_separator", ",",
                "multi_cite_separator", " "));

        root.put("footnotes", section(
                "template", "\\footnote{{text}}"));

        root.put("images", section(
                "include_command", "includegraphics",
                "path_template", "{path}",
                "width_unit", "px",
                "environment", "center",
                "base_dir", "",
                "validate_paths", false));

        root.put("lists", section(
                "unordered_environment", "itemize",
                "ordered_environment", "enumerate"));

        root.put("code_blocks", section(
                "environment", "lstlisting",
                "options_template", "language={language}",
                "languages", String.join(",", ConversionConfig.LISTINGS_LANGUAGES)));

        Map<String, Object> environments = new LinkedHashMap<>();
        for (String kind : new String[] {"note", "tip", "info", "warning", "important", "caution", "danger",
                "example", "quote", "abstract", "question", "success", "failure", "bug", "todo"}) {
            environments.put(kind, kind + "box");
        }
        root.put("callouts", section(
                "environments", environments,
                "fallback_environment", "calloutbox",
                "title_template", "[{title}]",
                "kind_normalization", "lower"));

        root.put("tables", section(
                "environment", "tabular",
                "include_hlines", true,
                "multicolumn_align", "c",
                "multirow_command", "multirow"));

        root.put("parsing", section(
                "strip_front_matter", false,
                "strict", false));

        root.put("math", section(
                "block_style", "dollars",
                "inline_template", "${content}$"));

        root.put("horizontal_rule", section(
                "latex", "\\noindent\\rule{\\linewidth}{0.4pt}"));

        return Collections.unmodifiableMap(root);
    }

    private static Map<String, Object> section(Object... keyValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put((String) keyValues[i], keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(values);
    }
}
