package ai.docsite.latex.config;

import ai.docsite.latex.config.ConversionConfig.BlockStyle;
import ai.docsite.latex.config.ConversionConfig.CalloutRules;
import ai.docsite.latex.config.ConversionConfig.CitationRules;
import ai.docsite.latex.config.ConversionConfig.CodeBlockRules;
import ai.docsite.latex.config.ConversionConfig.FootnoteRules;
import ai.docsite.latex.config.ConversionConfig.HeadingRules;
import ai.docsite.latex.config.ConversionConfig.ImageRules;
import ai.docsite.latex.config.ConversionConfig.InlineRules;
import ai.docsite.latex.config.ConversionConfig.KindNormalization;
import ai.docsite.latex.config.ConversionConfig.LabelRules;
import ai.docsite.latex.config.ConversionConfig.LinkRules;
import ai.docsite.latex.config.ConversionConfig.ListRules;
import ai.docsite.latex.config.ConversionConfig.MathRules;
import ai.docsite.latex.config.ConversionConfig.ParsingRules;
import ai.docsite.latex.config.ConversionConfig.TableRules;
import ai.docsite.latex.config.ConversionConfig.WikiLinkRules;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds a {@link ConversionConfig} by layering global and chapter overrides on top of the defaults.
 *
 * <p>Scopes are nested maps (section, then key). Maps are merged recursively and the later scope wins per key.
 * Every key is validated here so that generation never has to deal with malformed rules.
 */
public class ConversionConfigResolver {

    private static final Pattern COMMAND_NAME = Pattern.compile("[A-Za-z]+\\*?");
    private static final Pattern ENVIRONMENT_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9]*\\*?");
    private static final Pattern CALLOUT_KIND = Pattern.compile("[A-Za-z][A-Za-z0-9_-]*");

    public ConversionConfig resolve(Map<String, ?> global, Map<String, ?> chapter) {
        Map<String, Object> merged = merge(ConfigDefaults.VALUES, global, "");
        merged = merge(merged, chapter, "");
        return build(merged);
    }

    public ConversionConfig resolve(Map<String, ?> global) {
        return resolve(global, Map.of());
    }

    /**
     * Merges {@code override} into a copy of {@code base}. Keys unknown to the defaults are rejected.
     */
    static Map<String, Object> merge(Map<String, ?> base, Map<String, ?> override, String path) {
        Map<String, Object> merged = copy(base);
        if (override == null) {
            return merged;
        }
        for (Map.Entry<String, ?> entry : override.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String keyPath = path.isEmpty() ? key : path + "." + key;
            Object value = entry.getValue();
            boolean open = ConfigDefaults.OPEN_MAPPINGS.contains(path);
            if (!open && !merged.containsKey(key)) {
                throw new ConfigException(keyPath, "unknown configuration key");
            }
            Object current = merged.get(key);
            if (current instanceof Map<?, ?> currentMap) {
                if (!(value instanceof Map<?, ?> valueMap)) {
                    throw new ConfigException(keyPath, "expected a mapping but was " + describe(value));
                }
                merged.put(key, merge(asStringMap(currentMap), asStringMap(valueMap), keyPath));
            } else {
                if (value instanceof Map<?, ?> && !open) {
                    throw new ConfigException(keyPath, "expected a scalar value but was a mapping");
                }
                merged.put(key, value);
            }
        }
        return merged;
    }

    private ConversionConfig build(Map<String, Object> merged) {
        Section headings = new Section(merged, "headings");
        int anchorLevel = headings.integer("anchor_level");
        if (anchorLevel < 1 || anchorLevel > 6) {
            throw new ConfigException("headings.anchor_level", "must be between 1 and 6 but was " + anchorLevel);
        }
        Map<Integer, String> commands = new LinkedHashMap<>();
        headings.mapping("commands").forEach((level, command) -> {
            int parsed = parseHeadingLevel(level);
            commands.put(parsed, requireName(command, COMMAND_NAME, "headings.commands." + level));
        });
        HeadingRules headingRules = new HeadingRules(anchorLevel, commands,
                headings.name("fallback_command", COMMAND_NAME));

        Section labels = new Section(merged, "labels");
        LabelRules labelRules = new LabelRules(
                labels.bool("auto_label_headings"),
                labels.string("label_prefix").trim(),
                labels.string("label_separator"),
                labels.template("label_template", "{label}"));

        Section inline = new Section(merged, "inline");
        Map<Character, String> codeEscapes = new LinkedHashMap<>();
        inline.mapping("code_escapes").forEach((character, replacement) -> {
            if (character.length() != 1) {
                throw new ConfigException("inline.code_escapes." + character, "keys must be single characters");
            }
            codeEscapes.put(character.charAt(0), replacement);
        });
        Map<String, String> markers = inline.mapping("custom_markers");
        markers.forEach((symbol, command) -> {
            if (symbol.isBlank() || command.isBlank()) {
                throw new ConfigException("inline.custom_markers." + symbol, "marker symbol and command must not be blank");
            }
        });
        InlineRules inlineRules = new InlineRules(
                inline.name("bold_command", COMMAND_NAME),
                inline.name("italic_command", COMMAND_NAME),
                inline.name("code_command", COMMAND_NAME),
                inline.name("line_break_command", COMMAND_NAME),
                codeEscapes,
                inline.mapping("character_normalization"),
                markers,
                inline.bool("escape_special_characters"));

        Section links = new Section(merged, "links");
        LinkRules linkRules = new LinkRules(
                links.template("external_template", "{url}"),
                links.template("url_only_template", "{url}"),
                links.template("autolink_template", "{url}"),
                links.template("internal_template", "{label}"),
                links.bool("check_internal_targets"));

        Section wiki = new Section(merged, "wiki_links");
        WikiLinkRules wikiRules = new WikiLinkRules(wiki.template("template", "{label}"), wiki.string("label_separator"));

        Section citations = new Section(merged, "citations");
        CitationRules citationRules = new CitationRules(
                citations.template("cite_template", "{keys}"),
                citations.template("cite_with_locator_template", "{keys}", "{locator}"),
                citations.string("key_separator"),
                citations.string("multi_cite_separator"));

        Section footnotes = new Section(merged, "footnotes");
        FootnoteRules footnoteRules = new FootnoteRules(footnotes.template("template", "{text}"));

        Section images = new Section(merged, "images");
        String pathTemplate = images.string("path_template");
        if (!pathTemplate.contains("{path}") && !pathTemplate.contains("{stem}") && !pathTemplate.contains("{name}")) {
            throw new ConfigException("images.path_template", "must reference {path}, {stem} or {name}");
        }
        String imageEnvironment = images.string("environment").trim();
        if (!imageEnvironment.isEmpty()) {
            requireName(imageEnvironment, ENVIRONMENT_NAME, "images.environment");
        }
        ImageRules imageRules = new ImageRules(
                images.name("include_command", COMMAND_NAME),
                pathTemplate,
                images.string("width_unit").trim(),
                imageEnvironment,
                Optional.of(images.string("base_dir").trim()),
                images.bool("validate_paths"));

        Section lists = new Section(merged, "lists");
        ListRules listRules = new ListRules(
                lists.name("unordered_environment", ENVIRONMENT_NAME),
                lists.name("ordered_environment", ENVIRONMENT_NAME));

        Section codeBlocks = new Section(merged, "code_blocks");
        CodeBlockRules codeBlockRules = new CodeBlockRules(
                codeBlocks.name("environment", ENVIRONMENT_NAME),
                codeBlocks.string("options_template"),
                codeBlocks.stringSet("languages"));

        Section callouts = new Section(merged, "callouts");
        KindNormalization normalization = callouts.parse("kind_normalization", KindNormalization::from);
        Map<String, String> environments = new LinkedHashMap<>();
        callouts.mapping("environments").forEach((kind, environment) -> {
            String keyPath = "callouts.environments." + kind;
            if (!CALLOUT_KIND.matcher(kind).matches()) {
                throw new ConfigException(keyPath, "callout kind must be an identifier");
            }
            environments.put(normalization.apply(kind), requireName(environment, ENVIRONMENT_NAME, keyPath));
        });
        CalloutRules calloutRules = new CalloutRules(
                environments,
                callouts.name("fallback_environment", ENVIRONMENT_NAME),
                callouts.template("title_template", "{title}"),
                normalization);

        Section tables = new Section(merged, "tables");
        String multicolumnAlign = tables.string("multicolumn_align").trim();
        if (multicolumnAlign.isEmpty()) {
            throw new ConfigException("tables.multicolumn_align", "must not be blank");
        }
        TableRules tableRules = new TableRules(
                tables.name("environment", ENVIRONMENT_NAME),
                tables.bool("include_hlines"),
                multicolumnAlign,
                tables.name("multirow_command", COMMAND_NAME));

        Section parsing = new Section(merged, "parsing");
        ParsingRules parsingRules = new ParsingRules(parsing.bool("strip_front_matter"), parsing.bool("strict"));

        Section math = new Section(merged, "math");
        MathRules mathRules = new MathRules(
                math.parse("block_style", BlockStyle::from),
                math.template("inline_template", "{content}"));

        Section rule = new Section(merged, "horizontal_rule");

        return new ConversionConfig(headingRules, labelRules, inlineRules, linkRules, wikiRules, citationRules,
                footnoteRules, imageRules, listRules, codeBlockRules, calloutRules, tableRules, parsingRules,
                mathRules, rule.string("latex"));
    }

    private static int parseHeadingLevel(String raw) {
        try {
            int level = Integer.parseInt(raw.trim());
            if (level < 1 || level > 6) {
                throw new ConfigException("headings.commands." + raw, "relative heading level must be between 1 and 6");
            }
            return level;
        } catch (NumberFormatException ex) {
            throw new ConfigException("headings.commands." + raw, "relative heading level must be an integer", ex);
        }
    }

    private static String requireName(String raw, Pattern pattern, String keyPath) {
        String value = raw == null ? "" : raw.trim();
        if (value.startsWith("\\")) {
            value = value.substring(1);
        }
        if (!pattern.matcher(value).matches()) {
            throw new ConfigException(keyPath, "'" + raw + "' is not a valid LaTeX name");
        }
        return value;
    }

    private static Map<String, Object> copy(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, value instanceof Map<?, ?> map ? copy(asStringMap(map)) : value));
        return copy;
    }

    private static Map<String, Object> asStringMap(Map<?, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    /**
     * Typed, path-aware access to one section of the merged configuration.
     */
    private static final class Section {

        private final String name;
        private final Map<String, Object> values;

        private Section(Map<String, Object> root, String name) {
            this.name = name;
            Object section = root.get(name);
            if (!(section instanceof Map<?, ?> map)) {
                throw new ConfigException(name, "expected a mapping");
            }
            this.values = asStringMap(map);
        }

        private Object raw(String key) {
            Object value = values.get(key);
            if (value == null) {
                throw new ConfigException(path(key), "value must not be null");
            }
            return value;
        }

        String string(String key) {
            Object value = raw(key);
            if (value instanceof Map<?, ?> || value instanceof List<?>) {
                throw new ConfigException(path(key), "expected text but was " + describe(value));
            }
            return String.valueOf(value);
        }

        String name(String key, Pattern pattern) {
            return requireName(string(key), pattern, path(key));
        }

        String template(String key, String... placeholders) {
            String template = string(key);
            for (String placeholder : placeholders) {
                if (!template.contains(placeholder)) {
                    throw new ConfigException(path(key), "template must contain " + placeholder);
                }
            }
            return template;
        }

        int integer(String key) {
            Object value = raw(key);
            if (value instanceof Integer || value instanceof Long || value instanceof Short) {
                return ((Number) value).intValue();
            }
            try {
                return Integer.parseInt(String.valueOf(value).trim());
            } catch (NumberFormatException ex) {
                throw new ConfigException(path(key), "expected an integer but was '" + value + "'", ex);
            }
        }

        boolean bool(String key) {
            Object value = raw(key);
            if (value instanceof Boolean flag) {
                return flag;
            }
            String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
            return switch (text) {
                case "true", "yes", "1" -> true;
                case "false", "no", "0" -> false;
                default -> throw new ConfigException(path(key), "expected a boolean but was '" + value + "'");
            };
        }

        Map<String, String> mapping(String key) {
            Object value = raw(key);
            if (!(value instanceof Map<?, ?> map)) {
                throw new ConfigException(path(key), "expected a mapping but was " + describe(value));
            }
            Map<String, String> result = new LinkedHashMap<>();
            map.forEach((entryKey, entryValue) -> {
                if (entryValue == null || entryValue instanceof Map<?, ?>) {
                    throw new ConfigException(path(key) + "." + entryKey, "mapping values must be text");
                }
                result.put(String.valueOf(entryKey), String.valueOf(entryValue));
            });
            return result;
        }

        Set<String> stringSet(String key) {
            Object value = raw(key);
            List<String> items;
            if (value instanceof List<?> list) {
                items = list.stream().map(String::valueOf).collect(Collectors.toList());
            } else {
                items = Arrays.asList(String.valueOf(value).split(","));
            }
            return items.stream()
                    .map(String::trim)
                    .filter(item -> !item.isEmpty())
                    .map(item -> item.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }

        <T> T parse(String key, Function<String, T> parser) {
            String value = string(key);
            try {
                return parser.apply(value);
            } catch (IllegalArgumentException ex) {
                throw new ConfigException(path(key), ex.getMessage(), ex);
            }
        }

        private String path(String key) {
            return name + "." + key;
        }
    }
}
