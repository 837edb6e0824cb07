package ai.docsite.latex.generate;

import ai.docsite.latex.ast.Alignment;
import ai.docsite.latex.ast.Block;
import ai.docsite.latex.ast.BlockVisitor;
import ai.docsite.latex.ast.Callout;
import ai.docsite.latex.ast.Citation;
import ai.docsite.latex.ast.CitationEntry;
import ai.docsite.latex.ast.CodeBlock;
import ai.docsite.latex.ast.CustomMarker;
import ai.docsite.latex.ast.Document;
import ai.docsite.latex.ast.DocumentTraversal;
import ai.docsite.latex.ast.Emphasis;
import ai.docsite.latex.ast.FootnoteDefinition;
import ai.docsite.latex.ast.FootnoteRef;
import ai.docsite.latex.ast.Heading;
import ai.docsite.latex.ast.HorizontalRule;
import ai.docsite.latex.ast.Image;
import ai.docsite.latex.ast.Inline;
import ai.docsite.latex.ast.InlineCode;
import ai.docsite.latex.ast.InlineVisitor;
import ai.docsite.latex.ast.LineBreak;
import ai.docsite.latex.ast.Link;
import ai.docsite.latex.ast.ListBlock;
import ai.docsite.latex.ast.ListItem;
import ai.docsite.latex.ast.MathSpan;
import ai.docsite.latex.ast.Paragraph;
import ai.docsite.latex.ast.Table;
import ai.docsite.latex.ast.TableCell;
import ai.docsite.latex.ast.TableRow;
import ai.docsite.latex.ast.Text;
import ai.docsite.latex.config.ConversionConfig;
import ai.docsite.latex.diagnostics.DiagnosticKind;
import ai.docsite.latex.diagnostics.Diagnostics;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders a document as a LaTeX fragment.
 *
 * <p>The traversal is read-only. Top-level blocks are separated by one blank line and the fragment has no trailing
 * newline. References are checked before anything is rendered, so a broken reference never yields partial output.
 */
public final class LatexGenerator {

    private static final Pattern NUMERIC_WIDTH = Pattern.compile("\\d+(?:\\.\\d+)?");

    private final ConversionConfig config;
    private final ImageLocator imageLocator;

    public LatexGenerator(ConversionConfig config) {
        this(config, ImageLocator.filesystem());
    }

    public LatexGenerator(ConversionConfig config, ImageLocator imageLocator) {
        this.config = Objects.requireNonNull(config, "config");
        this.imageLocator = Objects.requireNonNull(imageLocator, "imageLocator");
    }

    public static String generate(Document document, ConversionConfig config, Diagnostics diagnostics) {
        return new LatexGenerator(config).generate(document, diagnostics);
    }

    public String generate(Document document, Diagnostics diagnostics) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(diagnostics, "diagnostics");
        LabelAllocator labels = LabelAllocator.allocate(document, config.labels(), diagnostics);
        ReferenceChecker.check(document, labels.labels(), config.links().checkInternalTargets());
        return new Rendering(document, labels, diagnostics).blocks(document.children());
    }

    /**
     * Per-call rendering state.
     */
    private final class Rendering implements BlockVisitor<String>, InlineVisitor<String> {

        private final Document document;
        private final LabelAllocator labels;
        private final Diagnostics diagnostics;

        private Rendering(Document document, LabelAllocator labels, Diagnostics diagnostics) {
            this.document = document;
            this.labels = labels;
            this.diagnostics = diagnostics;
        }

        String blocks(List<Block> blocks) {
            return blocks.stream()
                    .map(block -> block.accept(this))
                    .filter(rendered -> !rendered.isBlank())
                    .collect(Collectors.joining("\n\n"));
        }

        @Override
        public String visitHeading(Heading heading) {
            String command = config.headings().commandFor(heading.level());
            String section = "\\" + command + "{" + inlines(heading.content()) + "}";
            Optional<String> label = labels.labelFor(heading);
            if (label.isEmpty()) {
                return section;
            }
            return section + "\n" + TemplateRenderer.render(config.labels().template(), "label", label.get());
        }

        @Override
        public String visitParagraph(Paragraph paragraph) {
            return inlines(paragraph.content());
        }

        @Override
        public String visitList(ListBlock list) {
            String environment = list.ordered()
                    ? config.lists().orderedEnvironment()
                    : config.lists().unorderedEnvironment();
            List<String> items = new ArrayList<>();
            for (ListItem item : list.items()) {
                items.add(item(item));
            }
            return "\\begin{" + environment + "}\n" + String.join("\n", items) + "\n\\end{" + environment + "}";
        }

        private String item(ListItem item) {
            List<String> lines = new ArrayList<>();
            List<String> text = new ArrayList<>();
            for (Block child : item.children()) {
                if (child instanceof Paragraph paragraph) {
                    text.add(inlines(paragraph.content()));
                    continue;
                }
                flushItemText(text, lines);
                lines.add(child.accept(this));
            }
            flushItemText(text, lines);
            if (lines.isEmpty()) {
                return "\\item";
            }
            if (item.children().get(0) instanceof Paragraph && !lines.get(0).isEmpty()) {
                lines.set(0, "\\item " + lines.get(0));
            } else {
                lines.add(0, "\\item");
            }
            return String.join("\n", lines);
        }

        private void flushItemText(List<String> text, List<String> lines) {
            if (!text.isEmpty()) {
                lines.add(String.join("\n", text).strip());
                text.clear();
            }
        }

        @Override
        public String visitCodeBlock(CodeBlock code) {
            ConversionConfig.CodeBlockRules rules = config.codeBlocks();
            String begin = "\\begin{" + rules.environment() + "}";
            Optional<String> language = code.language().filter(rules::supports);
            if (language.isPresent()) {
                String options = TemplateRenderer.render(rules.optionsTemplate(), "language", language.get());
                if (!options.isBlank()) {
                    begin += "[" + options + "]";
                }
            }
            return begin + "\n" + code.literal() + "\n\\end{" + rules.environment() + "}";
        }

        @Override
        public String visitCallout(Callout callout) {
            ConversionConfig.CalloutRules rules = config.callouts();
            Optional<String> mapped = rules.environmentFor(callout.kind());
            String title = callout.title().map(this::inlines).orElse(null);
            String environment;
            if (mapped.isPresent()) {
                environment = mapped.get();
            } else {
                environment = rules.fallbackEnvironment();
                if (title == null) {
                    title = text(callout.kind());
                }
                diagnostics.report(DiagnosticKind.UNMAPPED_CALLOUT, "callout " + callout.kind(),
                        "no environment configured for callout kind '" + rules.normalizeKind(callout.kind())
                                + "', using " + environment);
            }
            String begin = "\\begin{" + environment + "}";
            if (title != null && !title.isBlank()) {
                begin += TemplateRenderer.render(rules.titleTemplate(), "title", title);
            }
            String body = blocks(callout.body());
            String end = "\\end{" + environment + "}";
            return body.isEmpty() ? begin + "\n" + end : begin + "\n" + body + "\n" + end;
        }

        @Override
        public String visitTable(Table table) {
            ConversionConfig.TableRules rules = config.tables();
            String columns = table.alignments().stream()
                    .map(Alignment::columnSpec)
                    .collect(Collectors.joining());
            List<String> lines = new ArrayList<>();
            lines.add("\\begin{" + rules.environment() + "}{" + columns + "}");
            if (rules.includeHlines()) {
                lines.add("\\hline");
            }
            lines.add(row(table.header()));
            if (rules.includeHlines()) {
                lines.add("\\hline");
            }
            for (TableRow row : table.rows()) {
                lines.add(row(row));
            }
            if (rules.includeHlines() && !table.rows().isEmpty()) {
                lines.add("\\hline");
            }
            lines.add("\\end{" + rules.environment() + "}");
            return String.join("\n", lines);
        }

        private String row(TableRow row) {
            return row.cells().stream().map(this::cell).collect(Collectors.joining(" & ")) + " \\\\";
        }

        private String cell(TableCell cell) {
            String latex = inlines(cell.content());
            if (cell.rowspan() > 1) {
                latex = "\\" + config.tables().multirowCommand() + "{" + cell.rowspan() + "}{*}{" + latex + "}";
            }
            if (cell.colspan() > 1) {
                latex = "\\multicolumn{" + cell.colspan() + "}{" + config.tables().multicolumnAlign() + "}{"
                        + latex + "}";
            }
            return latex;
        }

        @Override
        public String visitImage(Image image) {
            ConversionConfig.ImageRules rules = config.images();
            String path = TemplateRenderer.render(rules.pathTemplate(), pathParts(image.source()));
            if (rules.validatePaths() && !imageLocator.exists(path, rules.baseDir())) {
                diagnostics.report(DiagnosticKind.MISSING_IMAGE, image.source(),
                        "image not found: " + path + rules.baseDir().map(dir -> " (base " + dir + ")").orElse(""));
            }
            String options = image.width()
                    .map(width -> NUMERIC_WIDTH.matcher(width).matches() ? width + rules.widthUnit() : width)
                    .map(width -> "[width=" + width + "]")
                    .orElse("");
            String include = "\\" + rules.includeCommand() + options + "{" + path + "}";
            if (rules.environment().isBlank()) {
                return include;
            }
            return "\\begin{" + rules.environment() + "}\n" + include + "\n\\end{" + rules.environment() + "}";
        }

        @Override
        public String visitHorizontalRule(HorizontalRule rule) {
            return config.horizontalRule();
        }

        String inlines(List<Inline> inlines) {
            StringBuilder builder = new StringBuilder();
            for (int i = 0; i < inlines.size(); i++) {
                Inline inline = inlines.get(i);
                builder.append(inline.accept(this));
                if (inline instanceof LineBreak && i + 1 < inlines.size()
                        && inlines.get(i + 1) instanceof Text next
                        && !next.value().isEmpty() && !Character.isWhitespace(next.value().charAt(0))) {
                    builder.append(' ');
                }
            }
            return builder.toString();
        }

        @Override
        public String visitText(Text text) {
            return text(text.value());
        }

        @Override
        public String visitEmphasis(Emphasis emphasis) {
            String command = emphasis.strong() ? config.inline().boldCommand() : config.inline().italicCommand();
            return "\\" + command + "{" + inlines(emphasis.children()) + "}";
        }

        @Override
        public String visitInlineCode(InlineCode code) {
            Map<Character, String> escapes = config.inline().codeEscapes();
            StringBuilder escaped = new StringBuilder();
            for (char ch : code.literal().toCharArray()) {
                String replacement = escapes.get(ch);
                escaped.append(replacement == null ? String.valueOf(ch) : replacement);
            }
            return "\\" + config.inline().codeCommand() + "{" + escaped + "}";
        }

        @Override
        public String visitLink(Link link) {
            String destination = link.target().destination();
            String text = inlines(link.children());
            switch (link.target().kind()) {
                case INTERNAL:
                    return TemplateRenderer.render(config.links().internalTemplate(),
                            Map.of("label", destination, "text", text));
                case WIKI:
                    return TemplateRenderer.render(config.wikiLinks().template(),
                            Map.of("label", destination, "text", text));
                default:
                    if (link.children().isEmpty()) {
                        return TemplateRenderer.render(config.links().autolinkTemplate(), "url", destination);
                    }
                    if (DocumentTraversal.plainText(link.children()).strip().equals(destination)) {
                        return TemplateRenderer.render(config.links().urlOnlyTemplate(), "url", destination);
                    }
                    return TemplateRenderer.render(config.links().externalTemplate(),
                            Map.of("url", destination, "text", text));
            }
        }

        @Override
        public String visitCitation(Citation citation) {
            ConversionConfig.CitationRules rules = config.citations();
            if (!citation.hasLocators()) {
                String keys = citation.entries().stream()
                        .map(CitationEntry::key)
                        .collect(Collectors.joining(rules.keySeparator()));
                return TemplateRenderer.render(rules.citeTemplate(), "keys", keys);
            }
            List<String> rendered = new ArrayList<>();
            for (CitationEntry entry : citation.entries()) {
                if (entry.locator().isPresent()) {
                    rendered.add(TemplateRenderer.render(rules.citeWithLocatorTemplate(),
                            Map.of("keys", entry.key(), "locator", text(entry.locator().get()))));
                } else {
                    rendered.add(TemplateRenderer.render(rules.citeTemplate(), "keys", entry.key()));
                }
            }
            return String.join(rules.multiCiteSeparator(), rendered);
        }

        @Override
        public String visitFootnoteRef(FootnoteRef ref) {
            FootnoteDefinition definition = document.footnote(ref.id())
                    .orElseThrow(() -> new UnresolvedReferenceException("footnote", ref.id(),
                            "no definition for footnote reference [^" + ref.id() + "]"));
            return TemplateRenderer.render(config.footnotes().template(), "text", inlines(definition.body()));
        }

        @Override
        public String visitCustomMarker(CustomMarker marker) {
            String template = config.inline().customMarkers().getOrDefault(marker.symbol(), "");
            String text = text(marker.text());
            if (template.contains("{text}") || template.contains("{content}")) {
                return TemplateRenderer.render(template, Map.of("text", text, "content", text));
            }
            String command = template.startsWith("\\") ? template.substring(1) : template;
            return command.isBlank() ? text : "\\" + command + "{" + text + "}";
        }

        @Override
        public String visitMath(MathSpan math) {
            if (math.inline()) {
                return TemplateRenderer.render(config.math().inlineTemplate(), "content", math.literal());
            }
            return switch (config.math().blockStyle()) {
                case DOLLARS -> "$$" + math.literal() + "$$";
                case BRACKETS -> "\\[" + math.literal() + "\\]";
            };
        }

        @Override
        public String visitLineBreak(LineBreak lineBreak) {
            return "\\" + config.inline().lineBreakCommand();
        }

        /**
         * Applies character normalization and, when enabled, escapes LaTeX special characters. Normalization output
         * is never escaped.
         */
        private String text(String value) {
            ConversionConfig.InlineRules rules = config.inline();
            Map<String, String> normalization = rules.characterNormalization();
            Map<Character, String> escapes = rules.escapeSpecialCharacters() ? rules.codeEscapes() : Map.of();
            if (normalization.isEmpty() && escapes.isEmpty()) {
                return value;
            }
            StringBuilder builder = new StringBuilder(value.length());
            int index = 0;
            while (index < value.length()) {
                Map.Entry<String, String> normalized = normalizationAt(normalization, value, index);
                if (normalized != null) {
                    builder.append(normalized.getValue());
                    index += normalized.getKey().length();
                    continue;
                }
                char ch = value.charAt(index);
                String escaped = escapes.get(ch);
                builder.append(escaped == null ? String.valueOf(ch) : escaped);
                index++;
            }
            return builder.toString();
        }

        private Map.Entry<String, String> normalizationAt(Map<String, String> normalization, String value, int index) {
            for (Map.Entry<String, String> entry : normalization.entrySet()) {
                if (!entry.getKey().isEmpty() && value.startsWith(entry.getKey(), index)) {
                    return entry;
                }
            }
            return null;
        }

        private Map<String, String> pathParts(String source) {
            int slash = source.lastIndexOf('/');
            String name = slash < 0 ? source : source.substring(slash + 1);
            String dir = slash < 0 ? "" : source.substring(0, slash);
            int dot = name.lastIndexOf('.');
            String stem = dot > 0 ? name.substring(0, dot) : name;
            String ext = dot > 0 ? name.substring(dot + 1) : "";
            Map<String, String> parts = new HashMap<>();
            parts.put("path", source);
            parts.put("name", name);
            parts.put("stem", stem);
            parts.put("ext", ext);
            parts.put("dir", dir);
            return parts;
        }
    }
}
