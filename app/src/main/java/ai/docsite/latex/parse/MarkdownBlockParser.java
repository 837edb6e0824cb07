package ai.docsite.latex.parse;

import ai.docsite.latex.ast.Block;
import ai.docsite.latex.ast.Callout;
import ai.docsite.latex.ast.CodeBlock;
import ai.docsite.latex.ast.Document;
import ai.docsite.latex.ast.FootnoteDefinition;
import ai.docsite.latex.ast.Heading;
import ai.docsite.latex.ast.HorizontalRule;
import ai.docsite.latex.ast.Image;
import ai.docsite.latex.ast.Inline;
import ai.docsite.latex.ast.ListBlock;
import ai.docsite.latex.ast.ListItem;
import ai.docsite.latex.ast.MathSpan;
import ai.docsite.latex.ast.Paragraph;
import ai.docsite.latex.config.ConversionConfig;
import ai.docsite.latex.diagnostics.Diagnostics;
import ai.docsite.latex.inline.InlineTransformer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-oriented Markdown block parser.
 *
 * <p>Each line is classified by {@link LineClassifier}; containers (callout bodies, block quotes, list items) are
 * re-parsed from their dedented lines so nesting is handled by recursion. Inline content is delegated to
 * {@link InlineTransformer}. A parser instance serves one call.
 */
public final class MarkdownBlockParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarkdownBlockParser.class);

    private static final Pattern CLOSING_HASHES = Pattern.compile("(?:^|[ \\t]+)#+$");
    private static final Pattern EXPLICIT_LABEL = Pattern.compile("[ \\t]*\\{#([A-Za-z0-9_:.-]+)\\}$");

    private final ConversionConfig config;
    private final InlineTransformer inline;
    private final TableParser tables;
    private final Diagnostics diagnostics;
    private final Map<String, FootnoteExtractor.RawFootnote> rawFootnotes = new LinkedHashMap<>();

    private MarkdownBlockParser(ConversionConfig config, Diagnostics diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
        this.inline = new InlineTransformer(config);
        this.tables = new TableParser(inline, config.parsing().strict(), diagnostics);
    }

    /**
     * Parses {@code text} into a fresh document. Non-fatal problems go to {@code diagnostics}; structural errors in
     * strict mode raise {@link MarkdownParseException}.
     */
    public static Document parse(String text, ConversionConfig config, Diagnostics diagnostics) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(diagnostics, "diagnostics");
        return new MarkdownBlockParser(config, diagnostics).parseDocument(text);
    }

    private Document parseDocument(String text) {
        List<SourceLine> lines = split(text);
        if (config.parsing().stripFrontMatter()) {
            lines = FrontMatter.strip(lines);
        }
        List<Block> blocks = parseContainer(lines);
        Map<String, FootnoteDefinition> footnotes = new LinkedHashMap<>();
        rawFootnotes.forEach((id, raw) ->
                footnotes.put(id, new FootnoteDefinition(id, inline.transform(raw.text()))));
        LOGGER.debug("Parsed {} top-level blocks and {} footnotes", blocks.size(), footnotes.size());
        return new Document(blocks, footnotes);
    }

    private static List<SourceLine> split(String text) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        String[] raw = normalized.split("\n", -1);
        List<SourceLine> lines = new ArrayList<>(raw.length);
        for (int i = 0; i < raw.length; i++) {
            lines.add(new SourceLine(i + 1, raw[i]));
        }
        return lines;
    }

    private List<Block> parseContainer(List<SourceLine> lines) {
        return parseBlocks(FootnoteExtractor.extract(lines, rawFootnotes, config.parsing().strict(), diagnostics));
    }

    private List<Block> parseBlocks(List<SourceLine> lines) {
        List<Block> blocks = new ArrayList<>();
        int index = 0;
        while (index < lines.size()) {
            SourceLine line = lines.get(index);
            switch (LineClassifier.classify(line.text())) {
                case BLANK -> index++;
                case CALLOUT_HEADER -> index = parseCallout(lines, index, blocks);
                case BLOCK_QUOTE -> index = parseBlockQuote(lines, index, blocks);
                case FENCE -> index = parseFence(lines, index, blocks);
                case MATH_DELIMITER -> index = parseDisplayMath(lines, index, blocks);
                case HEADING -> {
                    blocks.add(heading(line));
                    index++;
                }
                case THEMATIC_BREAK -> {
                    blocks.add(new HorizontalRule());
                    index++;
                }
                case LIST_ITEM -> index = parseList(lines, index, blocks);
                case IMAGE -> {
                    blocks.add(image(line));
                    index++;
                }
                case TABLE_ROW -> index = TableParser.startsTable(lines, index)
                        ? tables.parse(lines, index, blocks)
                        : parseParagraph(lines, index, blocks);
                case TEXT -> index = parseParagraph(lines, index, blocks);
                default -> throw new IllegalStateException("Unhandled line kind on line " + line.number());
            }
        }
        return blocks;
    }

    private int parseCallout(List<SourceLine> lines, int start, List<Block> blocks) {
        Matcher header = LineClassifier.CALLOUT_HEADER.matcher(lines.get(start).text());
        if (!header.matches()) {
            throw new MarkdownParseException("callout", lines.get(start).number(), "invalid callout header");
        }
        List<SourceLine> body = new ArrayList<>();
        int index = start + 1;
        while (index < lines.size()) {
            SourceLine line = lines.get(index);
            if (LineClassifier.CALLOUT_HEADER.matcher(line.text()).matches()) {
                break;
            }
            Matcher quote = LineClassifier.BLOCK_QUOTE.matcher(line.text());
            if (!quote.matches()) {
                break;
            }
            body.add(line.withText(quote.group("rest")));
            index++;
        }
        String title = header.group("title");
        Optional<List<Inline>> inlineTitle = title == null || title.isBlank()
                ? Optional.empty()
                : Optional.of(inline.transform(title.strip()));
        blocks.add(new Callout(header.group("kind"), inlineTitle, parseContainer(body)));
        return index;
    }

    private int parseBlockQuote(List<SourceLine> lines, int start, List<Block> blocks) {
        List<SourceLine> body = new ArrayList<>();
        int index = start;
        while (index < lines.size()) {
            SourceLine line = lines.get(index);
            Matcher quote = LineClassifier.BLOCK_QUOTE.matcher(line.text());
            if (!quote.matches() || LineClassifier.CALLOUT_HEADER.matcher(line.text()).matches()) {
                break;
            }
            body.add(line.withText(quote.group("rest")));
            index++;
        }
        blocks.addAll(parseContainer(body));
        return index;
    }

    private int parseFence(List<SourceLine> lines, int start, List<Block> blocks) {
        Matcher opening = LineClassifier.FENCE.matcher(lines.get(start).text());
        if (!opening.matches()) {
            throw new MarkdownParseException("code block", lines.get(start).number(), "invalid fence");
        }
        String fence = opening.group("fence");
        int indent = LineClassifier.indentWidth(opening.group("indent"));
        List<String> content = new ArrayList<>();
        int index = start + 1;
        while (index < lines.size()) {
            String text = lines.get(index).text();
            if (FootnoteExtractor.FenceTracker.closes(fence, text)) {
                index++;
                break;
            }
            content.add(LineClassifier.dedent(text, indent));
            index++;
        }
        String language = opening.group("lang");
        blocks.add(new CodeBlock(Optional.of(language), String.join("\n", content)));
        return index;
    }

    private int parseDisplayMath(List<SourceLine> lines, int start, List<Block> blocks) {
        String first = lines.get(start).text().strip();
        String open = first.startsWith("$$") ? "$$" : "\\[";
        String close = open.equals("$$") ? "$$" : "\\]";
        if (first.length() > 4 && first.endsWith(close)) {
            addDisplayMath(first.substring(2, first.length() - 2), blocks);
            return start + 1;
        }
        List<String> content = new ArrayList<>();
        String rest = first.substring(2).strip();
        if (!rest.isEmpty()) {
            content.add(rest);
        }
        int index = start + 1;
        while (index < lines.size()) {
            String text = lines.get(index).text().strip();
            index++;
            if (text.endsWith(close)) {
                String tail = text.substring(0, text.length() - close.length()).strip();
                if (!tail.isEmpty()) {
                    content.add(tail);
                }
                break;
            }
            content.add(text);
        }
        addDisplayMath(String.join("\n", content), blocks);
        return index;
    }

    private static void addDisplayMath(String literal, List<Block> blocks) {
        blocks.add(new Paragraph(List.of(new MathSpan(false, literal.strip()))));
    }

    private Heading heading(SourceLine line) {
        Matcher matcher = LineClassifier.HEADING.matcher(line.text());
        if (!matcher.matches()) {
            throw new MarkdownParseException("heading", line.number(), "invalid heading");
        }
        String title = matcher.group("title");
        Optional<String> label = Optional.empty();
        Matcher explicit = EXPLICIT_LABEL.matcher(title);
        if (explicit.find()) {
            label = Optional.of(explicit.group(1));
            title = title.substring(0, explicit.start());
        }
        title = CLOSING_HASHES.matcher(title.strip()).replaceFirst("").strip();
        return new Heading(matcher.group("marks").length(), inline.transform(title), label);
    }

    private static Image image(SourceLine line) {
        Matcher markdown = LineClassifier.MARKDOWN_IMAGE.matcher(line.text());
        if (markdown.matches()) {
            return new Image(markdown.group("src"), markdown.group("alt"), Optional.ofNullable(markdown.group("width")));
        }
        Matcher html = LineClassifier.HTML_IMAGE.matcher(line.text());
        if (!html.matches()) {
            throw new MarkdownParseException("image", line.number(), "invalid image line");
        }
        String attributes = html.group("attrs");
        String source = LineClassifier.htmlAttribute(attributes, "src")
                .orElseThrow(() -> new MarkdownParseException("image", line.number(), "image without src"));
        return new Image(source,
                LineClassifier.htmlAttribute(attributes, "alt").orElse(""),
                LineClassifier.htmlAttribute(attributes, "width"));
    }

    private int parseList(List<SourceLine> lines, int start, List<Block> blocks) {
        Matcher first = LineClassifier.LIST_ITEM.matcher(lines.get(start).text());
        if (!first.matches()) {
            throw new MarkdownParseException("list", lines.get(start).number(), "invalid list item");
        }
        int baseIndent = LineClassifier.indentWidth(first.group("indent"));
        boolean ordered = isOrdered(first.group("marker"));
        List<ListItem> items = new ArrayList<>();
        int index = start;
        while (index < lines.size()) {
            SourceLine line = lines.get(index);
            if (line.isBlank()) {
                index++;
                continue;
            }
            Matcher item = LineClassifier.LIST_ITEM.matcher(line.text());
            if (!item.matches()
                    || LineClassifier.THEMATIC_BREAK.matcher(line.text()).matches()
                    || LineClassifier.indentWidth(item.group("indent")) != baseIndent
                    || isOrdered(item.group("marker")) != ordered) {
                break;
            }
            index = parseListItem(lines, index, item, items);
        }
        blocks.add(new ListBlock(ordered, items));
        return trimTrailingBlanks(lines, start, index);
    }

    private int parseListItem(List<SourceLine> lines, int start, Matcher item, List<ListItem> items) {
        int baseIndent = LineClassifier.indentWidth(item.group("indent"));
        int contentColumn = baseIndent + (item.start("content") - item.end("indent"));
        List<SourceLine> itemLines = new ArrayList<>();
        String firstContent = item.group("content").strip();
        if (!firstContent.isEmpty()) {
            itemLines.add(lines.get(start).withText(firstContent));
        }
        int index = start + 1;
        while (index < lines.size()) {
            SourceLine line = lines.get(index);
            if (line.isBlank()) {
                itemLines.add(line);
                index++;
                continue;
            }
            Matcher next = LineClassifier.LIST_ITEM.matcher(line.text());
            if (next.matches() && LineClassifier.indentWidth(next.group("indent")) <= baseIndent) {
                break;
            }
            if (LineClassifier.indentWidth(line.text()) <= baseIndent) {
                break;
            }
            itemLines.add(line.withText(LineClassifier.dedent(line.text(), contentColumn)));
            index++;
        }
        items.add(new ListItem(parseContainer(itemLines)));
        return index;
    }

    // blank lines swallowed by the last item belong to whatever follows the list
    private static int trimTrailingBlanks(List<SourceLine> lines, int start, int end) {
        int index = end;
        while (index > start + 1 && lines.get(index - 1).isBlank()) {
            index--;
        }
        return index;
    }

    private static boolean isOrdered(String marker) {
        return Character.isDigit(marker.charAt(0));
    }

    private int parseParagraph(List<SourceLine> lines, int start, List<Block> blocks) {
        List<String> text = new ArrayList<>();
        text.add(lines.get(start).text().stripLeading());
        int index = start + 1;
        while (index < lines.size()) {
            SourceLine line = lines.get(index);
            LineKind kind = LineClassifier.classify(line.text());
            boolean continues = kind == LineKind.TEXT
                    || (kind == LineKind.TABLE_ROW && !TableParser.startsTable(lines, index));
            if (!continues) {
                break;
            }
            text.add(line.text().stripLeading());
            index++;
        }
        String joined = String.join("\n", text).stripTrailing();
        blocks.add(new Paragraph(inline.transform(joined)));
        return index;
    }
}
