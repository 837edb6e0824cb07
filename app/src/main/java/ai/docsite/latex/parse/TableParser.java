package ai.docsite.latex.parse;

import ai.docsite.latex.ast.Alignment;
import ai.docsite.latex.ast.Table;
import ai.docsite.latex.ast.TableCell;
import ai.docsite.latex.ast.TableRow;
import ai.docsite.latex.diagnostics.DiagnosticKind;
import ai.docsite.latex.diagnostics.Diagnostics;
import ai.docsite.latex.inline.InlineTransformer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pipe tables. Cells may end with span metadata such as {@code {col=2}}, {@code {row=3}} or {@code {col=2, row=2}};
 * the token is removed from the cell text.
 */
final class TableParser {

    private static final Pattern SPAN_TOKEN = Pattern.compile("\\{([^{}]*=[^{}]*)\\}\\s*$");

    private final InlineTransformer inline;
    private final boolean strict;
    private final Diagnostics diagnostics;

    TableParser(InlineTransformer inline, boolean strict, Diagnostics diagnostics) {
        this.inline = inline;
        this.strict = strict;
        this.diagnostics = diagnostics;
    }

    static boolean startsTable(List<SourceLine> lines, int index) {
        return index + 1 < lines.size()
                && LineClassifier.TABLE_ROW.matcher(lines.get(index).text()).matches()
                && LineClassifier.isTableSeparator(lines.get(index + 1).text());
    }

    /**
     * Parses the table starting at {@code start}; returns the index of the first line after it.
     */
    int parse(List<SourceLine> lines, int start, List<? super Table> out) {
        SourceLine headerLine = lines.get(start);
        List<Alignment> alignments = alignments(lines.get(start + 1).text());
        TableRow header = row(headerLine, alignments.size());
        List<TableRow> rows = new ArrayList<>();
        int index = start + 2;
        while (index < lines.size() && LineClassifier.TABLE_ROW.matcher(lines.get(index).text()).matches()) {
            rows.add(row(lines.get(index), alignments.size()));
            index++;
        }
        out.add(new Table(alignments, header, rows));
        return index;
    }

    private TableRow row(SourceLine line, int columns) {
        List<TableCell> cells = new ArrayList<>();
        for (String raw : splitOuter(line.text().strip())) {
            cells.add(cell(raw.strip(), line));
        }
        TableRow row = new TableRow(cells);
        if (row.width() == columns) {
            return row;
        }
        String message = "row has " + row.width() + " columns but the alignment row declares " + columns;
        if (strict) {
            throw new MarkdownParseException("table", line.number(), message);
        }
        diagnostics.report(DiagnosticKind.TABLE_SHAPE, "line " + line.number(), message);
        int width = row.width();
        while (width < columns) {
            cells.add(TableCell.empty());
            width++;
        }
        return new TableRow(cells);
    }

    private TableCell cell(String raw, SourceLine line) {
        String content = raw;
        int colspan = 1;
        int rowspan = 1;
        Matcher matcher = SPAN_TOKEN.matcher(raw);
        if (matcher.find() && isSpanToken(matcher.group(1))) {
            content = raw.substring(0, matcher.start()).strip();
            for (String entry : matcher.group(1).split(",")) {
                int equals = entry.indexOf('=');
                String key = equals < 0 ? entry.strip() : entry.substring(0, equals).strip().toLowerCase(Locale.ROOT);
                int span = equals < 0 ? 0 : parseSpan(entry.substring(equals + 1).strip());
                if (span < 1 || !(key.equals("col") || key.equals("row"))) {
                    malformed(matcher.group(), line);
                    continue;
                }
                if (key.equals("col")) {
                    colspan = span;
                } else {
                    rowspan = span;
                }
            }
        }
        return new TableCell(content.isEmpty() ? List.of() : inline.transform(content), colspan, rowspan);
    }

    private static boolean isSpanToken(String properties) {
        for (String entry : properties.split(",")) {
            int equals = entry.indexOf('=');
            if (equals < 0) {
                continue;
            }
            String key = entry.substring(0, equals).strip().toLowerCase(Locale.ROOT);
            if (key.equals("col") || key.equals("row")) {
                return true;
            }
        }
        return false;
    }

    private static int parseSpan(String value) {
        if (value.isEmpty() || value.length() > 4 || !value.chars().allMatch(Character::isDigit)) {
            return 0;
        }
        return Integer.parseInt(value);
    }

    private void malformed(String token, SourceLine line) {
        String message = "malformed cell span '" + token.strip() + "'";
        if (strict) {
            throw new MarkdownParseException("table", line.number(), message);
        }
        diagnostics.report(DiagnosticKind.MALFORMED_TABLE_SPAN, "line " + line.number(), message);
    }

    private static List<Alignment> alignments(String separator) {
        List<Alignment> alignments = new ArrayList<>();
        for (String raw : splitOuter(separator.strip())) {
            String cell = raw.strip();
            boolean left = cell.startsWith(":");
            boolean right = cell.endsWith(":");
            if (left && right) {
                alignments.add(Alignment.CENTER);
            } else if (right) {
                alignments.add(Alignment.RIGHT);
            } else {
                alignments.add(Alignment.LEFT);
            }
        }
        return alignments;
    }

    /**
     * Splits a row on unescaped pipes outside inline code, after dropping the outer pipes. {@code \|} becomes a
     * literal pipe in the cell text.
     */
    static List<String> splitOuter(String stripped) {
        String body = stripped.startsWith("|") ? stripped.substring(1) : stripped;
        if (body.endsWith("|") && !body.endsWith("\\|")) {
            body = body.substring(0, body.length() - 1);
        }
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int codeFence = 0;
        int index = 0;
        while (index < body.length()) {
            char ch = body.charAt(index);
            if (ch == '\\' && index + 1 < body.length() && body.charAt(index + 1) == '|') {
                current.append('|');
                index += 2;
                continue;
            }
            if (ch == '`') {
                int end = index;
                while (end < body.length() && body.charAt(end) == '`') {
                    end++;
                }
                int length = end - index;
                if (codeFence == 0 && body.indexOf("`".repeat(length), end) >= 0) {
                    codeFence = length;
                } else if (codeFence == length) {
                    codeFence = 0;
                }
                current.append(body, index, end);
                index = end;
                continue;
            }
            if (ch == '|' && codeFence == 0) {
                cells.add(current.toString());
                current.setLength(0);
            } else {
                current.append(ch);
            }
            index++;
        }
        cells.add(current.toString());
        return cells;
    }
}
