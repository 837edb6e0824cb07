package ai.docsite.latex.parse;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes the block construct a single line can open. Recognizers are tried in {@link LineKind} order and the
 * first match wins.
 */
final class LineClassifier {

    static final int TAB_WIDTH = 4;

    static final Pattern CALLOUT_HEADER = Pattern.compile(
            "^[ \\t]*>[ \\t]?\\[!(?<kind>[A-Za-z][A-Za-z0-9_-]*)\\][+-]?(?:[ \\t]+(?<title>.*?))?[ \\t]*$");
    static final Pattern BLOCK_QUOTE = Pattern.compile("^[ \\t]*> ?(?<rest>.*)$");
    static final Pattern FENCE = Pattern.compile(
            "^(?<indent>[ \\t]*)(?<fence>`{3,}|~{3,})[ \\t]*(?<lang>[A-Za-z0-9_+#.-]*)[^`]*$");
    static final Pattern HEADING = Pattern.compile("^(?<marks>#{1,6})[ \\t]+(?<title>.*?)[ \\t]*$");
    static final Pattern THEMATIC_BREAK = Pattern.compile("^[ \\t]{0,3}([-*_])(?:[ \\t]*\\1){2,}[ \\t]*$");
    static final Pattern LIST_ITEM = Pattern.compile(
            "^(?<indent>[ \\t]*)(?<marker>[-*+]|\\d{1,9}[.)])[ \\t]+(?<content>.*)$");
    static final Pattern MARKDOWN_IMAGE = Pattern.compile(
            "^[ \\t]*!\\[(?<alt>[^\\]]*)\\]\\((?<src>[^)\\s]+)(?:[ \\t]+\"[^\"]*\")?\\)"
                    + "(?:\\{[ \\t]*width[ \\t]*=[ \\t]*(?<width>[^}\\s]+)[ \\t]*\\})?[ \\t]*$");
    static final Pattern HTML_IMAGE = Pattern.compile("^[ \\t]*<img\\s+(?<attrs>[^>]*?)/?>[ \\t]*$",
            Pattern.CASE_INSENSITIVE);
    static final Pattern TABLE_ROW = Pattern.compile("^[ \\t]*\\|.*$");
    static final Pattern SEPARATOR_CELL = Pattern.compile("^:?-+:?$");

    private LineClassifier() {
    }

    static LineKind classify(String line) {
        if (line == null || line.isBlank()) {
            return LineKind.BLANK;
        }
        if (CALLOUT_HEADER.matcher(line).matches()) {
            return LineKind.CALLOUT_HEADER;
        }
        if (BLOCK_QUOTE.matcher(line).matches()) {
            return LineKind.BLOCK_QUOTE;
        }
        if (FENCE.matcher(line).matches()) {
            return LineKind.FENCE;
        }
        if (isMathDelimiter(line)) {
            return LineKind.MATH_DELIMITER;
        }
        if (HEADING.matcher(line).matches()) {
            return LineKind.HEADING;
        }
        if (THEMATIC_BREAK.matcher(line).matches()) {
            return LineKind.THEMATIC_BREAK;
        }
        if (LIST_ITEM.matcher(line).matches()) {
            return LineKind.LIST_ITEM;
        }
        if (MARKDOWN_IMAGE.matcher(line).matches() || isHtmlImage(line)) {
            return LineKind.IMAGE;
        }
        if (TABLE_ROW.matcher(line).matches()) {
            return LineKind.TABLE_ROW;
        }
        return LineKind.TEXT;
    }

    static boolean isMathDelimiter(String line) {
        String stripped = line.strip();
        if (stripped.equals("$$") || stripped.equals("\\[")) {
            return true;
        }
        if (stripped.length() > 4 && stripped.startsWith("$$") && stripped.endsWith("$$")) {
            return true;
        }
        return stripped.length() > 4 && stripped.startsWith("\\[") && stripped.endsWith("\\]");
    }

    static boolean isHtmlImage(String line) {
        Matcher matcher = HTML_IMAGE.matcher(line);
        return matcher.matches() && htmlAttribute(matcher.group("attrs"), "src").isPresent();
    }

    static Optional<String> htmlAttribute(String attributes, String name) {
        Matcher matcher = Pattern.compile("(?i)\\b" + name + "\\s*=\\s*\"([^\"]*)\"").matcher(attributes);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * True when {@code line} is a table alignment row such as {@code |:--|--:|}.
     */
    static boolean isTableSeparator(String line) {
        String stripped = line.strip();
        if (!stripped.startsWith("|") || !stripped.contains("-")) {
            return false;
        }
        for (String cell : TableParser.splitOuter(stripped)) {
            if (!SEPARATOR_CELL.matcher(cell.strip()).matches()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Leading indentation width, counting a tab as {@value #TAB_WIDTH} columns.
     */
    static int indentWidth(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == ' ') {
                width++;
            } else if (ch == '\t') {
                width += TAB_WIDTH;
            } else {
                break;
            }
        }
        return width;
    }

    /**
     * Removes up to {@code columns} columns of leading indentation.
     */
    static String dedent(String line, int columns) {
        int width = 0;
        int index = 0;
        while (index < line.length() && width < columns) {
            char ch = line.charAt(index);
            if (ch == ' ') {
                width++;
            } else if (ch == '\t') {
                width += TAB_WIDTH;
            } else {
                break;
            }
            index++;
        }
        return line.substring(index);
    }
}
