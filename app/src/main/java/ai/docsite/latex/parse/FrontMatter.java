package ai.docsite.latex.parse;

import java.util.List;

/**
 * Leading metadata block delimited by {@code ---} and closed by {@code ---} or {@code ...}.
 */
final class FrontMatter {

    private FrontMatter() {
    }

    /**
     * Returns the lines after the front matter block, or {@code lines} unchanged when the input does not start with
     * one or the block is never closed.
     */
    static List<SourceLine> strip(List<SourceLine> lines) {
        if (lines.isEmpty() || !lines.get(0).text().strip().equals("---")) {
            return lines;
        }
        for (int i = 1; i < lines.size(); i++) {
            String text = lines.get(i).text().strip();
            if (text.equals("---") || text.equals("...")) {
                return lines.subList(i + 1, lines.size());
            }
        }
        return lines;
    }
}
