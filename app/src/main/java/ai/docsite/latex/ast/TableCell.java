package ai.docsite.latex.ast;

import java.util.List;

public record TableCell(List<Inline> content, int colspan, int rowspan) {

    public TableCell {
        content = List.copyOf(content);
        if (colspan < 1 || rowspan < 1) {
            throw new IllegalArgumentException("cell spans must be positive");
        }
    }

    public static TableCell empty() {
        return new TableCell(List.of(), 1, 1);
    }
}
