package ai.docsite.latex.ast;

import java.util.List;

public record TableRow(List<TableCell> cells) {

    public TableRow {
        cells = List.copyOf(cells);
    }

    /**
     * Number of columns this row occupies once column spans are expanded.
     */
    public int width() {
        return cells.stream().mapToInt(TableCell::colspan).sum();
    }
}
