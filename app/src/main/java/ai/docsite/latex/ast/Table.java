package ai.docsite.latex.ast;

import java.util.List;
import java.util.Objects;

public record Table(List<Alignment> alignments, TableRow header, List<TableRow> rows) implements Block {

    public Table {
        alignments = List.copyOf(alignments);
        header = Objects.requireNonNull(header, "header");
        rows = List.copyOf(rows);
    }

    public int columnCount() {
        return alignments.size();
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitTable(this);
    }
}
