package ai.docsite.latex.ast;

/**
 * Column alignment taken from a table separator row.
 */
public enum Alignment {
    LEFT("l"),
    CENTER("c"),
    RIGHT("r");

    private final String columnSpec;

    Alignment(String columnSpec) {
        this.columnSpec = columnSpec;
    }

    public String columnSpec() {
        return columnSpec;
    }
}
