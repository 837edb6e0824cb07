package ai.docsite.latex.ast;

public enum LinkKind {
    INTERNAL,
    EXTERNAL,
    WIKI
}
