package ai.docsite.latex.ast;

public record LineBreak() implements Inline {

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitLineBreak(this);
    }
}
