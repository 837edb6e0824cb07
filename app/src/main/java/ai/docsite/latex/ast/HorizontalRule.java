package ai.docsite.latex.ast;

public record HorizontalRule() implements Block {

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitHorizontalRule(this);
    }
}
