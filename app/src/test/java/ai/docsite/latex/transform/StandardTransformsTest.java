package ai.docsite.latex.transform;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.latex.ast.Callout;
import ai.docsite.latex.ast.Document;
import ai.docsite.latex.ast.Emphasis;
import ai.docsite.latex.ast.HorizontalRule;
import ai.docsite.latex.ast.ListBlock;
import ai.docsite.latex.ast.ListItem;
import ai.docsite.latex.ast.Paragraph;
import ai.docsite.latex.ast.Text;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class StandardTransformsTest {

    private static Paragraph paragraph(String text) {
        return new Paragraph(List.of(new Text(text)));
    }

    @Test
    void registersBothStandardTransforms() {
        TransformRegistry registry = new TransformRegistry();

        StandardTransforms.registerAll(registry);

        assertThat(registry.names()).containsExactly(
                StandardTransforms.DROP_HORIZONTAL_RULES, StandardTransforms.UNWRAP_CALLOUTS);
    }

    @Test
    void dropsRulesAtEveryDepth() {
        Document document = new Document(List.of(
                paragraph("a"),
                new HorizontalRule(),
                new ListBlock(false, List.of(new ListItem(List.of(paragraph("b"), new HorizontalRule()))))),
                Map.of());

        Document result = StandardTransforms.dropHorizontalRules(document);

        assertThat(result.children()).containsExactly(
                paragraph("a"),
                new ListBlock(false, List.of(new ListItem(List.of(paragraph("b"))))));
    }

    @Test
    void unwrapsNestedCalloutsWithTitles() {
        Callout inner = new Callout("tip", Optional.empty(), List.of(paragraph("inner")));
        Callout outer = new Callout("note", Optional.of(List.of(new Text("Heads up"))), List.of(paragraph("body"), inner));
        Document document = new Document(List.of(outer, paragraph("after")), Map.of());

        Document result = StandardTransforms.unwrapCallouts(document);

        assertThat(result.children()).containsExactly(
                new Paragraph(List.of(new Emphasis(true, List.of(new Text("Heads up"))))),
                paragraph("body"),
                paragraph("inner"),
                paragraph("after"));
    }

    @Test
    void leavesInputDocumentUntouched() {
        Document document = new Document(List.of(new HorizontalRule()), Map.of());

        StandardTransforms.dropHorizontalRules(document);

        assertThat(document.children()).containsExactly(new HorizontalRule());
    }
}
