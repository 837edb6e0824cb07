package ai.docsite.latex.inline;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.latex.ast.Citation;
import ai.docsite.latex.ast.CitationEntry;
import ai.docsite.latex.ast.CustomMarker;
import ai.docsite.latex.ast.Emphasis;
import ai.docsite.latex.ast.FootnoteRef;
import ai.docsite.latex.ast.Inline;
import ai.docsite.latex.ast.InlineCode;
import ai.docsite.latex.ast.LineBreak;
import ai.docsite.latex.ast.Link;
import ai.docsite.latex.ast.LinkTarget;
import ai.docsite.latex.ast.MathSpan;
import ai.docsite.latex.ast.Text;
import ai.docsite.latex.config.ConversionConfig;
import ai.docsite.latex.config.ConversionConfigResolver;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class InlineTransformerTest {

    private final InlineTransformer transformer = new InlineTransformer(ConversionConfig.defaults());

    @Test
    void plainTextStaysOneNode() {
        assertThat(transformer.transform("just words")).containsExactly(new Text("just words"));
    }

    @Test
    void codeSpansAreOpaque() {
        List<Inline> result = transformer.transform("run `**x** [@key]` now");

        assertThat(result).containsExactly(
                new Text("run "),
                new InlineCode("**x** [@key]"),
                new Text(" now"));
    }

    @Test
    void resolvesStrongAndNestedEmphasis() {
        List<Inline> result = transformer.transform("**bold *and italic***");

        assertThat(result).containsExactly(new Emphasis(true, List.of(
                new Text("bold "),
                new Emphasis(false, List.of(new Text("and italic"))))));
    }

    @Test
    void intrawordUnderscoresAreLiteral() {
        assertThat(transformer.transform("snake_case_name")).containsExactly(new Text("snake_case_name"));
        assertThat(transformer.transform("_word_")).containsExactly(new Emphasis(false, List.of(new Text("word"))));
    }

    @Test
    void unmatchedDelimitersStayText() {
        assertThat(transformer.transform("2 * 3 = 6")).containsExactly(new Text("2 * 3 = 6"));
    }

    @Test
    void parsesSingleCitation() {
        assertThat(transformer.transform("[@doe2020]")).containsExactly(
                new Citation(List.of(new CitationEntry("doe2020", Optional.empty()))));
    }

    @Test
    void parsesCitationsWithLocators() {
        assertThat(transformer.transform("[@doe2020, p. 12; @smith2021]")).containsExactly(
                new Citation(List.of(
                        new CitationEntry("doe2020", Optional.of("p. 12")),
                        new CitationEntry("smith2021", Optional.empty()))));
    }

    @Test
    void bracketWithAnEntryLackingAtSignIsNotACitation() {
        assertThat(transformer.transform("[@a; foo]")).containsExactly(new Text("[@a; foo]"));
        assertThat(transformer.transform("see [@a; @b, ch. 2]")).containsExactly(
                new Text("see "),
                new Citation(List.of(
                        new CitationEntry("a", Optional.empty()),
                        new CitationEntry("b", Optional.of("ch. 2")))));
    }

    @Test
    void wikiLinksCarrySlugAndDisplayText() {
        assertThat(transformer.transform("[[My Note]]")).containsExactly(
                new Link(LinkTarget.wiki("my-note"), List.of(new Text("My Note"))));
        assertThat(transformer.transform("[[My Note|see here]]")).containsExactly(
                new Link(LinkTarget.wiki("my-note"), List.of(new Text("see here"))));
    }

    @Test
    void distinguishesInternalExternalAndAutolinks() {
        List<Inline> result = transformer.transform("[Intro](#Getting Started) and [site](https://example.org) <https://x.io>");

        assertThat(result).containsExactly(
                new Text("[Intro](#Getting Started) and "),
                new Link(LinkTarget.external("https://example.org"), List.of(new Text("site"))),
                new Text(" "),
                new Link(LinkTarget.external("https://x.io"), List.of()));
        assertThat(transformer.transform("[Intro](#getting-started)")).containsExactly(
                new Link(LinkTarget.internal("getting-started"), List.of(new Text("Intro"))));
    }

    @Test
    void linkTextKeepsEmphasis() {
        assertThat(transformer.transform("[**bold** link](https://example.org)")).containsExactly(
                new Link(LinkTarget.external("https://example.org"), List.of(
                        new Emphasis(true, List.of(new Text("bold"))),
                        new Text(" link"))));
    }

    @Test
    void footnoteReferenceIsNotACitation() {
        assertThat(transformer.transform("claim[^1].")).containsExactly(
                new Text("claim"), new FootnoteRef("1"), new Text("."));
    }

    @Test
    void imageSyntaxIsNotALink() {
        assertThat(transformer.transform("![alt](pic.png)")).containsExactly(new Text("![alt](pic.png)"));
    }

    @Test
    void recognizesInlineAndDisplayMath() {
        assertThat(transformer.transform("area $\\pi r^2$ here")).containsExactly(
                new Text("area "), new MathSpan(true, "\\pi r^2"), new Text(" here"));
        assertThat(transformer.transform("\\(x\\) and $$ y $$")).containsExactly(
                new MathSpan(true, "x"), new Text(" and "), new MathSpan(false, "y"));
    }

    @Test
    void emphasisMarkersInsideMathStayLiteral() {
        assertThat(transformer.transform("Compute $2*3*4$ now")).containsExactly(
                new Text("Compute "), new MathSpan(true, "2*3*4"), new Text(" now"));
        assertThat(transformer.transform("\\(a_1 * b_1\\) and $$x_i * y_i$$")).containsExactly(
                new MathSpan(true, "a_1 * b_1"), new Text(" and "), new MathSpan(false, "x_i * y_i"));
    }

    @Test
    void mathInsideStrongIsStillMath() {
        assertThat(transformer.transform("**sum $a*b*c$**")).containsExactly(
                new Emphasis(true, List.of(new Text("sum "), new MathSpan(true, "a*b*c"))));
    }

    @Test
    void escapedDollarIsNotMath() {
        assertThat(transformer.transform("costs \\$5 and \\$6")).containsExactly(new Text("costs \\$5 and \\$6"));
    }

    @Test
    void recognizesLineBreaks() {
        assertThat(transformer.transform("one<br>two")).containsExactly(
                new Text("one"), new LineBreak(), new Text("two"));
        assertThat(transformer.transform("one  \ntwo")).containsExactly(
                new Text("one"), new LineBreak(), new Text("\ntwo"));
    }

    @Test
    void recognizesConfiguredCustomMarkers() {
        ConversionConfig config = new ConversionConfigResolver().resolve(
                Map.of("inline", Map.of("custom_markers", Map.of("==", "hl"))));

        assertThat(InlineTransformer.transform("a ==marked== word", config)).containsExactly(
                new Text("a "), new CustomMarker("==", "marked"), new Text(" word"));
    }

    @Test
    void internalAnchorsUseLabelPrefix() {
        ConversionConfig config = new ConversionConfigResolver().resolve(
                Map.of("labels", Map.of("label_prefix", "sec")));

        assertThat(InlineTransformer.transform("[see](#Overview)", config)).containsExactly(
                new Link(LinkTarget.internal("sec-overview"), List.of(new Text("see"))));
    }
}
