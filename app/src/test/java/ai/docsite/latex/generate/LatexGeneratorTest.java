package ai.docsite.latex.generate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.docsite.latex.ast.Document;
import ai.docsite.latex.ast.Heading;
import ai.docsite.latex.ast.Paragraph;
import ai.docsite.latex.ast.Text;
import ai.docsite.latex.config.ConfigOverrides;
import ai.docsite.latex.config.ConversionConfig;
import ai.docsite.latex.config.ConversionConfigResolver;
import ai.docsite.latex.diagnostics.Diagnostic;
import ai.docsite.latex.diagnostics.DiagnosticKind;
import ai.docsite.latex.diagnostics.Diagnostics;
import ai.docsite.latex.parse.MarkdownBlockParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LatexGeneratorTest {

    private final Diagnostics diagnostics = new Diagnostics();

    private String render(String markdown, String... overrides) {
        return render(markdown, (path, baseDir) -> true, overrides);
    }

    private String render(String markdown, ImageLocator locator, String... overrides) {
        ConversionConfig config = new ConversionConfigResolver()
                .resolve(ConfigOverrides.fromDottedPairs(List.of(overrides)));
        Document document = MarkdownBlockParser.parse(markdown, config, diagnostics);
        return new LatexGenerator(config, locator).generate(document, diagnostics);
    }

    @Test
    void rendersHeadingWithAutomaticLabel() {
        String latex = render("# Introduction", "labels.auto_label_headings=true", "labels.label_prefix=sec");

        assertThat(latex).isEqualTo("\\section{Introduction}\n\\label{sec-introduction}");
    }

    @Test
    void suffixesCollidingLabels() {
        String latex = render("## Overview\n\n## Overview", "labels.auto_label_headings=true", "labels.label_prefix=sec");

        assertThat(latex).isEqualTo("\\subsection{Overview}\n\\label{sec-overview}\n\n"
                + "\\subsection{Overview}\n\\label{sec-overview-1}");
    }

    @Test
    void collisionSuffixUsesConfiguredSeparator() {
        String latex = render("## Over View\n\n## Over View", "labels.auto_label_headings=true",
                "labels.label_prefix=sec", "labels.label_separator=_");

        assertThat(latex).isEqualTo("\\subsection{Over View}\n\\label{sec_over_view}\n\n"
                + "\\subsection{Over View}\n\\label{sec_over_view_1}");
    }

    @Test
    void explicitLabelsAreReservedBeforeAutomaticOnes() {
        String latex = render("# Intro\n\n# Other {#intro}", "labels.auto_label_headings=true");

        assertThat(latex).isEqualTo("\\section{Intro}\n\\label{intro-1}\n\n\\section{Other}\n\\label{intro}");
    }

    @Test
    void duplicateExplicitLabelsAreReported() {
        String latex = render("# A {#same}\n\n# B {#same}");

        assertThat(latex).contains("\\label{same}", "\\label{same-1}");
        assertThat(diagnostics.snapshot()).extracting(Diagnostic::kind).containsExactly(DiagnosticKind.DUPLICATE_LABEL);
    }

    @Test
    void anchorLevelShiftsSectioningCommands() {
        String latex = render("# Top\n\n## Sub\n\n### Deeper\n\n###### Deepest", "headings.anchor_level=2");

        assertThat(latex).isEqualTo("\\section{Top}\n\n\\section{Sub}\n\n\\subsection{Deeper}\n\n\\paragraph{Deepest}");
    }

    @Test
    void rendersCitations() {
        assertThat(render("[@doe2020]")).isEqualTo("\\cite{doe2020}");
        assertThat(render("[@doe2020, p. 12; @smith2021]")).isEqualTo("\\cite[p. 12]{doe2020} \\cite{smith2021}");
        assertThat(render("[@a; @b]")).isEqualTo("\\cite{a,b}");
    }

    @Test
    void rendersInlineFormatting() {
        assertThat(render("**b** *i* `a_b`")).isEqualTo("\\textbf{b} \\textit{i} \\texttt{a\\_b}");
        assertThat(render("a<br>b")).isEqualTo("a\\newline b");
        assertThat(render("area $x^2$")).isEqualTo("area $x^2$");
        assertThat(render("Compute $2*3*4$ now")).isEqualTo("Compute $2*3*4$ now");
    }

    @Test
    void rendersLinks() {
        assertThat(render("[site](https://example.org)")).isEqualTo("\\href{https://example.org}{site}");
        assertThat(render("<https://x.io>")).isEqualTo("\\url{https://x.io}");
        assertThat(render("[https://x.io](https://x.io)")).isEqualTo("\\url{https://x.io}");
        assertThat(render("[[My Note]]")).isEqualTo("\\hyperref[my-note]{My Note}");
    }

    @Test
    void internalLinksPointAtHeadingLabels() {
        String latex = render("# Somewhere\n\nSee [there](#Somewhere).",
                "labels.auto_label_headings=true", "links.check_internal_targets=true");

        assertThat(latex).endsWith("See \\ref{somewhere}.");
    }

    @Test
    void uncheckedInternalLinksRenderEvenWithoutTarget() {
        assertThat(render("[x](#nowhere)")).isEqualTo("\\ref{nowhere}");
    }

    @Test
    void checkedInternalLinkWithoutTargetFails() {
        Throwable thrown = catchThrowable(() -> render("[x](#nowhere)", "links.check_internal_targets=true"));

        assertThat(thrown).isInstanceOf(UnresolvedReferenceException.class).hasMessageContaining("nowhere");
    }

    @Test
    void inlinesFootnoteDefinitions() {
        assertThat(render("Claim[^1].\n\n[^1]: Source with *style*."))
                .isEqualTo("Claim\\footnote{Source with \\textit{style}.}.");
    }

    @Test
    void missingFootnoteDefinitionFails() {
        Throwable thrown = catchThrowable(() -> render("Claim[^x]."));

        assertThat(thrown).isInstanceOf(UnresolvedReferenceException.class).hasMessageContaining("[^x]");
    }

    @Test
    void footnoteCyclesFail() {
        Throwable thrown = catchThrowable(() -> render("A[^a]\n\n[^a]: see[^b]\n[^b]: back[^a]"));

        assertThat(thrown).isInstanceOf(UnresolvedReferenceException.class).hasMessageContaining("cycle");
    }

    @Test
    void rendersLists() {
        assertThat(render("- a\n- b\n  1. c")).isEqualTo("\\begin{itemize}\n\\item a\n\\item b\n"
                + "\\begin{enumerate}\n\\item c\n\\end{enumerate}\n\\end{itemize}");
    }

    @Test
    void rendersCodeBlocksWithSupportedLanguagesOnly() {
        assertThat(render("```python\nx = 1\n```"))
                .isEqualTo("\\begin{lstlisting}[language=python]\nx = 1\n\\end{lstlisting}");
        assertThat(render("```mermaid\ngraph\n```")).isEqualTo("\\begin{lstlisting}\ngraph\n\\end{lstlisting}");
    }

    @Test
    void rendersMappedAndUnmappedCallouts() {
        assertThat(render("> [!warning] Careful\n> body"))
                .isEqualTo("\\begin{warningbox}[Careful]\nbody\n\\end{warningbox}");
        assertThat(diagnostics.isEmpty()).isTrue();

        assertThat(render("> [!custom]\n> body")).isEqualTo("\\begin{calloutbox}[custom]\nbody\n\\end{calloutbox}");
        assertThat(diagnostics.snapshot()).extracting(Diagnostic::kind).containsExactly(DiagnosticKind.UNMAPPED_CALLOUT);
    }

    @Test
    void rendersTablesWithSpans() {
        String latex = render("| A | B |\n|:--|--:|\n| 1 | 2 |\n| wide {col=2} |\n| tall {row=2} | x |");

        assertThat(latex).isEqualTo(String.join("\n",
                "\\begin{tabular}{lr}",
                "\\hline",
                "A & B \\\\",
                "\\hline",
                "1 & 2 \\\\",
                "\\multicolumn{2}{c}{wide} \\\\",
                "\\multirow{2}{*}{tall} & x \\\\",
                "\\hline",
                "\\end{tabular}"));
    }

    @Test
    void rendersImagesAndReportsMissingFiles() {
        List<String> checked = new ArrayList<>();
        ImageLocator missing = (path, baseDir) -> {
            checked.add(path + "@" + baseDir.orElse(""));
            return false;
        };

        String latex = render("![Plot](img/plot.png){width=50}", missing,
                "images.validate_paths=true", "images.path_template=figures/{stem}.pdf", "images.base_dir=book");

        assertThat(latex).isEqualTo("\\begin{center}\n\\includegraphics[width=50px]{figures/plot.pdf}\n\\end{center}");
        assertThat(checked).containsExactly("figures/plot.pdf@book");
        assertThat(diagnostics.snapshot()).extracting(Diagnostic::kind).containsExactly(DiagnosticKind.MISSING_IMAGE);
    }

    @Test
    void imagesAreNotCheckedUnlessValidationIsEnabled() {
        String latex = render("![x](a.png){width=0.5\\linewidth}", (path, baseDir) -> {
            throw new AssertionError("locator must not be consulted");
        }, "images.environment=");

        assertThat(latex).isEqualTo("\\includegraphics[width=0.5\\linewidth]{a.png}");
    }

    @Test
    void rendersDisplayMathInConfiguredStyle() {
        assertThat(render("$$\nx\n$$")).isEqualTo("$$x$$");
        assertThat(render("$$\nx\n$$", "math.block_style=brackets")).isEqualTo("\\[x\\]");
    }

    @Test
    void normalizesCharactersAndEscapesOnlyWhenEnabled() {
        assertThat(render("a ≤ b & 50%")).isEqualTo("a \\leq b & 50%");
        assertThat(render("a ≤ b & 50%", "inline.escape_special_characters=true")).isEqualTo("a \\leq b \\& 50\\%");
    }

    @Test
    void separatesBlocksWithOneBlankLine() {
        assertThat(render("# A\n\ntext\n\n---")).isEqualTo("\\section{A}\n\ntext\n\n\\noindent\\rule{\\linewidth}{0.4pt}");
    }

    @Test
    void rendersHandBuiltDocuments() {
        Document document = new Document(List.of(
                new Heading(1, List.of(new Text("Title")), Optional.of("top")),
                new Paragraph(List.of(new Text("body")))), Map.of());

        String latex = LatexGenerator.generate(document, ConversionConfig.defaults(), diagnostics);

        assertThat(latex).isEqualTo("\\section{Title}\n\\label{top}\n\nbody");
    }
}
