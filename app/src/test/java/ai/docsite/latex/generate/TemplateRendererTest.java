package ai.docsite.latex.generate;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateRendererTest {

    @Test
    void substitutesKnownPlaceholdersInsideLatexBraces() {
        assertThat(TemplateRenderer.render("\\label{{label}}", "label", "sec-intro")).isEqualTo("\\label{sec-intro}");
        assertThat(TemplateRenderer.render("\\href{{url}}{{text}}", Map.of("url", "https://x.io", "text", "X")))
                .isEqualTo("\\href{https://x.io}{X}");
    }

    @Test
    void leavesUnknownPlaceholdersLiteral() {
        assertThat(TemplateRenderer.render("\\rule{\\linewidth}{{other}}", "label", "x"))
                .isEqualTo("\\rule{\\linewidth}{{other}}");
    }

    @Test
    void doesNotRescanSubstitutedValues() {
        assertThat(TemplateRenderer.render("{a}", Map.of("a", "{b}", "b", "nope"))).isEqualTo("{b}");
    }
}
