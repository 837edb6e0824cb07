package ai.docsite.latex.inline;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SlugsTest {

    @Test
    void collapsesNonAlphanumericRuns() {
        assertThat(Slugs.slugify("My Note", "-")).isEqualTo("my-note");
        assertThat(Slugs.slugify("  Results & Discussion!  ", "-")).isEqualTo("results-discussion");
        assertThat(Slugs.slugify("C++ / Java", "_")).isEqualTo("c_java");
    }

    @Test
    void keepsNonAsciiLetters() {
        assertThat(Slugs.slugify("Économie générale", "-")).isEqualTo("économie-générale");
    }

    @Test
    void labelFallsBackWhenNothingAlphanumericRemains() {
        assertThat(Slugs.slugify("???", "-")).isEmpty();
        assertThat(Slugs.label("???", "-")).isEqualTo("section");
        assertThat(Slugs.label("Overview", "-")).isEqualTo("overview");
    }
}
