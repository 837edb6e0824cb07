package ai.docsite.latex.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConversionConfigResolverTest {

    private final ConversionConfigResolver resolver = new ConversionConfigResolver();

    @Test
    void defaultsDescribeStandardLatex() {
        ConversionConfig config = ConversionConfig.defaults();

        assertThat(config.headings().anchorLevel()).isEqualTo(1);
        assertThat(config.headings().commandFor(1)).isEqualTo("section");
        assertThat(config.headings().commandFor(3)).isEqualTo("subsubsection");
        assertThat(config.headings().commandFor(6)).isEqualTo("paragraph");
        assertThat(config.labels().autoLabelHeadings()).isFalse();
        assertThat(config.inline().boldCommand()).isEqualTo("textbf");
        assertThat(config.inline().escapeSpecialCharacters()).isFalse();
        assertThat(config.math().blockStyle()).isEqualTo(ConversionConfig.BlockStyle.DOLLARS);
        assertThat(config.callouts().environmentFor("Warning")).contains("warningbox");
        assertThat(config.callouts().environmentFor("custom")).isEmpty();
        assertThat(config.codeBlocks().supports("Python")).isTrue();
    }

    @Test
    void chapterScopeWinsOverGlobalScope() {
        Map<String, Object> global = ConfigOverrides.fromDottedPairs(List.of(
                "headings.anchor_level=2",
                "labels.label_prefix=book"));
        Map<String, Object> chapter = ConfigOverrides.fromDottedPairs(List.of("labels.label_prefix=ch1"));

        ConversionConfig config = resolver.resolve(global, chapter);

        assertThat(config.headings().anchorLevel()).isEqualTo(2);
        assertThat(config.labels().prefix()).isEqualTo("ch1");
        assertThat(config.headings().commandFor(2)).isEqualTo("section");
        assertThat(config.headings().commandFor(1)).isEqualTo("section");
    }

    @Test
    void commandNamesLoseTheirBackslash() {
        ConversionConfig config = resolver.resolve(Map.of("inline", Map.of("bold_command", "\\emph")));

        assertThat(config.inline().boldCommand()).isEqualTo("emph");
    }

    @Test
    void openMappingsAcceptNewEntries() {
        ConversionConfig config = resolver.resolve(Map.of(
                "callouts", Map.of("environments", Map.of("Spoiler", "spoilerbox")),
                "inline", Map.of("custom_markers", Map.of("==", "hl"))));

        assertThat(config.callouts().environmentFor("spoiler")).contains("spoilerbox");
        assertThat(config.callouts().environmentFor("note")).contains("notebox");
        assertThat(config.inline().customMarkers()).containsEntry("==", "hl");
    }

    @Test
    void rejectsUnknownKeys() {
        Throwable thrown = catchThrowable(() -> resolver.resolve(Map.of("headings", Map.of("anchor", 2))));

        assertThat(thrown).isInstanceOf(ConfigException.class)
                .hasMessageContaining("headings.anchor");
    }

    @Test
    void rejectsOutOfRangeAnchorLevel() {
        Throwable thrown = catchThrowable(() -> resolver.resolve(Map.of("headings", Map.of("anchor_level", 7))));

        assertThat(thrown).isInstanceOf(ConfigException.class)
                .hasMessageContaining("headings.anchor_level");
    }

    @Test
    void rejectsTemplatesWithoutRequiredPlaceholder() {
        Throwable thrown = catchThrowable(() -> resolver.resolve(Map.of("footnotes", Map.of("template", "\\footnote{}"))));

        assertThat(thrown).isInstanceOf(ConfigException.class)
                .hasMessageContaining("{text}");
    }

    @Test
    void rejectsInvalidBooleans() {
        Throwable thrown = catchThrowable(() -> resolver.resolve(Map.of("parsing", Map.of("strict", "maybe"))));

        assertThat(thrown).isInstanceOf(ConfigException.class)
                .hasMessageContaining("parsing.strict");
    }

    @Test
    void parsesTextualBooleansAndIntegers() {
        ConversionConfig config = resolver.resolve(ConfigOverrides.fromDottedPairs(List.of(
                "parsing.strict=yes",
                "labels.auto_label_headings=true",
                "math.block_style=brackets")));

        assertThat(config.parsing().strict()).isTrue();
        assertThat(config.labels().autoLabelHeadings()).isTrue();
        assertThat(config.math().blockStyle()).isEqualTo(ConversionConfig.BlockStyle.BRACKETS);
    }

    @Test
    void prefixQualifiesLabels() {
        ConversionConfig config = resolver.resolve(Map.of("labels", Map.of("label_prefix", "sec")));

        assertThat(config.labels().qualify("intro")).isEqualTo("sec-intro");
        assertThat(ConversionConfig.defaults().labels().qualify("intro")).isEqualTo("intro");
    }
}
