package ai.docsite.latex.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigOverridesTest {

    @Test
    void nestsDottedKeys() {
        Map<String, Object> overrides = ConfigOverrides.fromDottedPairs(List.of(
                "headings.anchor_level=2",
                "headings.commands.1=chapter",
                "labels.label_prefix = ch1 "));

        assertThat(overrides).containsOnlyKeys("headings", "labels");
        assertThat(overrides.get("headings")).isEqualTo(Map.of("anchor_level", "2", "commands", Map.of("1", "chapter")));
        assertThat(overrides.get("labels")).isEqualTo(Map.of("label_prefix", "ch1"));
    }

    @Test
    void keepsEqualsSignsInValues() {
        Map<String, Object> overrides = ConfigOverrides.fromDottedPairs(List.of("code_blocks.options_template=language={language}"));

        assertThat(overrides.get("code_blocks")).isEqualTo(Map.of("options_template", "language={language}"));
    }

    @Test
    void rejectsPairsWithoutValue() {
        Throwable thrown = catchThrowable(() -> ConfigOverrides.fromDottedPairs(List.of("headings.anchor_level")));

        assertThat(thrown).isInstanceOf(ConfigException.class);
    }

    @Test
    void rejectsKeysWithoutSection() {
        Throwable thrown = catchThrowable(() -> ConfigOverrides.fromDottedPairs(List.of("strict=true")));

        assertThat(thrown).isInstanceOf(ConfigException.class)
                .hasMessageContaining("strict");
    }

    @Test
    void extendsSectionsFromAnImmutableMap() {
        Map<String, Object> overrides = new LinkedHashMap<>(Map.of("parsing", Map.of("strict", false)));

        ConfigOverrides.put(overrides, "parsing.strip_front_matter", true);

        assertThat(overrides.get("parsing")).isEqualTo(Map.of("strict", false, "strip_front_matter", true));
    }

    @Test
    void rejectsSectionThatIsAlreadyAScalar() {
        Throwable thrown = catchThrowable(() -> ConfigOverrides.fromDottedPairs(List.of(
                "labels.label_prefix=sec", "labels.label_prefix.extra=x")));

        assertThat(thrown).isInstanceOf(ConfigException.class)
                .hasMessageContaining("scalar");
    }
}
