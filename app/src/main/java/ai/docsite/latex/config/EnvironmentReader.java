package ai.docsite.latex.config;

import java.util.Optional;

/**
 * Source of environment values, replaceable in tests.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    default Optional<String> getNonBlank(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }
}
