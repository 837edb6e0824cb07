package ai.docsite.latex.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts flat {@code section.key=value} pairs into the nested override maps used by
 * {@link ConversionConfigResolver}.
 */
public final class ConfigOverrides {

    private ConfigOverrides() {
    }

    public static Map<String, Object> fromDottedPairs(List<String> pairs) {
        Map<String, Object> root = new LinkedHashMap<>();
        if (pairs == null) {
            return root;
        }
        for (String pair : pairs) {
            int separator = pair.indexOf('=');
            if (separator <= 0) {
                throw new ConfigException(pair, "override must have the form section.key=value");
            }
            String path = pair.substring(0, separator).trim();
            String value = pair.substring(separator + 1).trim();
            put(root, path, value);
        }
        return root;
    }

    static void put(Map<String, Object> root, String path, Object value) {
        String[] segments = path.split("\\.");
        if (segments.length < 2) {
            throw new ConfigException(path, "override key must name a section and a key");
        }
        Map<String, Object> current = root;
        for (int i = 0; i < segments.length - 1; i++) {
            String segment = segments[i].trim();
            if (segment.isEmpty()) {
                throw new ConfigException(path, "override key has an empty segment");
            }
            Map<String, Object> section = section(current.get(segment), path, segment);
            current.put(segment, section);
            current = section;
        }
        String leaf = segments[segments.length - 1].trim();
        if (leaf.isEmpty()) {
            throw new ConfigException(path, "override key has an empty segment");
        }
        current.put(leaf, value);
    }

    // nested sections are rebuilt as String-keyed copies so they can be extended in place
    private static Map<String, Object> section(Object existing, String path, String segment) {
        Map<String, Object> section = new LinkedHashMap<>();
        if (existing == null) {
            return section;
        }
        if (!(existing instanceof Map<?, ?> map)) {
            throw new ConfigException(path, "conflicts with a scalar override for " + segment);
        }
        map.forEach((key, value) -> section.put(String.valueOf(key), value));
        return section;
    }
}
