package ai.docsite.latex.transform;

import ai.docsite.latex.config.ConfigException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Named document transforms. Registration is expected at startup; lookups are safe from any thread.
 */
public final class TransformRegistry {

    private static final TransformRegistry SHARED = new TransformRegistry();

    private final ConcurrentMap<String, DocumentTransform> transforms = new ConcurrentHashMap<>();

    /**
     * Process-wide registry, empty until something registers into it.
     */
    public static TransformRegistry shared() {
        return SHARED;
    }

    public void register(String name, DocumentTransform transform) {
        if (name == null || name.isBlank()) {
            throw new ConfigException("transforms", "transform name must not be blank");
        }
        Objects.requireNonNull(transform, "transform");
        DocumentTransform existing = transforms.putIfAbsent(name, transform);
        if (existing != null) {
            throw new ConfigException("transforms." + name, "a transform with this name is already registered");
        }
    }

    public boolean contains(String name) {
        return name != null && transforms.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(transforms.keySet());
    }

    /**
     * Validates every name before anything runs and returns the transforms as an ordered pipeline.
     */
    public TransformPipeline resolve(List<String> names) {
        if (names == null || names.isEmpty()) {
            return TransformPipeline.empty();
        }
        List<String> unknown = new ArrayList<>();
        List<TransformPipeline.Step> selected = new ArrayList<>();
        for (String name : names) {
            DocumentTransform transform = name == null ? null : transforms.get(name);
            if (transform == null) {
                unknown.add(String.valueOf(name));
            } else {
                selected.add(new TransformPipeline.Step(name, transform));
            }
        }
        if (!unknown.isEmpty()) {
            throw new ConfigException("transforms", "unknown transform(s) " + unknown + "; registered: " + names());
        }
        return new TransformPipeline(selected);
    }
}
