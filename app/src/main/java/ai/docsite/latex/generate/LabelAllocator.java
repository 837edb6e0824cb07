package ai.docsite.latex.generate;

import ai.docsite.latex.ast.Block;
import ai.docsite.latex.ast.Document;
import ai.docsite.latex.ast.DocumentTraversal;
import ai.docsite.latex.ast.Heading;
import ai.docsite.latex.config.ConversionConfig;
import ai.docsite.latex.diagnostics.DiagnosticKind;
import ai.docsite.latex.diagnostics.Diagnostics;
import ai.docsite.latex.inline.Slugs;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Assigns heading labels for one document. Explicit {@code {#id}} labels are reserved first, then automatic labels
 * are allocated in document pre-order; a taken label gets the first free numeric suffix, joined with the configured
 * label separator ({@code -1}, {@code -2}, ... by default).
 */
final class LabelAllocator {

    private final Map<Heading, String> labels = new IdentityHashMap<>();
    private final Set<String> taken = new HashSet<>();
    private final String separator;

    private LabelAllocator(String separator) {
        this.separator = separator;
    }

    static LabelAllocator allocate(Document document, ConversionConfig.LabelRules rules, Diagnostics diagnostics) {
        LabelAllocator allocator = new LabelAllocator(rules.separator());
        List<Heading> headings = new ArrayList<>();
        DocumentTraversal.forEachBlock(document.children(), block -> collectHeading(block, headings));
        for (Heading heading : headings) {
            if (heading.label().isEmpty()) {
                continue;
            }
            String label = rules.qualify(heading.label().get());
            if (allocator.taken.contains(label)) {
                diagnostics.report(DiagnosticKind.DUPLICATE_LABEL, label,
                        "explicit label '" + label + "' is used by more than one heading");
            }
            allocator.assign(heading, label);
        }
        if (rules.autoLabelHeadings()) {
            for (Heading heading : headings) {
                if (heading.label().isEmpty()) {
                    String base = rules.qualify(
                            Slugs.label(DocumentTraversal.plainText(heading.content()), rules.separator()));
                    allocator.assign(heading, base);
                }
            }
        }
        return allocator;
    }

    private static void collectHeading(Block block, List<Heading> headings) {
        if (block instanceof Heading heading) {
            headings.add(heading);
        }
    }

    private void assign(Heading heading, String base) {
        String candidate = base;
        int counter = 1;
        while (taken.contains(candidate)) {
            candidate = base + separator + counter;
            counter++;
        }
        taken.add(candidate);
        labels.put(heading, candidate);
    }

    Optional<String> labelFor(Heading heading) {
        return Optional.ofNullable(labels.get(heading));
    }

    Set<String> labels() {
        return Collections.unmodifiableSet(taken);
    }
}
