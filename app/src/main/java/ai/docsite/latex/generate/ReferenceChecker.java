package ai.docsite.latex.generate;

import ai.docsite.latex.ast.Document;
import ai.docsite.latex.ast.DocumentTraversal;
import ai.docsite.latex.ast.FootnoteDefinition;
import ai.docsite.latex.ast.FootnoteRef;
import ai.docsite.latex.ast.Inline;
import ai.docsite.latex.ast.Link;
import ai.docsite.latex.ast.LinkKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Reference integrity, checked once on the final document before any output is produced.
 */
final class ReferenceChecker {

    private ReferenceChecker() {
    }

    static void check(Document document, Set<String> headingLabels, boolean checkInternalTargets) {
        List<Inline> inlines = new ArrayList<>();
        Consumer<Inline> collect = inlines::add;
        DocumentTraversal.forEachBlock(document.children(), block -> DocumentTraversal.forEachInline(block, collect));
        document.footnotes().values().forEach(definition -> DocumentTraversal.forEachInline(definition.body(), collect));

        for (Inline inline : inlines) {
            if (inline instanceof FootnoteRef ref && document.footnote(ref.id()).isEmpty()) {
                throw new UnresolvedReferenceException("footnote", ref.id(),
                        "no definition for footnote reference [^" + ref.id() + "]");
            }
            if (checkInternalTargets && inline instanceof Link link && link.target().kind() == LinkKind.INTERNAL
                    && !headingLabels.contains(link.target().destination())) {
                throw new UnresolvedReferenceException("internal link", link.target().destination(),
                        "no heading carries label '" + link.target().destination() + "'");
            }
        }
        for (FootnoteDefinition definition : document.footnotes().values()) {
            detectCycle(document, definition.id(), new ArrayDeque<>(), new HashSet<>());
        }
    }

    private static void detectCycle(Document document, String id, Deque<String> path, Set<String> done) {
        if (path.contains(id)) {
            List<String> cycle = new ArrayList<>(path);
            cycle.add(id);
            throw new UnresolvedReferenceException("footnote", id,
                    "footnotes reference each other in a cycle " + String.join(" -> ", cycle));
        }
        if (!done.add(id)) {
            return;
        }
        FootnoteDefinition definition = document.footnote(id).orElse(null);
        if (definition == null) {
            return;
        }
        path.addLast(id);
        List<String> nested = new ArrayList<>();
        DocumentTraversal.forEachInline(definition.body(), inline -> {
            if (inline instanceof FootnoteRef ref) {
                nested.add(ref.id());
            }
        });
        for (String next : nested) {
            detectCycle(document, next, path, done);
        }
        path.removeLast();
    }
}
