package ai.docsite.latex.transform;

import ai.docsite.latex.ast.Document;

/**
 * A named rewrite of the parsed document applied before generation. Implementations must return a document and
 * must not keep state between invocations.
 */
@FunctionalInterface
public interface DocumentTransform {

    Document apply(Document document);
}
