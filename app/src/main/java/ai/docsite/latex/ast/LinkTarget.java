package ai.docsite.latex.ast;

import java.util.Objects;

/**
 * Classified link destination. For internal and wiki links {@code destination} is the resolved label slug,
 * for external links it is the URL as written.
 */
public record LinkTarget(LinkKind kind, String destination) {

    public LinkTarget {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(destination, "destination");
    }

    public static LinkTarget internal(String label) {
        return new LinkTarget(LinkKind.INTERNAL, label);
    }

    public static LinkTarget external(String url) {
        return new LinkTarget(LinkKind.EXTERNAL, url);
    }

    public static LinkTarget wiki(String slug) {
        return new LinkTarget(LinkKind.WIKI, slug);
    }
}
