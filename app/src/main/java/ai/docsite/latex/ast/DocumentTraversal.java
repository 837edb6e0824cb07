package ai.docsite.latex.ast;

import java.util.List;
import java.util.function.Consumer;

/**
 * Read-only traversal helpers shared by the generator and reference checks.
 *
 * <p>Blocks are visited in document pre-order: a container before its children, children in source order.
 */
public final class DocumentTraversal {

    private DocumentTraversal() {
    }

    public static void forEachBlock(List<Block> blocks, Consumer<Block> action) {
        for (Block block : blocks) {
            action.accept(block);
            if (block instanceof ListBlock list) {
                for (ListItem item : list.items()) {
                    forEachBlock(item.children(), action);
                }
            } else if (block instanceof Callout callout) {
                forEachBlock(callout.body(), action);
            }
        }
    }

    /**
     * Visits every inline node directly owned by {@code block}, descending into emphasis and link children but not
     * into nested blocks.
     */
    public static void forEachInline(Block block, Consumer<Inline> action) {
        if (block instanceof Heading heading) {
            forEachInline(heading.content(), action);
        } else if (block instanceof Paragraph paragraph) {
            forEachInline(paragraph.content(), action);
        } else if (block instanceof Callout callout) {
            callout.title().ifPresent(title -> forEachInline(title, action));
        } else if (block instanceof Table table) {
            forEachCell(table.header(), action);
            table.rows().forEach(row -> forEachCell(row, action));
        }
    }

    public static void forEachInline(List<Inline> inlines, Consumer<Inline> action) {
        for (Inline inline : inlines) {
            action.accept(inline);
            if (inline instanceof Emphasis emphasis) {
                forEachInline(emphasis.children(), action);
            } else if (inline instanceof Link link) {
                forEachInline(link.children(), action);
            }
        }
    }

    /**
     * Flattens inline content to the text a reader would see, used for slugs.
     */
    public static String plainText(List<Inline> inlines) {
        StringBuilder builder = new StringBuilder();
        appendPlainText(inlines, builder);
        return builder.toString();
    }

    private static void forEachCell(TableRow row, Consumer<Inline> action) {
        row.cells().forEach(cell -> forEachInline(cell.content(), action));
    }

    private static void appendPlainText(List<Inline> inlines, StringBuilder builder) {
        for (Inline inline : inlines) {
            if (inline instanceof Text text) {
                builder.append(text.value());
            } else if (inline instanceof Emphasis emphasis) {
                appendPlainText(emphasis.children(), builder);
            } else if (inline instanceof Link link) {
                appendPlainText(link.children(), builder);
            } else if (inline instanceof InlineCode code) {
                builder.append(code.literal());
            } else if (inline instanceof CustomMarker marker) {
                builder.append(marker.text());
            } else if (inline instanceof MathSpan math) {
                builder.append(math.literal());
            } else if (inline instanceof LineBreak) {
                builder.append(' ');
            }
        }
    }
}
