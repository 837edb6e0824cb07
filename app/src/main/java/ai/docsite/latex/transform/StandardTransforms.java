package ai.docsite.latex.transform;

import ai.docsite.latex.ast.Block;
import ai.docsite.latex.ast.Callout;
import ai.docsite.latex.ast.Document;
import ai.docsite.latex.ast.Emphasis;
import ai.docsite.latex.ast.HorizontalRule;
import ai.docsite.latex.ast.ListBlock;
import ai.docsite.latex.ast.ListItem;
import ai.docsite.latex.ast.Paragraph;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Transforms shipped with the converter. They are not registered implicitly; callers opt in through
 * {@link #registerAll(TransformRegistry)}.
 */
public final class StandardTransforms {

    public static final String DROP_HORIZONTAL_RULES = "drop-horizontal-rules";
    public static final String UNWRAP_CALLOUTS = "unwrap-callouts";

    private StandardTransforms() {
    }

    public static void registerAll(TransformRegistry registry) {
        registry.register(DROP_HORIZONTAL_RULES, StandardTransforms::dropHorizontalRules);
        registry.register(UNWRAP_CALLOUTS, StandardTransforms::unwrapCallouts);
    }

    /**
     * Removes thematic breaks at every nesting depth.
     */
    static Document dropHorizontalRules(Document document) {
        return document.withChildren(rewrite(document.children(),
                block -> block instanceof HorizontalRule ? List.of() : List.of(block)));
    }

    /**
     * Replaces each callout by its body, preceded by its title as a bold paragraph when it has one.
     */
    static Document unwrapCallouts(Document document) {
        return document.withChildren(rewrite(document.children(), block -> {
            if (!(block instanceof Callout callout)) {
                return List.of(block);
            }
            List<Block> replacement = new ArrayList<>();
            callout.title().ifPresent(title -> replacement.add(new Paragraph(List.of(new Emphasis(true, title)))));
            replacement.addAll(callout.body());
            return replacement;
        }));
    }

    /**
     * Applies {@code rule} bottom-up: containers are rebuilt from their rewritten children before the rule sees
     * them.
     */
    private static List<Block> rewrite(List<Block> blocks, Function<Block, List<Block>> rule) {
        List<Block> result = new ArrayList<>();
        for (Block block : blocks) {
            Block rebuilt = block;
            if (block instanceof ListBlock list) {
                List<ListItem> items = new ArrayList<>();
                for (ListItem item : list.items()) {
                    items.add(new ListItem(rewrite(item.children(), rule)));
                }
                rebuilt = new ListBlock(list.ordered(), items);
            } else if (block instanceof Callout callout) {
                rebuilt = new Callout(callout.kind(), callout.title(), rewrite(callout.body(), rule));
            }
            result.addAll(rule.apply(rebuilt));
        }
        return result;
    }
}
