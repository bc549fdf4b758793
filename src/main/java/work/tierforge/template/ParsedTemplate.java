package work.tierforge.template;

import io.pebbletemplates.pebble.node.ExtendsNode;
import io.pebbletemplates.pebble.node.RenderableNode;
import io.pebbletemplates.pebble.node.RootNode;
import java.util.Optional;
import java.util.Set;

/**
 * A compiled template's syntax tree together with the names its {@code import … as} tags bind.
 */
public record ParsedTemplate(String name, RootNode root, Set<String> importAliases) {
    public ParsedTemplate {
        importAliases = Set.copyOf(importAliases);
    }

    /**
     * The top-level {@code extends} tag, if any.
     */
    public Optional<ExtendsNode> extendsNode() {
        for (RenderableNode node : root.getBody().getChildren()) {
            if (node instanceof ExtendsNode extendsNode) {
                return Optional.of(extendsNode);
            }
        }
        return Optional.empty();
    }
}
