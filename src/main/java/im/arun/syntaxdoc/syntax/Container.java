package im.arun.syntaxdoc.syntax;

import java.util.List;

/**
 * A node with two or more ordered children.
 */
public interface Container extends Node {

    List<Node> getItems();

    /**
     * Separator placed between items when rendered as EBNF text.
     */
    String getSeparator();

    static List<Node> checkItems(List<? extends Node> items) {
        if (items == null || items.size() < 2) {
            throw new IllegalArgumentException("must have at least two items");
        }
        for (Node item : items) {
            if (item == null) {
                throw new IllegalArgumentException("items must not be null");
            }
        }
        return List.copyOf(items);
    }
}
