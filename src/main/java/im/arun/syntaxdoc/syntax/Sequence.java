package im.arun.syntaxdoc.syntax;

import lombok.Value;

import java.util.Arrays;
import java.util.List;

/**
 * Concatenation of two or more items, {@code a b c}.
 */
@Value
public class Sequence implements Container {
    List<Node> items;

    public Sequence(List<? extends Node> items) {
        this.items = Container.checkItems(items);
    }

    public Sequence(Node... items) {
        this(Arrays.asList(items));
    }

    @Override
    public String getSeparator() {
        return " ";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSequence(this);
    }
}
