package im.arun.syntaxdoc.syntax;

import lombok.Value;

import java.util.Arrays;
import java.util.List;

/**
 * A choice between two or more branches, {@code a | b | c}.
 * The first branch is the preferred path.
 */
@Value
public class Alternation implements Container {
    List<Node> items;

    public Alternation(List<? extends Node> items) {
        this.items = Container.checkItems(items);
    }

    public Alternation(Node... items) {
        this(Arrays.asList(items));
    }

    @Override
    public String getSeparator() {
        return " | ";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAlternation(this);
    }
}
