package im.arun.syntaxdoc.syntax;

import lombok.Value;

import java.util.Objects;

/**
 * An item that may be absent, {@code a?}.
 */
@Value
public class Optional implements Quantifier {
    Node item;

    public Optional(Node item) {
        this.item = Objects.requireNonNull(item, "item");
    }

    @Override
    public String getSuffix() {
        return "?";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitOptional(this);
    }
}
