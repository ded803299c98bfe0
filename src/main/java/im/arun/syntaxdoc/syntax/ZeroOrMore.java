package im.arun.syntaxdoc.syntax;

import lombok.Value;

import java.util.Objects;

/**
 * An item repeated any number of times, {@code a*}.
 */
@Value
public class ZeroOrMore implements Quantifier {
    Node item;

    public ZeroOrMore(Node item) {
        this.item = Objects.requireNonNull(item, "item");
    }

    @Override
    public String getSuffix() {
        return "*";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitZeroOrMore(this);
    }
}
