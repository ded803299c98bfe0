package im.arun.syntaxdoc.syntax;

import lombok.Value;

import java.util.Objects;

/**
 * An item repeated at least once, {@code a+}.
 */
@Value
public class OneOrMore implements Quantifier {
    Node item;

    public OneOrMore(Node item) {
        this.item = Objects.requireNonNull(item, "item");
    }

    @Override
    public String getSuffix() {
        return "+";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitOneOrMore(this);
    }
}
