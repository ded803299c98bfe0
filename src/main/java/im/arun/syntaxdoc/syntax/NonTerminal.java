package im.arun.syntaxdoc.syntax;

import lombok.Value;

import java.util.Objects;

/**
 * A reference to another rule by name. The name is never resolved here.
 */
@Value
public class NonTerminal implements Node {
    String text;

    public NonTerminal(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNonTerminal(this);
    }
}
