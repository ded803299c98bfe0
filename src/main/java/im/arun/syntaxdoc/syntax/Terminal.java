package im.arun.syntaxdoc.syntax;

import lombok.Value;

import java.util.Objects;

/**
 * A leaf holding the surface text of a literal, regex, character class or comment,
 * delimiters and escapes included.
 */
@Value
public class Terminal implements Node {
    String text;
    TerminalKind kind;

    public Terminal(String text, TerminalKind kind) {
        this.text = Objects.requireNonNull(text, "text");
        this.kind = kind != null ? kind : TerminalKind.NONE;
    }

    public Terminal(String text) {
        this(text, TerminalKind.NONE);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTerminal(this);
    }
}
