package im.arun.syntaxdoc.model;

import im.arun.syntaxdoc.syntax.Node;
import lombok.Value;

/**
 * A rule together with the syntax tree read from its notation.
 * {@code syntax} is null for rules that carry no notation.
 */
@Value
public class ParsedRule {
    Rule rule;
    Node syntax;

    public boolean hasSyntax() {
        return syntax != null;
    }
}
