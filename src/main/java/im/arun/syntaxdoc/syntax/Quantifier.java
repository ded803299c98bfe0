package im.arun.syntaxdoc.syntax;

/**
 * A node wrapping exactly one child with an optional or repeating meaning.
 */
public interface Quantifier extends Node {

    Node getItem();

    /**
     * The quantifier symbol appended to the item: {@code ?}, {@code *} or {@code +}.
     */
    String getSuffix();
}
