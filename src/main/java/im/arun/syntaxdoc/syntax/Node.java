package im.arun.syntaxdoc.syntax;

/**
 * A node in the syntax tree of one grammar rule's right-hand side.
 * Nodes are immutable and each node owns its children exclusively.
 */
public interface Node {

    <R> R accept(NodeVisitor<R> visitor);
}
