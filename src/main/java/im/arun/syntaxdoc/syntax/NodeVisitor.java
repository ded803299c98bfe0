package im.arun.syntaxdoc.syntax;

/**
 * Dispatch over the closed set of syntax node types.
 * Every projection of a syntax tree implements this interface, so a new node type
 * has to be handled by each of them before the code compiles again.
 *
 * @param <R> result of visiting a node
 */
public interface NodeVisitor<R> {

    R visitAlternation(Alternation node);

    R visitSequence(Sequence node);

    R visitOptional(Optional node);

    R visitZeroOrMore(ZeroOrMore node);

    R visitOneOrMore(OneOrMore node);

    R visitTerminal(Terminal node);

    R visitNonTerminal(NonTerminal node);
}
