package im.arun.syntaxdoc.ebnf;

import im.arun.syntaxdoc.reader.NotationReader;
import im.arun.syntaxdoc.syntax.Alternation;
import im.arun.syntaxdoc.syntax.Container;
import im.arun.syntaxdoc.syntax.Node;
import im.arun.syntaxdoc.syntax.NodeVisitor;
import im.arun.syntaxdoc.syntax.NonTerminal;
import im.arun.syntaxdoc.syntax.OneOrMore;
import im.arun.syntaxdoc.syntax.Optional;
import im.arun.syntaxdoc.syntax.Quantifier;
import im.arun.syntaxdoc.syntax.Sequence;
import im.arun.syntaxdoc.syntax.Terminal;
import im.arun.syntaxdoc.syntax.TerminalKind;
import im.arun.syntaxdoc.syntax.ZeroOrMore;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders syntax trees back into canonical EBNF text.
 *
 * <p>Grouping is decided by the parent: a container is parenthesized only when its
 * parent asks for it. Sequences and quantifiers always ask; alternations ask only
 * of a nested alternation. Reading the rendered text again gives back an equal tree.
 */
public class EbnfRenderer {
    private final NotationReader reader;

    public EbnfRenderer() {
        this(new NotationReader());
    }

    public EbnfRenderer(NotationReader reader) {
        this.reader = reader;
    }

    /**
     * Render a node as EBNF text.
     *
     * @param node         the node to render
     * @param forceGrouped wrap the text in parentheses if the node is a container
     * @return the EBNF text
     */
    public String toText(Node node, boolean forceGrouped) {
        return node.accept(new TextVisitor(forceGrouped));
    }

    /**
     * Render a rule body as a {@code ::=} block. When the root is an alternation every
     * alternative goes on its own line:
     *
     * <pre>
     * prefix::= alt-1
     * prefix  | alt-2
     * </pre>
     *
     * @param node      root of the rule's syntax tree
     * @param prefix    text put in front of every line, usually indentation
     * @param separator text between lines
     */
    public String renderRule(Node node, String prefix, String separator) {
        StringBuilder buf = new StringBuilder();
        buf.append(prefix).append("::= ");
        if (node instanceof Alternation) {
            List<Node> alternatives = ((Alternation) node).getItems();
            buf.append(alternative(alternatives.get(0)));
            for (int i = 1; i < alternatives.size(); i++) {
                buf.append(separator).append(prefix).append("  | ");
                buf.append(alternative(alternatives.get(i)));
            }
        } else {
            buf.append(toText(node, false));
        }
        return buf.toString();
    }

    public String renderRule(Node node, String prefix) {
        return renderRule(node, prefix, "\n");
    }

    /**
     * Parse notation source and render it as a {@code ::=} block.
     */
    public String renderRule(String source, String prefix, String separator) {
        return renderRule(reader.parse(source), prefix, separator);
    }

    private String alternative(Node node) {
        return toText(node, node instanceof Alternation);
    }

    private String joinItems(Container node, boolean forceGrouped, boolean groupItems) {
        String text = node.getItems().stream()
            .map(item -> toText(item, groupItems || item instanceof Alternation))
            .collect(Collectors.joining(node.getSeparator()));
        return forceGrouped ? "(" + text + ")" : text;
    }

    private String quantified(Quantifier node) {
        Node item = node.getItem();
        String text = toText(item, true);
        // a?* and /* c */? do not read back, (a?)* and (/* c */)? do
        if (item instanceof Quantifier || isComment(item)) {
            text = "(" + text + ")";
        }
        return text + node.getSuffix();
    }

    private static boolean isComment(Node node) {
        return node instanceof Terminal && ((Terminal) node).getKind() == TerminalKind.COMMENT;
    }

    private final class TextVisitor implements NodeVisitor<String> {
        private final boolean forceGrouped;

        TextVisitor(boolean forceGrouped) {
            this.forceGrouped = forceGrouped;
        }

        @Override
        public String visitAlternation(Alternation node) {
            return joinItems(node, forceGrouped, false);
        }

        @Override
        public String visitSequence(Sequence node) {
            return joinItems(node, forceGrouped, true);
        }

        @Override
        public String visitOptional(Optional node) {
            return quantified(node);
        }

        @Override
        public String visitZeroOrMore(ZeroOrMore node) {
            return quantified(node);
        }

        @Override
        public String visitOneOrMore(OneOrMore node) {
            return quantified(node);
        }

        @Override
        public String visitTerminal(Terminal node) {
            return node.getText();
        }

        @Override
        public String visitNonTerminal(NonTerminal node) {
            return node.getText();
        }
    }
}
