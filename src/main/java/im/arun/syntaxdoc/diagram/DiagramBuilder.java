package im.arun.syntaxdoc.diagram;

import im.arun.syntaxdoc.syntax.Alternation;
import im.arun.syntaxdoc.syntax.Container;
import im.arun.syntaxdoc.syntax.Node;
import im.arun.syntaxdoc.syntax.NodeVisitor;
import im.arun.syntaxdoc.syntax.NonTerminal;
import im.arun.syntaxdoc.syntax.OneOrMore;
import im.arun.syntaxdoc.syntax.Optional;
import im.arun.syntaxdoc.syntax.Sequence;
import im.arun.syntaxdoc.syntax.Terminal;
import im.arun.syntaxdoc.syntax.ZeroOrMore;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps a syntax tree one node to one node onto railroad diagram primitives.
 * No layout happens here.
 */
public class DiagramBuilder implements NodeVisitor<DiagramNode> {
    public static final String DEFAULT_ANCHOR_PREFIX = "rule-";

    private final String anchorPrefix;

    public DiagramBuilder() {
        this(DEFAULT_ANCHOR_PREFIX);
    }

    /**
     * @param anchorPrefix prefix of the in-page anchor each rule reference links to
     */
    public DiagramBuilder(String anchorPrefix) {
        this.anchorPrefix = anchorPrefix != null ? anchorPrefix : DEFAULT_ANCHOR_PREFIX;
    }

    public DiagramNode toDiagram(Node node) {
        return node.accept(this);
    }

    /**
     * Anchor id of the section documenting {@code ruleName}.
     */
    public String anchorFor(String ruleName) {
        return anchorPrefix + ruleName;
    }

    @Override
    public DiagramNode visitAlternation(Alternation node) {
        return new DiagramChoice(0, items(node));
    }

    @Override
    public DiagramNode visitSequence(Sequence node) {
        return new DiagramSequence(items(node));
    }

    @Override
    public DiagramNode visitOptional(Optional node) {
        return new DiagramOptional(toDiagram(node.getItem()));
    }

    @Override
    public DiagramNode visitZeroOrMore(ZeroOrMore node) {
        return new DiagramZeroOrMore(toDiagram(node.getItem()));
    }

    @Override
    public DiagramNode visitOneOrMore(OneOrMore node) {
        return new DiagramOneOrMore(toDiagram(node.getItem()));
    }

    @Override
    public DiagramNode visitTerminal(Terminal node) {
        return new DiagramTerminal(node.getText(), node.getKind().getCssClass());
    }

    @Override
    public DiagramNode visitNonTerminal(NonTerminal node) {
        return new DiagramNonTerminal(node.getText(), "#" + anchorFor(node.getText()));
    }

    private List<DiagramNode> items(Container node) {
        return node.getItems().stream()
            .map(this::toDiagram)
            .collect(Collectors.toList());
    }
}
