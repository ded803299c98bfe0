package im.arun.syntaxdoc.diagram;

import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.Value;

/**
 * A rule reference box linking to the rule's section in the same document.
 */
@Value
@JsonTypeName("non-terminal")
public class DiagramNonTerminal implements DiagramNode {
    String text;
    String href;
}
