package im.arun.syntaxdoc.diagram;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Drawing-agnostic railroad diagram primitive.
 * A diagram renderer lays these out; serialized as JSON each node carries a {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = DiagramChoice.class, name = "choice"),
    @JsonSubTypes.Type(value = DiagramSequence.class, name = "sequence"),
    @JsonSubTypes.Type(value = DiagramOptional.class, name = "optional"),
    @JsonSubTypes.Type(value = DiagramZeroOrMore.class, name = "zero-or-more"),
    @JsonSubTypes.Type(value = DiagramOneOrMore.class, name = "one-or-more"),
    @JsonSubTypes.Type(value = DiagramTerminal.class, name = "terminal"),
    @JsonSubTypes.Type(value = DiagramNonTerminal.class, name = "non-terminal")
})
public interface DiagramNode {
}
