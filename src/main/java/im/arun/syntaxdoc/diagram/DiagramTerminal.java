package im.arun.syntaxdoc.diagram;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.Value;

/**
 * A terminal box. {@code cssClass} names the terminal kind so literals, regexes,
 * character classes and comments can be styled apart.
 */
@Value
@JsonTypeName("terminal")
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class DiagramTerminal implements DiagramNode {
    String text;
    String cssClass;
}
