package im.arun.syntaxdoc.diagram;

import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.Value;

@Value
@JsonTypeName("zero-or-more")
public class DiagramZeroOrMore implements DiagramNode {
    DiagramNode item;
}
