package im.arun.syntaxdoc.diagram;

import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.Value;

@Value
@JsonTypeName("one-or-more")
public class DiagramOneOrMore implements DiagramNode {
    DiagramNode item;
}
