package im.arun.syntaxdoc.diagram;

import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.Value;

@Value
@JsonTypeName("optional")
public class DiagramOptional implements DiagramNode {
    DiagramNode item;
}
