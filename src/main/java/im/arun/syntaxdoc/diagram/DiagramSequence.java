package im.arun.syntaxdoc.diagram;

import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.Value;

import java.util.List;

@Value
@JsonTypeName("sequence")
public class DiagramSequence implements DiagramNode {
    List<DiagramNode> items;
}
