package im.arun.syntaxdoc.diagram;

import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.Value;

import java.util.List;

/**
 * A fork between branches; the branch at {@code defaultIndex} is drawn as the main line.
 */
@Value
@JsonTypeName("choice")
public class DiagramChoice implements DiagramNode {
    int defaultIndex;
    List<DiagramNode> branches;
}
