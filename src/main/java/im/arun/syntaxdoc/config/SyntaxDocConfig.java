package im.arun.syntaxdoc.config;

import lombok.Data;

@Data
public class SyntaxDocConfig {
    private String rulePrefix = "  ";
    private String lineSeparator = "\n";
    private String anchorPrefix = "rule-";
    private String outputFormat = "html";
    private String pageTitle = "Syntax";
    private boolean parallelParsing = true;
}
