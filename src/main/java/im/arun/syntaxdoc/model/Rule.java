package im.arun.syntaxdoc.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One grammar rule as written in a rule document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Rule {

    @JsonProperty("name")
    private String name;

    @JsonProperty("label")
    private String label;

    /** Grammar notation for the rule's right-hand side; rules without it are prose only. */
    @JsonProperty("syntax")
    private String syntax;

    @JsonProperty("summary")
    private String summary;

    @JsonProperty("description")
    private String description;

    public Rule(String name, String syntax) {
        this.name = name;
        this.syntax = syntax;
    }
}
