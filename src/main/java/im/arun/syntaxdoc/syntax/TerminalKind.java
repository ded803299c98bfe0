package im.arun.syntaxdoc.syntax;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a terminal, used by renderers to style it.
 */
public enum TerminalKind {
    NONE(""),
    LITERAL("literal"),
    REGEX("regex"),
    CHAR_CLASS("char-class"),
    COMMENT("comment");

    private final String cssClass;

    TerminalKind(String cssClass) {
        this.cssClass = cssClass;
    }

    @JsonValue
    public String getCssClass() {
        return cssClass;
    }
}
