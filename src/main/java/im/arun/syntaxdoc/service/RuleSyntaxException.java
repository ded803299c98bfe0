package im.arun.syntaxdoc.service;

import im.arun.syntaxdoc.reader.NotationSyntaxException;

/**
 * Thrown when the notation of one rule in a document cannot be parsed.
 */
public class RuleSyntaxException extends RuntimeException {
    private final String ruleName;

    public RuleSyntaxException(String ruleName, NotationSyntaxException cause) {
        super("Invalid syntax in rule '" + ruleName + "': " + cause.getMessage(), cause);
        this.ruleName = ruleName;
    }

    public String getRuleName() {
        return ruleName;
    }

    @Override
    public synchronized NotationSyntaxException getCause() {
        return (NotationSyntaxException) super.getCause();
    }
}
