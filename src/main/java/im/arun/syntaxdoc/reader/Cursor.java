package im.arun.syntaxdoc.reader;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read position over one notation source string.
 * A cursor belongs to a single parse call and only ever moves forward.
 */
final class Cursor {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final String source;
    private int offset;

    Cursor(String source) {
        this(source, 0);
    }

    Cursor(String source, int offset) {
        this.source = source;
        this.offset = offset;
    }

    String getSource() {
        return source;
    }

    int getOffset() {
        return offset;
    }

    boolean atEnd() {
        return offset >= source.length();
    }

    /**
     * Consume {@code value} if the source continues with it.
     *
     * @return the consumed text, or null when the source does not continue with it
     */
    String readLiteral(String value, boolean skipWhitespace) {
        if (skipWhitespace) {
            skipWhitespace();
        }
        if (source.startsWith(value, offset)) {
            offset += value.length();
            return value;
        }
        return null;
    }

    String readLiteral(String value) {
        return readLiteral(value, true);
    }

    /**
     * Check for {@code value} after any whitespace without consuming the value itself.
     */
    boolean peekLiteral(String value) {
        skipWhitespace();
        return source.startsWith(value, offset);
    }

    /**
     * Consume the longest match of {@code pattern} anchored at the current offset.
     *
     * @return the matched text, or null when the pattern does not match here
     */
    String readMatch(Pattern pattern, boolean skipWhitespace) {
        if (skipWhitespace) {
            skipWhitespace();
        }
        Matcher matcher = pattern.matcher(source);
        matcher.region(offset, source.length());
        if (matcher.lookingAt()) {
            offset = matcher.end();
            return matcher.group();
        }
        return null;
    }

    String readMatch(Pattern pattern) {
        return readMatch(pattern, true);
    }

    /**
     * Consume a {@code /* ... *}{@code /} comment, ending at the first {@code *}{@code /}.
     *
     * @return the comment text with its delimiters, or null when no closed comment starts here
     */
    String readComment() {
        skipWhitespace();
        if (!source.startsWith("/*", offset)) {
            return null;
        }
        int end = source.indexOf("*/", offset + 2);
        if (end < 0) {
            return null;
        }
        String comment = source.substring(offset, end + 2);
        offset = end + 2;
        return comment;
    }

    void skipWhitespace() {
        Matcher matcher = WHITESPACE.matcher(source);
        matcher.region(offset, source.length());
        if (matcher.lookingAt()) {
            offset = matcher.end();
        }
    }

    NotationSyntaxException error(String reason) {
        return new NotationSyntaxException(source, offset, reason);
    }
}
