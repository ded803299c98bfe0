package im.arun.syntaxdoc.reader;

/**
 * Thrown when grammar notation cannot be parsed.
 * Carries the offset of the failure; the line, column and source excerpt shown in
 * the message are derived from it on first use.
 */
public class NotationSyntaxException extends RuntimeException {
    private static final int EXCERPT_RADIUS = 40;

    private final String source;
    private final int offset;
    private final String reason;

    private transient Position position;

    public NotationSyntaxException(String source, int offset, String reason) {
        super(reason);
        this.source = source;
        this.offset = offset;
        this.reason = reason;
    }

    public String getSource() {
        return source;
    }

    /**
     * Offset into the source at which parsing failed.
     */
    public int getOffset() {
        return offset;
    }

    public String getReason() {
        return reason;
    }

    /**
     * 1-based line of the failure. {@code \r}, {@code \n} and {@code \r\n} each end one line.
     */
    public int getLine() {
        return position().line;
    }

    /**
     * 1-based column of the failure.
     */
    public int getColumn() {
        return position().column;
    }

    /**
     * Up to 40 characters either side of the failure, clipped to its line, followed by a
     * second line with a caret under the failing character.
     */
    public String getExcerpt() {
        Position pos = position();
        int start = Math.max(offset - EXCERPT_RADIUS, pos.lineStart);
        int end = Math.min(offset + EXCERPT_RADIUS, source.length());
        for (int i = offset; i < end; i++) {
            char c = source.charAt(i);
            if (c == '\r' || c == '\n') {
                end = i;
                break;
            }
        }
        String text = source.substring(start, end);
        return text + "\n" + " ".repeat(offset - start) + "^";
    }

    @Override
    public String getMessage() {
        return String.format("error at %d:%d: %s", getLine(), getColumn(), reason) + "\n" + getExcerpt();
    }

    private Position position() {
        if (position == null) {
            position = Position.locate(source, offset);
        }
        return position;
    }

    private static final class Position {
        final int line;
        final int column;
        final int lineStart;

        private Position(int line, int column, int lineStart) {
            this.line = line;
            this.column = column;
            this.lineStart = lineStart;
        }

        static Position locate(String source, int offset) {
            int line = 1;
            int column = 1;
            int lineStart = 0;
            char last = 0;
            int end = Math.min(offset, source.length());
            for (int i = 0; i < end; i++) {
                char c = source.charAt(i);
                if (c == '\r') {
                    line++;
                    column = 1;
                    lineStart = i + 1;
                } else if (c == '\n') {
                    // second half of \r\n
                    if (last != '\r') {
                        line++;
                        column = 1;
                    }
                    lineStart = i + 1;
                } else {
                    column++;
                }
                last = c;
            }
            return new Position(line, column, lineStart);
        }
    }
}
