package im.arun.syntaxdoc.reader;

import im.arun.syntaxdoc.syntax.Alternation;
import im.arun.syntaxdoc.syntax.Node;
import im.arun.syntaxdoc.syntax.NonTerminal;
import im.arun.syntaxdoc.syntax.OneOrMore;
import im.arun.syntaxdoc.syntax.Optional;
import im.arun.syntaxdoc.syntax.Sequence;
import im.arun.syntaxdoc.syntax.Terminal;
import im.arun.syntaxdoc.syntax.TerminalKind;
import im.arun.syntaxdoc.syntax.ZeroOrMore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Recursive descent reader for grammar notation.
 *
 * <pre>
 * alternation := sequence ('|' sequence)*
 * sequence    := item+
 * item        := atom quantifier?
 * atom        := identifier | literal | regex | comment
 *              | char-class | '.' | '(' alternation ')'
 * quantifier  := '?' | '*' | '+'
 * </pre>
 *
 * The reader holds no state; each call to {@link #parse(String)} works on its own
 * {@link Cursor}, so one instance can be shared between threads.
 */
public class NotationReader {

    private static final String CLASS_CHAR =
        "(?:[^\\[\\]\\\\-]|\\\\[\\[\\]\\\\-]|\\\\x[\\da-fA-F]{2}|\\\\u[\\da-fA-F]{4}|\\\\U\\{[\\da-fA-F]{1,6}\\})";

    static final Pattern IDENTIFIER = Pattern.compile("\\w[\\w.-]*", Pattern.UNICODE_CHARACTER_CLASS);
    static final Pattern LITERAL_SINGLE_QUOTED = Pattern.compile("'(?:[^'\\\\]|\\\\.)*+'");
    static final Pattern LITERAL_DOUBLE_QUOTED = Pattern.compile("\"(?:[^\"\\\\]|\\\\.)*+\"");
    static final Pattern REGEX = Pattern.compile("/(?:[^/\\\\]|\\\\.)*+/i?");
    static final Pattern CLASS_BUILTIN = Pattern.compile("\\\\[DSWdsw]");
    static final Pattern CLASS_ITEM = Pattern.compile(CLASS_CHAR + "(?:-" + CLASS_CHAR + ")?");

    /**
     * Parse one rule's notation into a syntax tree.
     *
     * @param source notation text
     * @return root of the tree, never an empty or single-item container
     * @throws NotationSyntaxException if the text is not valid notation or has trailing input
     */
    public Node parse(String source) {
        Objects.requireNonNull(source, "source");
        Cursor cursor = new Cursor(source);
        Node node = readAlternation(cursor);
        cursor.skipWhitespace();
        if (!cursor.atEnd()) {
            throw cursor.error("invalid character");
        }
        return node;
    }

    static Node readAlternation(Cursor cursor) {
        List<Node> alternatives = new ArrayList<>();
        do {
            alternatives.add(readSequence(cursor));
        } while (cursor.readLiteral("|") != null);

        return alternatives.size() == 1 ? alternatives.get(0) : new Alternation(alternatives);
    }

    static Node readSequence(Cursor cursor) {
        List<Node> items = new ArrayList<>();
        Node item;
        while ((item = readItem(cursor)) != null) {
            items.add(item);
        }

        if (items.isEmpty()) {
            cursor.skipWhitespace();
            throw cursor.error(cursor.atEnd() ? "unexpected end of text" : "invalid character");
        }
        return items.size() == 1 ? items.get(0) : new Sequence(items);
    }

    /**
     * Read one atom and its quantifier, if any.
     *
     * @return the item, or null when no item starts at the cursor
     */
    static Node readItem(Cursor cursor) {
        Node item;
        String match;
        if ((match = cursor.readMatch(IDENTIFIER)) != null) {
            item = new NonTerminal(match);
        } else if ((match = cursor.readMatch(LITERAL_SINGLE_QUOTED)) != null
                || (match = cursor.readMatch(LITERAL_DOUBLE_QUOTED)) != null) {
            item = new Terminal(match, TerminalKind.LITERAL);
        } else if ((match = cursor.readComment()) != null) {
            // comments annotate, they never take a quantifier
            return new Terminal(match, TerminalKind.COMMENT);
        } else if ((match = cursor.readMatch(REGEX)) != null) {
            item = new Terminal(match, TerminalKind.REGEX);
        } else if ((item = readClass(cursor, true)) != null) {
            // char-class
        } else if (cursor.readLiteral(".") != null) {
            item = new Terminal(".", TerminalKind.CHAR_CLASS);
        } else if (cursor.readLiteral("(") != null) {
            item = readGroup(cursor);
        } else {
            checkUnterminated(cursor);
            return null;
        }
        return readQuantifier(cursor, item);
    }

    static Node readQuantifier(Cursor cursor, Node item) {
        if (cursor.readLiteral("?") != null) {
            return new Optional(item);
        } else if (cursor.readLiteral("*") != null) {
            return new ZeroOrMore(item);
        } else if (cursor.readLiteral("+") != null) {
            return new OneOrMore(item);
        }
        return item;
    }

    private static Node readGroup(Cursor cursor) {
        if (cursor.peekLiteral(")")) {
            throw cursor.error("expecting alternation after '('");
        }
        Node item = readAlternation(cursor);
        if (cursor.readLiteral(")") == null) {
            throw cursor.error("expecting closing brace ')'");
        }
        return item;
    }

    /**
     * Read a bracketed character class. A trailing {@code -} followed by another class
     * splices that class's text into this one.
     *
     * @return the class as a char-class terminal, or null when no {@code [} is at the cursor
     */
    static Terminal readClass(Cursor cursor, boolean skipWhitespace) {
        if (cursor.readLiteral("[", skipWhitespace) == null) {
            return null;
        }
        StringBuilder text = new StringBuilder("[");
        boolean hasItems = false;
        // leading ^ and - are flags, not items
        if (cursor.readLiteral("^", false) != null) {
            text.append('^');
        }
        if (cursor.readLiteral("-", false) != null) {
            text.append('-');
        }
        String item;
        while ((item = readClassItem(cursor)) != null) {
            text.append(item);
            hasItems = true;
        }
        if (!hasItems) {
            throw cursor.error("expecting char-class items");
        }
        if (cursor.readLiteral("-", false) != null) {
            text.append('-');
            Terminal nested = readClass(cursor, false);
            if (nested != null) {
                text.append(nested.getText());
            }
        }
        if (cursor.readLiteral("]", false) == null) {
            throw cursor.error("expecting closing ']'");
        }
        text.append(']');
        return new Terminal(text.toString(), TerminalKind.CHAR_CLASS);
    }

    static String readClassItem(Cursor cursor) {
        String match = cursor.readMatch(CLASS_BUILTIN, false);
        if (match != null) {
            return match;
        }
        return cursor.readMatch(CLASS_ITEM, false);
    }

    /**
     * A quote or slash that no token rule accepted can only be an unclosed token.
     */
    private static void checkUnterminated(Cursor cursor) {
        if (cursor.atEnd()) {
            return;
        }
        String source = cursor.getSource();
        char c = source.charAt(cursor.getOffset());
        if (c == '\'' || c == '"') {
            throw cursor.error("unterminated literal");
        }
        if (c == '/') {
            throw cursor.error(source.startsWith("/*", cursor.getOffset()) ? "unterminated comment" : "unterminated regex");
        }
    }
}
