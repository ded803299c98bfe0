package im.arun.syntaxdoc.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SyntaxDocCLITest {
    private static final String DOCUMENT = "title = \"Demo\"\n"
        + "[[rules]]\n"
        + "name = \"list\"\n"
        + "syntax = \"'[' (item (',' item)*)? ']'\"\n"
        + "[[rules]]\n"
        + "name = \"item\"\n"
        + "syntax = \"/[a-z]+/ | list\"\n";

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private int run(String... args) {
        PrintStream stdout = new PrintStream(out, true, StandardCharsets.UTF_8);
        return new CommandLine(new SyntaxDocCLI(stdout)).execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void writesEbnfToStandardOutput(@TempDir Path dir) throws Exception {
        Path input = Files.writeString(dir.resolve("demo.toml"), DOCUMENT);

        assertEquals(0, run("-i", input.toString(), "-f", "ebnf"));
        assertEquals("list\n"
            + "  ::= '[' (item (',' item)*)? ']'\n"
            + "\n"
            + "item\n"
            + "  ::= /[a-z]+/\n"
            + "    | list\n", stdout());
    }

    @Test
    void prefixOption(@TempDir Path dir) throws Exception {
        Path input = Files.writeString(dir.resolve("demo.toml"), DOCUMENT);

        assertEquals(0, run("--input", input.toString(), "--format", "ebnf", "--prefix", "\t"));
        assertTrue(stdout().contains("item\n\t::= /[a-z]+/\n\t  | list\n"));
    }

    @Test
    void writesHtmlToFile(@TempDir Path dir) throws Exception {
        Path input = Files.writeString(dir.resolve("demo.toml"), DOCUMENT);
        Path output = dir.resolve("demo.html");

        assertEquals(0, run("-i", input.toString(), "-o", output.toString()));
        String html = Files.readString(output);
        assertTrue(html.contains("<title>Demo</title>"));
        assertTrue(html.contains("<section id=\"rule-item\">"));
        assertEquals("", stdout());
    }

    @Test
    void explicitInputFormat(@TempDir Path dir) throws Exception {
        Path input = Files.writeString(dir.resolve("rules.txt"), "{\"rules\": [{\"name\": \"a\", \"syntax\": \"b+\"}]}");

        assertEquals(0, run("-i", input.toString(), "--input-format", "json", "-f", "diagram-json"));
        assertTrue(stdout().contains("\"one-or-more\""));
    }

    @Test
    void invalidSyntaxFailsTheRun(@TempDir Path dir) throws Exception {
        Path input = Files.writeString(dir.resolve("bad.toml"), "[[rules]]\nname = \"x\"\nsyntax = \"a (b\"\n");
        Path output = dir.resolve("bad.html");

        assertEquals(1, run("-i", input.toString(), "-o", output.toString()));
        assertFalse(Files.exists(output));
    }

    @Test
    void missingInputFile(@TempDir Path dir) {
        assertEquals(1, run("-i", dir.resolve("absent.toml").toString()));
    }

    @Test
    void unknownOutputFormat(@TempDir Path dir) throws Exception {
        Path input = Files.writeString(dir.resolve("demo.toml"), DOCUMENT);
        assertEquals(1, run("-i", input.toString(), "-f", "pdf"));
    }
}
