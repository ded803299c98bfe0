package im.arun.syntaxdoc.loader;

import im.arun.syntaxdoc.model.Rule;
import im.arun.syntaxdoc.model.RuleDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RuleDocumentLoaderTest {
    private final RuleDocumentLoader loader = new RuleDocumentLoader();

    static Path resource(String name) throws Exception {
        return Paths.get(RuleDocumentLoaderTest.class.getResource("/" + name).toURI());
    }

    @Test
    void loadsTomlInDocumentOrder() throws Exception {
        RuleDocument document = loader.load(resource("grammar.toml"));

        assertEquals("Arithmetic", document.getTitle());
        assertTrue(document.getDescription().startsWith("A tiny expression grammar."));
        assertEquals(4, document.getRules().size());

        Rule expr = document.getRules().get(0);
        assertEquals("expr", expr.getName());
        assertEquals("Expression", expr.getLabel());
        assertEquals("term (('+' | '-') term)*", expr.getSyntax());
        assertEquals("Sums & differences.", expr.getSummary());

        assertEquals("term", document.getRules().get(1).getName());
        assertEquals("number", document.getRules().get(2).getName());

        Rule notes = document.getRules().get(3);
        assertNull(notes.getSyntax());
        assertEquals("Prose only, no grammar.", notes.getDescription());
    }

    @Test
    void labelDefaultsToName() throws Exception {
        RuleDocument document = loader.load(resource("grammar.toml"));
        assertEquals("term", document.getRules().get(1).getLabel());
    }

    @Test
    void loadsYaml() throws Exception {
        RuleDocument document = loader.load(resource("grammar.yaml"));
        assertEquals(3, document.getRules().size());
        assertEquals("[0-9]+", document.getRules().get(2).getSyntax());
        assertEquals("number", document.getRules().get(2).getLabel());
    }

    @Test
    void loadsJsonFromStream() throws Exception {
        String json = "{\"rules\": [{\"name\": \"a\", \"syntax\": \"'x' | b\"}]}";
        RuleDocument document = loader.load(
            new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), DocumentFormat.JSON);
        assertEquals(1, document.getRules().size());
        assertEquals("'x' | b", document.getRules().get(0).getSyntax());
    }

    @Test
    void documentWithoutRules() throws Exception {
        RuleDocument document = loader.load(
            new ByteArrayInputStream("title = \"Empty\"\n".getBytes(StandardCharsets.UTF_8)), DocumentFormat.TOML);
        assertEquals("Empty", document.getTitle());
        assertTrue(document.getRules().isEmpty());
    }

    @Test
    void ruleWithoutNameIsRejected() {
        String yaml = "rules:\n  - syntax: a\n";
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> loader.load(
            new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), DocumentFormat.YAML));
        assertEquals("Rule #1 has no name", e.getMessage());
    }

    @Test
    void unknownExtensionIsRejected(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("rules.txt"), "rules = []");
        assertThrows(IllegalArgumentException.class, () -> loader.load(file));
        assertEquals(0, loader.load(file, DocumentFormat.TOML).getRules().size());
    }

    @Test
    void formatFromPathAndName() {
        assertEquals(DocumentFormat.TOML, DocumentFormat.fromPath(Paths.get("a/Grammar.TOML")));
        assertEquals(DocumentFormat.YAML, DocumentFormat.fromPath(Paths.get("grammar.yml")));
        assertEquals(DocumentFormat.JSON, DocumentFormat.fromPath(Paths.get("grammar.json")));
        assertNull(DocumentFormat.fromPath(Paths.get("grammar")));
        assertEquals(DocumentFormat.YAML, DocumentFormat.fromName(" yaml "));
        assertThrows(IllegalArgumentException.class, () -> DocumentFormat.fromName("xml"));
    }
}
