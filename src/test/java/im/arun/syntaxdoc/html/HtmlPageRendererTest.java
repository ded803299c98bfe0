package im.arun.syntaxdoc.html;

import im.arun.syntaxdoc.model.ParsedRule;
import im.arun.syntaxdoc.model.Rule;
import im.arun.syntaxdoc.reader.NotationReader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HtmlPageRendererTest {
    private final NotationReader reader = new NotationReader();
    private final HtmlPageRenderer renderer = new HtmlPageRenderer();

    private ParsedRule parsed(String name, String syntax) {
        return new ParsedRule(new Rule(name, name, syntax, null, null), syntax != null ? reader.parse(syntax) : null);
    }

    @Test
    void escapesMarkup() {
        assertEquals("&lt;a href=&quot;x&quot;&gt; &amp; &#39;b&#39;", HtmlPageRenderer.escape("<a href=\"x\"> & 'b'"));
        assertEquals("", HtmlPageRenderer.escape(null));
    }

    @Test
    void splitsProseIntoParagraphs() {
        assertEquals("<p>One.</p>\n<p>Two &amp; three.</p>\n", HtmlPageRenderer.paragraphs("One.\n\nTwo & three.\n"));
        assertEquals("<p>Same\nparagraph</p>\n", HtmlPageRenderer.paragraphs("Same\nparagraph"));
        assertEquals("", HtmlPageRenderer.paragraphs("  "));
    }

    @Test
    void ruleSectionHoldsEbnfAndDiagram() {
        String html = renderer.renderRule(parsed("tag", "'<' name '>'"));

        assertTrue(html.startsWith("<section id=\"rule-tag\">\n<h2>tag</h2>\n"));
        assertTrue(html.contains("<pre class=\"ebnf\">::= &#39;&lt;&#39; name &#39;&gt;&#39;</pre>"));
        assertTrue(html.contains("<script type=\"application/json\" class=\"railroad\">{\"type\":\"sequence\""));
        assertTrue(html.contains("\"href\":\"#rule-name\""));
        assertTrue(html.endsWith("</section>\n"));
    }

    @Test
    void scriptEndTagInsideDiagramIsEscaped() {
        String html = renderer.renderRule(parsed("end", "'</script>'"));
        assertTrue(html.contains("'<\\/script>'"));
        assertEquals(html.indexOf("</script>"), html.lastIndexOf("</script>"));
    }

    @Test
    void proseOnlyRule() {
        ParsedRule rule = new ParsedRule(new Rule("notes", "Notes", null, "Short.", "Longer text."), null);
        String html = renderer.renderRule(rule);
        assertTrue(html.contains("<p>Short.</p>\n<p>Longer text.</p>\n"));
        assertFalse(html.contains("<pre"));
    }

    @Test
    void pageListsEveryRule() {
        String html = renderer.render("My <Grammar>", "About it.", List.of(parsed("a", "b c"), parsed("b", "'x'")));

        assertTrue(html.startsWith("<!DOCTYPE html>\n"));
        assertTrue(html.contains("<title>My &lt;Grammar&gt;</title>"));
        assertTrue(html.contains("<h1>My &lt;Grammar&gt;</h1>\n<p>About it.</p>\n<nav>"));
        assertTrue(html.contains("<li><a href=\"#rule-a\">a</a></li>\n<li><a href=\"#rule-b\">b</a></li>\n"));
        assertTrue(html.indexOf("<section id=\"rule-a\">") < html.indexOf("<section id=\"rule-b\">"));
        assertTrue(html.endsWith("</body>\n</html>\n"));
    }
}
