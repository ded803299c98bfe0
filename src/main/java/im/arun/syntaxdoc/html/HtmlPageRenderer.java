package im.arun.syntaxdoc.html;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.syntaxdoc.diagram.DiagramBuilder;
import im.arun.syntaxdoc.diagram.DiagramNode;
import im.arun.syntaxdoc.ebnf.EbnfRenderer;
import im.arun.syntaxdoc.model.ParsedRule;
import im.arun.syntaxdoc.model.Rule;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Writes a standalone HTML page documenting a list of rules.
 * Each rule gets a section anchored at its name holding its prose, its EBNF text and
 * its railroad diagram model as JSON for a client-side diagram library to draw.
 */
public class HtmlPageRenderer {
    private final EbnfRenderer ebnfRenderer;
    private final DiagramBuilder diagramBuilder;
    private final ObjectMapper objectMapper;
    private final String rulePrefix;
    private final String lineSeparator;

    public HtmlPageRenderer(EbnfRenderer ebnfRenderer, DiagramBuilder diagramBuilder,
                            String rulePrefix, String lineSeparator) {
        this.ebnfRenderer = ebnfRenderer;
        this.diagramBuilder = diagramBuilder;
        this.objectMapper = new ObjectMapper();
        this.rulePrefix = rulePrefix;
        this.lineSeparator = lineSeparator;
    }

    public HtmlPageRenderer() {
        this(new EbnfRenderer(), new DiagramBuilder(), "", "\n");
    }

    public String render(String title, String description, List<ParsedRule> rules) {
        StringBuilder sections = new StringBuilder();
        for (ParsedRule rule : rules) {
            sections.append(renderRule(rule));
        }
        return String.format("""
            <!DOCTYPE html>
            <html>
            <head>
            <meta charset="utf-8">
            <title>%1$s</title>
            </head>
            <body>
            <h1>%1$s</h1>
            %2$s<nav>
            <ul>
            %3$s</ul>
            </nav>
            %4$s</body>
            </html>
            """, escape(title), paragraphs(description), renderIndex(rules), sections);
    }

    private String renderIndex(List<ParsedRule> rules) {
        StringBuilder index = new StringBuilder();
        for (ParsedRule parsed : rules) {
            Rule rule = parsed.getRule();
            index.append(String.format("<li><a href=\"#%s\">%s</a></li>\n",
                escape(diagramBuilder.anchorFor(rule.getName())), escape(rule.getLabel())));
        }
        return index.toString();
    }

    String renderRule(ParsedRule parsed) {
        Rule rule = parsed.getRule();
        StringBuilder body = new StringBuilder();
        body.append(paragraphs(rule.getSummary()));
        if (parsed.hasSyntax()) {
            String ebnf = ebnfRenderer.renderRule(parsed.getSyntax(), rulePrefix, lineSeparator);
            body.append("<pre class=\"ebnf\">").append(escape(ebnf)).append("</pre>\n");
            body.append("<script type=\"application/json\" class=\"railroad\">")
                .append(diagramJson(parsed))
                .append("</script>\n");
        }
        body.append(paragraphs(rule.getDescription()));
        return String.format("""
            <section id="%s">
            <h2>%s</h2>
            %s</section>
            """, escape(diagramBuilder.anchorFor(rule.getName())), escape(rule.getLabel()), body);
    }

    private String diagramJson(ParsedRule parsed) {
        try {
            String json = objectMapper.writerFor(DiagramNode.class)
                .writeValueAsString(diagramBuilder.toDiagram(parsed.getSyntax()));
            // keep "</script>" inside a string from closing the element
            return json.replace("</", "<\\/");
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize diagram for rule " + parsed.getRule().getName(), e);
        }
    }

    /**
     * Blank-line separated prose as escaped paragraphs.
     */
    static String paragraphs(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        StringBuilder html = new StringBuilder();
        for (String paragraph : text.strip().split("\\R\\s*\\R")) {
            html.append("<p>").append(escape(paragraph.strip())).append("</p>\n");
        }
        return html.toString();
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&':
                    escaped.append("&amp;");
                    break;
                case '<':
                    escaped.append("&lt;");
                    break;
                case '>':
                    escaped.append("&gt;");
                    break;
                case '"':
                    escaped.append("&quot;");
                    break;
                case '\'':
                    escaped.append("&#39;");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
