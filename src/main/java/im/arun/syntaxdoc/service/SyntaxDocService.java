package im.arun.syntaxdoc.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.syntaxdoc.config.OutputFormat;
import im.arun.syntaxdoc.config.SyntaxDocConfig;
import im.arun.syntaxdoc.diagram.DiagramBuilder;
import im.arun.syntaxdoc.diagram.DiagramNode;
import im.arun.syntaxdoc.ebnf.EbnfRenderer;
import im.arun.syntaxdoc.html.HtmlPageRenderer;
import im.arun.syntaxdoc.model.ParsedRule;
import im.arun.syntaxdoc.model.Rule;
import im.arun.syntaxdoc.model.RuleDocument;
import im.arun.syntaxdoc.reader.NotationReader;
import im.arun.syntaxdoc.reader.NotationSyntaxException;
import im.arun.syntaxdoc.syntax.Node;
import im.arun.syntaxdoc.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Turns a rule document into documentation: parses every rule's notation, then
 * renders the rules as an HTML page, an EBNF listing or diagram models in JSON.
 */
public class SyntaxDocService {
    private static final Logger logger = LoggerFactory.getLogger(SyntaxDocService.class);

    private final SyntaxDocConfig config;
    private final NotationReader reader;
    private final EbnfRenderer ebnfRenderer;
    private final DiagramBuilder diagramBuilder;
    private final HtmlPageRenderer htmlPageRenderer;
    private final ObjectMapper objectMapper;

    public SyntaxDocService(SyntaxDocConfig config) {
        this.config = config;
        this.reader = new NotationReader();
        this.ebnfRenderer = new EbnfRenderer(reader);
        this.diagramBuilder = new DiagramBuilder(config.getAnchorPrefix());
        this.htmlPageRenderer = new HtmlPageRenderer(
            ebnfRenderer, diagramBuilder, config.getRulePrefix(), config.getLineSeparator());
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public SyntaxDocService() {
        this(new SyntaxDocConfig());
    }

    /**
     * Parse the notation of every rule, keeping document order.
     * Rules without notation come back with a null syntax tree.
     *
     * @throws RuleSyntaxException for the first rule, in document order, whose notation is invalid
     */
    public List<ParsedRule> parseRules(RuleDocument document) {
        List<Rule> rules = document.getRules();
        if (!config.isParallelParsing() || rules.size() < 2) {
            return rules.stream().map(this::parseRule).collect(Collectors.toList());
        }

        List<CompletableFuture<ParsedRule>> futures = rules.stream()
            .map(rule -> CompletableFuture.supplyAsync(() -> parseRule(rule), ExecutorProvider.getExecutor()))
            .collect(Collectors.toList());
        try {
            return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    ParsedRule parseRule(Rule rule) {
        if (rule.getSyntax() == null) {
            logger.debug("Rule {} has no syntax", rule.getName());
            return new ParsedRule(rule, null);
        }
        try {
            Node syntax = reader.parse(rule.getSyntax());
            logger.debug("Parsed rule {}", rule.getName());
            return new ParsedRule(rule, syntax);
        } catch (NotationSyntaxException e) {
            throw new RuleSyntaxException(rule.getName(), e);
        }
    }

    public String render(RuleDocument document) {
        return render(document, OutputFormat.fromId(config.getOutputFormat()));
    }

    public String render(RuleDocument document, OutputFormat format) {
        List<ParsedRule> rules = parseRules(document);
        logger.info("Rendering {} rules as {}", rules.size(), format);
        switch (format) {
            case EBNF:
                return renderEbnf(rules);
            case DIAGRAM_JSON:
                return renderDiagramJson(rules);
            default:
                String title = document.getTitle() != null ? document.getTitle() : config.getPageTitle();
                return htmlPageRenderer.render(title, document.getDescription(), rules);
        }
    }

    /**
     * Rule names each followed by their {@code ::=} block, one blank line between rules.
     */
    public String renderEbnf(List<ParsedRule> rules) {
        StringBuilder buf = new StringBuilder();
        for (ParsedRule parsed : rules) {
            if (!parsed.hasSyntax()) {
                continue;
            }
            if (buf.length() > 0) {
                buf.append(config.getLineSeparator());
            }
            buf.append(parsed.getRule().getName()).append(config.getLineSeparator());
            buf.append(ebnfRenderer.renderRule(parsed.getSyntax(), config.getRulePrefix(), config.getLineSeparator()));
            buf.append(config.getLineSeparator());
        }
        return buf.toString();
    }

    /**
     * A JSON object mapping each rule name to its diagram model.
     */
    public String renderDiagramJson(List<ParsedRule> rules) {
        Map<String, DiagramNode> diagrams = new LinkedHashMap<>();
        for (ParsedRule parsed : rules) {
            if (parsed.hasSyntax()) {
                diagrams.put(parsed.getRule().getName(), diagramBuilder.toDiagram(parsed.getSyntax()));
            }
        }
        try {
            return objectMapper.writerFor(new TypeReference<Map<String, DiagramNode>>() {})
                .writeValueAsString(diagrams);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize diagrams", e);
        }
    }
}
