package im.arun.syntaxdoc.loader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.syntaxdoc.model.Rule;
import im.arun.syntaxdoc.model.RuleDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads rule documents from TOML, YAML or JSON.
 * Rules come back in document order with their label defaulted to their name.
 */
public class RuleDocumentLoader {
    private static final Logger logger = LoggerFactory.getLogger(RuleDocumentLoader.class);

    private final ObjectMapper tomlMapper = new TomlMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ObjectMapper jsonMapper = new ObjectMapper();

    /**
     * Load a document, picking the format from the file extension.
     *
     * @throws IOException              if the file cannot be read or is malformed
     * @throws IllegalArgumentException if the extension is not one of .toml, .yaml, .yml, .json
     */
    public RuleDocument load(Path path) throws IOException {
        DocumentFormat format = DocumentFormat.fromPath(path);
        if (format == null) {
            throw new IllegalArgumentException("Cannot tell the format of " + path + " from its extension");
        }
        return load(path, format);
    }

    public RuleDocument load(Path path, DocumentFormat format) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            RuleDocument document = load(in, format);
            logger.info("Loaded {} rules from {}", document.getRules().size(), path);
            return document;
        }
    }

    public RuleDocument load(InputStream in, DocumentFormat format) throws IOException {
        RuleDocument document = mapperFor(format).readValue(in, RuleDocument.class);
        return normalize(document);
    }

    private ObjectMapper mapperFor(DocumentFormat format) {
        switch (format) {
            case TOML:
                return tomlMapper;
            case YAML:
                return yamlMapper;
            default:
                return jsonMapper;
        }
    }

    private RuleDocument normalize(RuleDocument document) {
        if (document == null) {
            document = new RuleDocument();
        }
        List<Rule> rules = document.getRules() != null ? new ArrayList<>(document.getRules()) : new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            if (rule == null || rule.getName() == null || rule.getName().isBlank()) {
                throw new IllegalArgumentException("Rule #" + (i + 1) + " has no name");
            }
            if (rule.getLabel() == null) {
                rule.setLabel(rule.getName());
            }
        }
        document.setRules(rules);
        return document;
    }
}
