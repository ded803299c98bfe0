package im.arun.syntaxdoc.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String DEFAULT_RESOURCE = "config.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final SyntaxDocConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    /**
     * @param configPath YAML file to read; when null or missing the bundled
     *                   {@code config.yaml} is used, then built-in defaults
     */
    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private SyntaxDocConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), SyntaxDocConfig.class);
                }
                logger.warn("Config file not found: {}", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, SyntaxDocConfig.class);
                }
            }

            logger.warn("No config.yaml found, using default configuration");
            return new SyntaxDocConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new SyntaxDocConfig();
        }
    }

    public SyntaxDocConfig load() {
        return load(null);
    }

    /**
     * Copy of the loaded configuration with {@code userOptions} merged over it.
     * Keys may be given in snake_case or camelCase; unknown keys are logged and skipped.
     */
    public SyntaxDocConfig load(Map<String, Object> userOptions) {
        SyntaxDocConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            switch (key) {
                case "rule_prefix":
                case "rulePrefix":
                    config.setRulePrefix(value.toString());
                    break;
                case "line_separator":
                case "lineSeparator":
                    config.setLineSeparator(value.toString());
                    break;
                case "anchor_prefix":
                case "anchorPrefix":
                    config.setAnchorPrefix(value.toString());
                    break;
                case "output_format":
                case "outputFormat":
                    config.setOutputFormat(OutputFormat.fromId(value.toString()).getId());
                    break;
                case "page_title":
                case "pageTitle":
                    config.setPageTitle(value.toString());
                    break;
                case "parallel_parsing":
                case "parallelParsing":
                    config.setParallelParsing(parseBoolean(value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private SyntaxDocConfig copyConfig(SyntaxDocConfig source) {
        SyntaxDocConfig copy = new SyntaxDocConfig();
        copy.setRulePrefix(source.getRulePrefix());
        copy.setLineSeparator(source.getLineSeparator());
        copy.setAnchorPrefix(source.getAnchorPrefix());
        copy.setOutputFormat(source.getOutputFormat());
        copy.setPageTitle(source.getPageTitle());
        copy.setParallelParsing(source.isParallelParsing());
        return copy;
    }
}
