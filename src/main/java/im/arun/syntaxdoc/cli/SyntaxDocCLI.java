package im.arun.syntaxdoc.cli;

import im.arun.syntaxdoc.config.ConfigLoader;
import im.arun.syntaxdoc.config.OutputFormat;
import im.arun.syntaxdoc.config.SyntaxDocConfig;
import im.arun.syntaxdoc.loader.DocumentFormat;
import im.arun.syntaxdoc.loader.RuleDocumentLoader;
import im.arun.syntaxdoc.model.RuleDocument;
import im.arun.syntaxdoc.service.SyntaxDocService;
import im.arun.syntaxdoc.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for SyntaxDoc using Picocli.
 */
@Command(
    name = "syntaxdoc",
    description = "Generates documentation for a formal syntax",
    mixinStandardHelpOptions = true,
    version = "SyntaxDoc 1.0"
)
public class SyntaxDocCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(SyntaxDocCLI.class);

    @Option(names = {"-i", "--input"}, description = "The rule document (default: standard input)")
    private Path inputPath;

    @Option(names = {"-o", "--output"}, description = "The output file (default: standard output)")
    private Path outputPath;

    @Option(names = {"-f", "--format"}, description = "Output format: html, ebnf or diagram-json")
    private String format;

    @Option(names = {"--input-format"}, description = "Format of the rule document: toml, yaml or json (default: from extension, toml for standard input)")
    private String inputFormat;

    @Option(names = {"--prefix"}, description = "Text put in front of every ::= line")
    private String prefix;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    private final PrintStream stdout;

    public SyntaxDocCLI() {
        this(System.out);
    }

    SyntaxDocCLI(PrintStream stdout) {
        this.stdout = stdout;
    }

    @Override
    public Integer call() {
        if (inputPath != null && !Files.exists(inputPath)) {
            logger.error("Input file not found: {}", inputPath);
            return 1;
        }

        try {
            Map<String, Object> options = new HashMap<>();
            options.put("outputFormat", format);
            options.put("rulePrefix", prefix);
            SyntaxDocConfig config = new ConfigLoader(configPath).load(options);

            RuleDocument document = loadDocument();
            String output = new SyntaxDocService(config).render(document, OutputFormat.fromId(config.getOutputFormat()));

            if (outputPath != null) {
                Files.writeString(outputPath, output, StandardCharsets.UTF_8);
                logger.info("Output written to: {}", outputPath);
            } else {
                stdout.print(output);
                stdout.flush();
            }
            return 0;
        } catch (IOException e) {
            logger.error("Error reading or writing documents: {}", e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            logger.error(e.getMessage());
            logger.debug("Generation failed", e);
            return 1;
        }
    }

    private RuleDocument loadDocument() throws IOException {
        RuleDocumentLoader loader = new RuleDocumentLoader();
        DocumentFormat explicit = inputFormat != null ? DocumentFormat.fromName(inputFormat) : null;
        if (inputPath == null) {
            return loader.load(System.in, explicit != null ? explicit : DocumentFormat.TOML);
        }
        return explicit != null ? loader.load(inputPath, explicit) : loader.load(inputPath);
    }

    public static void main(String[] args) {
        try {
            int exitCode = new CommandLine(new SyntaxDocCLI()).execute(args);
            System.exit(exitCode);
        } finally {
            ExecutorProvider.shutdown();
        }
    }
}
