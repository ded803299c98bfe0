package im.arun.syntaxdoc.config;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Kinds of document the generator can write.
 */
public enum OutputFormat {
    HTML("html"),
    EBNF("ebnf"),
    DIAGRAM_JSON("diagram-json");

    private final String id;

    OutputFormat(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Look up a format by id, ignoring case; {@code diagram_json} is accepted too.
     */
    public static OutputFormat fromId(String id) {
        if (id != null) {
            String normalized = id.trim().replace('_', '-');
            for (OutputFormat format : values()) {
                if (format.id.equalsIgnoreCase(normalized)) {
                    return format;
                }
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + id + " (expected one of "
            + Arrays.stream(values()).map(OutputFormat::getId).collect(Collectors.joining(", ")) + ")");
    }

    @Override
    public String toString() {
        return id;
    }
}
