package im.arun.syntaxdoc.loader;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Serialization formats a rule document may be written in.
 */
public enum DocumentFormat {
    TOML,
    YAML,
    JSON;

    /**
     * Guess the format from a file extension.
     *
     * @return the format, or null when the extension is not recognized
     */
    public static DocumentFormat fromPath(Path path) {
        String filename = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (filename.endsWith(".toml")) {
            return TOML;
        } else if (filename.endsWith(".yaml") || filename.endsWith(".yml")) {
            return YAML;
        } else if (filename.endsWith(".json")) {
            return JSON;
        }
        return null;
    }

    public static DocumentFormat fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown document format: " + name + " (expected toml, yaml or json)", e);
        }
    }
}
