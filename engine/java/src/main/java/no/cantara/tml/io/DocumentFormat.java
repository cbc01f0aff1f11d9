package no.cantara.tml.io;

import java.nio.file.Path;
import java.util.Locale;

/**
 * On-disk representation of an exported document.
 */
public enum DocumentFormat {
    JSON,
    YAML;

    /** {@code .yaml}/{@code .yml} files are YAML; everything else is read as JSON. */
    public static DocumentFormat fromPath(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? YAML : JSON;
    }

    public static DocumentFormat fromName(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "json" -> JSON;
            case "yaml", "yml" -> YAML;
            default -> throw new IllegalArgumentException("Unknown format '" + name + "'; expected json or yaml");
        };
    }
}
