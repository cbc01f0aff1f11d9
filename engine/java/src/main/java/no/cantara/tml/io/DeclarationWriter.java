package no.cantara.tml.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Exports Declarations and organizational graphs as JSON or YAML documents.
 */
public final class DeclarationWriter {

    private static final Yaml YAML;

    static {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        options.setIndicatorIndent(2);
        options.setIndentWithIndicator(true);
        YAML = new Yaml(options);
    }

    private DeclarationWriter() {}

    public static String toJson(Object document) {
        try {
            return TmlJson.mapper().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toYaml(Object document) {
        return YAML.dump(TmlJson.toMap(document));
    }

    public static String render(Object document, DocumentFormat format) {
        return switch (format) {
            case JSON -> toJson(document);
            case YAML -> toYaml(document);
        };
    }

    /** Writes {@code document} to {@code path} in the format implied by its extension. */
    public static void write(Object document, Path path) throws IOException {
        Files.writeString(path, render(document, DocumentFormat.fromPath(path)));
    }
}
