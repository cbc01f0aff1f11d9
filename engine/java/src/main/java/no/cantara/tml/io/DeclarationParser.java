package no.cantara.tml.io;

import no.cantara.tml.model.Declaration;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a Declaration export (JSON or YAML) back into a {@link Declaration}.
 */
public final class DeclarationParser {

    // SafeConstructor keeps YAML tags from instantiating arbitrary Java types.
    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    private DeclarationParser() {}

    public static Declaration parse(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, DocumentFormat.fromPath(path));
        }
    }

    public static Declaration parse(InputStream is, DocumentFormat format) throws IOException {
        return switch (format) {
            case JSON -> TmlJson.mapper().readValue(is, Declaration.class);
            case YAML -> fromMap(loadYaml(is));
        };
    }

    /**
     * Binds an already-loaded document tree.
     *
     * @throws IllegalArgumentException if the tree does not describe a Declaration
     */
    public static Declaration fromMap(Map<String, Object> data) {
        if (data == null) {
            throw new IllegalArgumentException("Empty declaration document");
        }
        return TmlJson.mapper().convertValue(normalise(data), Declaration.class);
    }

    /** Loads a YAML document into a plain tree, with timestamps as ISO-8601 strings. */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> loadYaml(InputStream is) {
        Object loaded = YAML.load(is);
        if (!(loaded instanceof Map)) {
            throw new IllegalArgumentException("Expected a YAML mapping at the document root");
        }
        return (Map<String, Object>) normalise(loaded);
    }

    // SnakeYAML resolves unquoted timestamps to java.util.Date; the model uses Instant strings.
    private static Object normalise(Object value) {
        if (value instanceof Date d) {
            return d.toInstant().toString();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), normalise(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(normalise(v)));
            return copy;
        }
        return value;
    }
}
