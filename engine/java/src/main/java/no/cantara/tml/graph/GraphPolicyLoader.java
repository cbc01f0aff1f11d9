package no.cantara.tml.graph;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads a {@link GraphPolicy} from YAML:
 *
 * <pre>
 * target_match: substring        # or: exact
 * blocking_keywords: [must, requires, ...]
 * gating_keywords: [gates, approval, ...]
 * </pre>
 *
 * Keys that are absent keep their default value.
 */
public final class GraphPolicyLoader {

    static final String DEFAULT_RESOURCE = "tml-graph-policy.yaml";

    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    private GraphPolicyLoader() {}

    /** The policy bundled on the classpath, or the built-in defaults if the resource is absent. */
    public static GraphPolicy loadDefault() {
        try (InputStream is = GraphPolicyLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            return is != null ? load(is) : GraphPolicy.defaults();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static GraphPolicy load(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        }
    }

    /**
     * @throws IllegalArgumentException if the document is not a mapping or a key has the wrong shape
     */
    @SuppressWarnings("unchecked")
    public static GraphPolicy load(InputStream is) {
        Object data = YAML.load(is);
        if (data == null) {
            return GraphPolicy.defaults();
        }
        if (!(data instanceof Map)) {
            throw new IllegalArgumentException("Graph policy must be a mapping, got " + data.getClass().getSimpleName());
        }
        return fromMap((Map<String, Object>) data);
    }

    /**
     * @throws IllegalArgumentException if {@code target_match} is not a known mode, or a keyword key
     *                                  is not a list of strings
     */
    public static GraphPolicy fromMap(Map<String, Object> data) {
        GraphPolicy defaults = GraphPolicy.defaults();
        Object mode = data.get("target_match");
        if (mode != null && !(mode instanceof String)) {
            throw new IllegalArgumentException("'target_match' must be a string");
        }
        return new GraphPolicy(
                mode != null ? TargetMatchMode.fromValue((String) mode) : defaults.targetMatch(),
                keywords(data, "blocking_keywords", defaults.blockingKeywords()),
                keywords(data, "gating_keywords", defaults.gatingKeywords()));
    }

    private static List<String> keywords(Map<String, Object> data, String key, List<String> fallback) {
        Object raw = data.get(key);
        if (raw == null) {
            return fallback;
        }
        if (!(raw instanceof List<?> list)) {
            throw new IllegalArgumentException("'" + key + "' must be a list of strings");
        }
        List<String> keywords = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof String keyword)) {
                throw new IllegalArgumentException("Entries of '" + key + "' must be strings, got " + item);
            }
            keywords.add(keyword);
        }
        return keywords;
    }
}
