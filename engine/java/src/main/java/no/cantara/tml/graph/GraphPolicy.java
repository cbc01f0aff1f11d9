package no.cantara.tml.graph;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * The tunable heuristics of the graph computation: how Binding and Connector targets are
 * matched, and which description keywords mark a dependency as blocking or gating.
 *
 * <p>Keyword lists are kept in order and lowercased; blocking keywords are checked before gating ones.
 */
public record GraphPolicy(
        TargetMatchMode targetMatch,
        List<String> blockingKeywords,
        List<String> gatingKeywords
) {
    public static final List<String> DEFAULT_BLOCKING_KEYWORDS = List.of(
            "must", "requires", "blocks", "blocking", "required", "depends on", "prerequisite");
    public static final List<String> DEFAULT_GATING_KEYWORDS = List.of(
            "gates", "approves", "approval", "authorize", "gating", "review");

    public GraphPolicy {
        Objects.requireNonNull(targetMatch, "targetMatch");
        blockingKeywords = lowercased(blockingKeywords);
        gatingKeywords = lowercased(gatingKeywords);
    }

    public static GraphPolicy defaults() {
        return new GraphPolicy(TargetMatchMode.SUBSTRING, DEFAULT_BLOCKING_KEYWORDS, DEFAULT_GATING_KEYWORDS);
    }

    private static List<String> lowercased(List<String> keywords) {
        if (keywords == null) {
            return List.of();
        }
        return keywords.stream()
                .filter(Objects::nonNull)
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .filter(k -> !k.isEmpty())
                .toList();
    }
}
