package no.cantara.tml.graph;

import java.util.Locale;

/**
 * Decides whether a Binding target and a Connector source name the same real-world target.
 *
 * <p>Matching favours recall: a spurious flow is reviewed by a human later, a missed one is
 * never seen. In substring mode a blank target is contained in every other target and so
 * matches all of them; {@code null} counts as blank.
 */
public final class TargetMatcher {

    private final TargetMatchMode mode;

    public TargetMatcher(TargetMatchMode mode) {
        this.mode = mode;
    }

    /** The default rule: case-insensitive, trimmed, containment in either direction. */
    public static boolean targetsMatch(String writesTo, String readsFrom) {
        return new TargetMatcher(TargetMatchMode.SUBSTRING).matches(writesTo, readsFrom);
    }

    public boolean matches(String writesTo, String readsFrom) {
        String w = normalise(writesTo);
        String r = normalise(readsFrom);
        return switch (mode) {
            case EXACT -> w.equals(r);
            case SUBSTRING -> w.contains(r) || r.contains(w);
        };
    }

    private static String normalise(String target) {
        return target == null ? "" : target.trim().toLowerCase(Locale.ROOT);
    }
}
