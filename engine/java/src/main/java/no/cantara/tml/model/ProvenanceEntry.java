package no.cantara.tml.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable audit entry: who did what to which primitive, and when.
 *
 * @param details       free-form description of the change; for confirmations at least
 *                      {@code field} and {@code assertion_text}
 * @param previousState snapshot of what was replaced, or {@code null}
 */
public record ProvenanceEntry(
        String id,
        String scopeId,
        String primitiveId,
        PrimitiveType primitiveType,
        ProvenanceAction action,
        HumanIdentity actor,
        Instant timestamp,
        Map<String, Object> details,
        Map<String, Object> previousState
) {
    public ProvenanceEntry {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
        previousState = previousState != null ? Collections.unmodifiableMap(new LinkedHashMap<>(previousState)) : null;
    }
}
