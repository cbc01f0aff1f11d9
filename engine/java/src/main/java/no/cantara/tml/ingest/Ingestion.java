package no.cantara.tml.ingest;

import no.cantara.tml.model.Declaration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A freshly ingested Declaration and the structuring confidence of each of its primitives.
 */
public record Ingestion(Declaration declaration, Map<String, Confidence> confidenceById) {

    public Ingestion {
        confidenceById = Collections.unmodifiableMap(new LinkedHashMap<>(confidenceById));
    }

    /** Primitive ids to follow up on in an interview, in ingestion order. */
    public List<String> lowConfidenceIds() {
        return confidenceById.entrySet().stream()
                .filter(e -> e.getValue() == Confidence.LOW)
                .map(Map.Entry::getKey)
                .toList();
    }
}
