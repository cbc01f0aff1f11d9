package no.cantara.tml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What happened to a primitive, as recorded in its provenance log.
 */
public enum ProvenanceAction {
    EXTRACTED,
    STRUCTURED,
    CONFIRMED,
    CORRECTED,
    FLAGGED;

    @JsonValue
    public String value() {
        return WireValues.of(this);
    }

    @JsonCreator
    public static ProvenanceAction fromValue(String value) {
        return WireValues.parse(ProvenanceAction.class, value);
    }
}
