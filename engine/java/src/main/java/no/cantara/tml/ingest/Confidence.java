package no.cantara.tml.ingest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import no.cantara.tml.model.WireValues;

/**
 * How sure the structuring step was about an extracted primitive.
 */
public enum Confidence {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String value() {
        return WireValues.of(this);
    }

    /** Absent or blank values count as {@link #MEDIUM}. */
    @JsonCreator
    public static Confidence fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        return WireValues.parse(Confidence.class, value);
    }
}
