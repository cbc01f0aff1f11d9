package no.cantara.tml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Presentation a View projects its Capabilities into.
 */
public enum ProjectionFormat {
    CONFIRMATION,
    SUMMARY,
    OPERATIONAL,
    EXPORT;

    @JsonValue
    public String value() {
        return WireValues.of(this);
    }

    @JsonCreator
    public static ProjectionFormat fromValue(String value) {
        return WireValues.parse(ProjectionFormat.class, value);
    }
}
