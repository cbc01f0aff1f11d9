package no.cantara.tml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Hard policies are never violated; soft policies may be overridden with a reason.
 */
public enum EnforcementLevel {
    HARD,
    SOFT;

    @JsonValue
    public String value() {
        return WireValues.of(this);
    }

    @JsonCreator
    public static EnforcementLevel fromValue(String value) {
        return WireValues.parse(EnforcementLevel.class, value);
    }
}
