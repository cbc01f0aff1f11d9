package no.cantara.tml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Relative importance of a decision factor.
 */
public enum FactorWeight {
    PRIMARY,
    SECONDARY,
    TIEBREAKER;

    @JsonValue
    public String value() {
        return WireValues.of(this);
    }

    @JsonCreator
    public static FactorWeight fromValue(String value) {
        return WireValues.parse(FactorWeight.class, value);
    }
}
