package no.cantara.tml.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import no.cantara.tml.model.WireValues;

/**
 * Strength of a dependency between two Capabilities, strongest first.
 */
public enum DependencyType {
    BLOCKING,
    GATING,
    INFORMING;

    @JsonValue
    public String value() {
        return WireValues.of(this);
    }

    @JsonCreator
    public static DependencyType fromValue(String value) {
        return WireValues.parse(DependencyType.class, value);
    }
}
