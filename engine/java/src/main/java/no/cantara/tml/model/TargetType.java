package no.cantara.tml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of target a Connector reads from or a Binding writes to.
 */
public enum TargetType {
    CAPABILITY,
    DOMAIN,
    EXTERNAL_SYSTEM;

    @JsonValue
    public String value() {
        return WireValues.of(this);
    }

    @JsonCreator
    public static TargetType fromValue(String value) {
        return WireValues.parse(TargetType.class, value);
    }
}
