package no.cantara.tml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The nine closed primitive types.
 */
public enum PrimitiveType {
    SCOPE,
    DOMAIN,
    CAPABILITY,
    VIEW,
    ARCHETYPE,
    POLICY,
    CONNECTOR,
    BINDING,
    PROVENANCE;

    @JsonValue
    public String value() {
        return WireValues.of(this);
    }

    @JsonCreator
    public static PrimitiveType fromValue(String value) {
        return WireValues.parse(PrimitiveType.class, value);
    }

    /** View and Provenance carry no confirmation record. */
    public boolean isConfirmable() {
        return this != VIEW && this != PROVENANCE;
    }
}
