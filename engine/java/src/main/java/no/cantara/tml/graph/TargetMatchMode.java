package no.cantara.tml.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import no.cantara.tml.model.WireValues;

/**
 * How a Binding's {@code writes_to} is compared with a Connector's {@code reads_from}.
 */
public enum TargetMatchMode {
    /** Case-insensitive, trimmed, either side may contain the other. */
    SUBSTRING,
    /** Case-insensitive, trimmed equality. */
    EXACT;

    @JsonValue
    public String value() {
        return WireValues.of(this);
    }

    @JsonCreator
    public static TargetMatchMode fromValue(String value) {
        return WireValues.parse(TargetMatchMode.class, value);
    }
}
