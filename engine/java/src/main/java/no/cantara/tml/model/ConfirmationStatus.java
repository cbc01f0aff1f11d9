package no.cantara.tml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Human review state of a confirmable primitive.
 */
public enum ConfirmationStatus {
    UNCONFIRMED,
    CONFIRMED,
    CORRECTED,
    FLAGGED;

    @JsonValue
    public String value() {
        return WireValues.of(this);
    }

    @JsonCreator
    public static ConfirmationStatus fromValue(String value) {
        return WireValues.parse(ConfirmationStatus.class, value);
    }

    /** Confirmed and corrected assertions both count as validated; flagged ones do not. */
    public boolean countsAsConfirmed() {
        return this == CONFIRMED || this == CORRECTED;
    }
}
