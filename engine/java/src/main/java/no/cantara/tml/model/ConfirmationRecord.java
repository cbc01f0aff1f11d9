package no.cantara.tml.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Who confirmed, corrected or flagged an assertion, and when.
 *
 * @param status        the review outcome
 * @param confirmedBy   the reviewing actor
 * @param confirmedAt   when the review happened
 * @param originalText  the assertion as it was shown to the reviewer
 * @param correctedText the reviewer's replacement text, only for {@link ConfirmationStatus#CORRECTED}
 * @param flagReason    why the assertion was deferred, only for {@link ConfirmationStatus#FLAGGED}
 */
public record ConfirmationRecord(
        ConfirmationStatus status,
        HumanIdentity confirmedBy,
        Instant confirmedAt,
        String originalText,
        String correctedText,
        String flagReason
) {
    public ConfirmationRecord {
        Objects.requireNonNull(status, "status");
    }

    /** The text a reader should see: the correction if there is one, else the original. */
    public String displayText() {
        return correctedText != null ? correctedText : originalText;
    }
}
