package no.cantara.tml.confirmation;

import no.cantara.tml.model.ConfirmationStatus;
import no.cantara.tml.model.HumanIdentity;

import java.util.Objects;

/**
 * A reviewer's verdict on one assertion about one primitive.
 *
 * @param primitiveId   the primitive under review
 * @param status        confirmed, corrected or flagged
 * @param actor         the reviewer
 * @param originalText  the assertion as shown; {@code null} uses the primitive's own assertion text
 * @param correctedText replacement display text, required when {@code status} is corrected
 * @param field         which field of the primitive the assertion was drawn from
 * @param flagReason    optional note on why the assertion is deferred
 */
public record ConfirmationRequest(
        String primitiveId,
        ConfirmationStatus status,
        HumanIdentity actor,
        String originalText,
        String correctedText,
        String field,
        String flagReason
) {
    public ConfirmationRequest {
        Objects.requireNonNull(primitiveId, "primitiveId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(actor, "actor");
        if (status == ConfirmationStatus.UNCONFIRMED) {
            throw new IllegalArgumentException("A confirmation must confirm, correct or flag; 'unconfirmed' is not a target");
        }
        if (status == ConfirmationStatus.CORRECTED && (correctedText == null || correctedText.isBlank())) {
            throw new IllegalArgumentException("A correction requires the corrected text");
        }
    }

    public static ConfirmationRequest confirm(String primitiveId, HumanIdentity actor, String originalText) {
        return new ConfirmationRequest(primitiveId, ConfirmationStatus.CONFIRMED, actor, originalText, null, null, null);
    }

    public static ConfirmationRequest correct(String primitiveId, HumanIdentity actor, String originalText, String correctedText) {
        return new ConfirmationRequest(primitiveId, ConfirmationStatus.CORRECTED, actor, originalText, correctedText, null, null);
    }

    public static ConfirmationRequest flag(String primitiveId, HumanIdentity actor, String originalText, String reason) {
        return new ConfirmationRequest(primitiveId, ConfirmationStatus.FLAGGED, actor, originalText, null, null, reason);
    }

    public ConfirmationRequest withField(String field) {
        return new ConfirmationRequest(primitiveId, status, actor, originalText, correctedText, field, flagReason);
    }
}
