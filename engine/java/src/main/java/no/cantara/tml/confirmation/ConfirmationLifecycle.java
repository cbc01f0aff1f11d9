package no.cantara.tml.confirmation;

import no.cantara.tml.io.TmlJson;
import no.cantara.tml.model.Confirmable;
import no.cantara.tml.model.ConfirmationRecord;
import no.cantara.tml.model.HumanIdentity;
import no.cantara.tml.model.IdGenerator;
import no.cantara.tml.model.Primitive;
import no.cantara.tml.model.ProvenanceAction;
import no.cantara.tml.model.ProvenanceEntry;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State transitions of a confirmable primitive, and the provenance each one must produce.
 *
 * <pre>
 *   unconfirmed ──confirm──▶ confirmed
 *        │     ──correct──▶ corrected
 *        └─────  flag  ───▶ flagged     (any state may be re-reviewed)
 * </pre>
 *
 * <p>Pure: nothing here writes to a Declaration or a store. A correction replaces only the
 * confirmation's display text; the primitive's structural fields are left untouched.
 */
public class ConfirmationLifecycle {

    static final String DEFAULT_FIELD = "assertion";

    private final Clock clock;
    private final IdGenerator ids;

    public ConfirmationLifecycle(Clock clock, IdGenerator ids) {
        this.clock = clock;
        this.ids = ids;
    }

    public ConfirmationOutcome transition(Confirmable primitive, ConfirmationRequest request) {
        if (!primitive.id().equals(request.primitiveId())) {
            throw new IllegalArgumentException("Request targets '" + request.primitiveId()
                    + "' but primitive is '" + primitive.id() + "'");
        }
        Instant now = clock.instant();
        String originalText = request.originalText() != null ? request.originalText() : primitive.assertionText();
        String field = request.field() != null ? request.field() : DEFAULT_FIELD;

        ConfirmationRecord record = switch (request.status()) {
            case CONFIRMED -> new ConfirmationRecord(request.status(), request.actor(), now, originalText, null, null);
            case CORRECTED -> new ConfirmationRecord(request.status(), request.actor(), now, originalText,
                    request.correctedText(), null);
            case FLAGGED -> new ConfirmationRecord(request.status(), request.actor(), now, originalText, null,
                    request.flagReason());
            case UNCONFIRMED -> throw new IllegalArgumentException("'unconfirmed' is not a confirmation target");
        };

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field", field);
        details.put("assertion_text", originalText);
        if (record.correctedText() != null) {
            details.put("corrected_text", record.correctedText());
        }
        if (record.flagReason() != null) {
            details.put("flag_reason", record.flagReason());
        }

        Map<String, Object> previous = primitive.confirmation() != null ? TmlJson.toMap(primitive.confirmation()) : null;
        ProvenanceEntry entry = new ProvenanceEntry(
                ids.next("prov"),
                primitive.owningScopeId(),
                primitive.id(),
                primitive.primitiveType(),
                actionFor(record),
                request.actor(),
                now,
                details,
                previous);

        return new ConfirmationOutcome(primitive.withConfirmation(record), record, entry);
    }

    /**
     * Provenance for a structural edit: the whole payload of {@code previous} is replaced.
     */
    public ProvenanceEntry structuralUpdate(Primitive previous, HumanIdentity actor) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", "primitive_update");
        details.put("field", "data");
        return new ProvenanceEntry(
                ids.next("prov"),
                previous.owningScopeId(),
                previous.id(),
                previous.primitiveType(),
                ProvenanceAction.CORRECTED,
                actor,
                clock.instant(),
                details,
                TmlJson.toMap(previous));
    }

    private static ProvenanceAction actionFor(ConfirmationRecord record) {
        return switch (record.status()) {
            case CONFIRMED -> ProvenanceAction.CONFIRMED;
            case CORRECTED -> ProvenanceAction.CORRECTED;
            case FLAGGED -> ProvenanceAction.FLAGGED;
            case UNCONFIRMED -> throw new IllegalStateException("unreachable");
        };
    }
}
