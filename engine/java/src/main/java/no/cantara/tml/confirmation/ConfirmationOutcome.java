package no.cantara.tml.confirmation;

import no.cantara.tml.model.Confirmable;
import no.cantara.tml.model.ConfirmationRecord;
import no.cantara.tml.model.ProvenanceEntry;

/**
 * The two halves of one confirmation: the primitive carrying its new record, and the
 * provenance entry describing the change. Neither half may be written without the other.
 */
public record ConfirmationOutcome(
        Confirmable updated,
        ConfirmationRecord record,
        ProvenanceEntry provenance
) {}
