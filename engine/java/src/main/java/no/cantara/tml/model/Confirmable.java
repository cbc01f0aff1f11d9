package no.cantara.tml.model;

/**
 * A primitive that can be confirmed, corrected or flagged by a human reviewer.
 *
 * <p>Scope, Archetype, Domain, Capability, Policy, Connector and Binding are confirmable;
 * View and ProvenanceEntry are not.
 */
public interface Confirmable extends Primitive {

    /** The current confirmation, or {@code null} while the primitive is unconfirmed. */
    ConfirmationRecord confirmation();

    ExtractionSource source();

    /** Returns a copy of this primitive carrying {@code confirmation}; all other fields are unchanged. */
    Confirmable withConfirmation(ConfirmationRecord confirmation);

    /** The assertion shown to the reviewer when no explicit text is supplied. */
    String assertionText();

    default ConfirmationStatus confirmationStatus() {
        ConfirmationRecord record = confirmation();
        return record != null ? record.status() : ConfirmationStatus.UNCONFIRMED;
    }

    default boolean countsAsConfirmed() {
        return confirmationStatus().countsAsConfirmed();
    }
}
