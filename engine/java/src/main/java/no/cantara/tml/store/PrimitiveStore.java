package no.cantara.tml.store;

import no.cantara.tml.model.ConfirmationRecord;
import no.cantara.tml.model.ConfirmationStatus;
import no.cantara.tml.model.PrimitiveType;
import no.cantara.tml.model.ProvenanceEntry;

import java.util.List;
import java.util.Optional;

/**
 * Keyed object store for primitives plus an append-only provenance log.
 *
 * <p>Implementations serialise writes to a single primitive id (last writer wins); the engine
 * does no locking of its own. Filter arguments passed as {@code null} match everything.
 */
public interface PrimitiveStore {

    /** Inserts or replaces the payload stored under {@code primitive.id()}. */
    void store(StoredPrimitive primitive);

    Optional<StoredPrimitive> get(String primitiveId);

    /** Rows in insertion order, optionally filtered by scope, type and confirmation status. */
    List<StoredPrimitive> list(String scopeId, PrimitiveType type, ConfirmationStatus status);

    /**
     * Replaces the confirmation of a stored confirmable primitive; {@code null} resets it to unconfirmed.
     *
     * @throws IllegalArgumentException if the id is unknown or the primitive is not confirmable
     */
    void updateConfirmation(String primitiveId, ConfirmationRecord confirmation);

    void appendProvenance(ProvenanceEntry entry);

    /** Provenance entries in append order, optionally filtered by scope and primitive. */
    List<ProvenanceEntry> getProvenance(String scopeId, String primitiveId);
}
