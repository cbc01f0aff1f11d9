package no.cantara.tml.confirmation;

import no.cantara.tml.model.Confirmable;
import no.cantara.tml.model.Declaration;
import no.cantara.tml.model.HumanIdentity;
import no.cantara.tml.model.IdGenerator;
import no.cantara.tml.model.Primitive;
import no.cantara.tml.model.ProvenanceEntry;
import no.cantara.tml.store.PrimitiveStore;
import no.cantara.tml.store.StoredPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * The two mutation entry points a review surface may call: {@link #confirm} for the
 * confirmation state of an assertion, and {@link #update} for structural edits of a primitive.
 *
 * <p>Each call writes a primitive and exactly one provenance entry. When a {@link PrimitiveStore}
 * is configured, both halves are written to it first; if the provenance append fails, the
 * primitive write is compensated and the Declaration is left untouched. Calls against the same
 * Declaration are serialised on it, so the store and the Declaration always agree on which
 * review of a primitive came last.
 */
public class ConfirmationService {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationService.class);

    /** Thrown when the request names a primitive the Declaration does not hold, or one that cannot be confirmed. */
    public static class UnknownPrimitiveException extends IllegalArgumentException {
        public UnknownPrimitiveException(String msg) { super(msg); }
    }

    /** Thrown when only one half of a confirmation could be persisted; the other half has been rolled back. */
    public static class ConfirmationWriteException extends IllegalStateException {
        public ConfirmationWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final ConfirmationLifecycle lifecycle;
    private final PrimitiveStore store;
    private final Clock clock;

    /** A service that only updates in-memory Declarations. */
    public ConfirmationService(Clock clock, IdGenerator ids) {
        this(null, clock, ids);
    }

    public ConfirmationService(PrimitiveStore store, Clock clock, IdGenerator ids) {
        this.lifecycle = new ConfirmationLifecycle(clock, ids);
        this.store = store;
        this.clock = clock;
    }

    /**
     * Confirms, corrects or flags one primitive of {@code declaration} and records the provenance.
     * Completion is recomputed afterwards.
     */
    public ConfirmationOutcome confirm(Declaration declaration, ConfirmationRequest request) {
        Confirmable current;
        ConfirmationOutcome outcome;
        synchronized (declaration) {
            current = declaration.findPrimitive(request.primitiveId())
                    .filter(Confirmable.class::isInstance)
                    .map(Confirmable.class::cast)
                    .orElseThrow(() -> new UnknownPrimitiveException("No confirmable primitive '"
                            + request.primitiveId() + "' in declaration " + declaration.getId()));

            outcome = lifecycle.transition(current, request);

            if (store != null) {
                Confirmable previous = current;
                store.updateConfirmation(current.id(), outcome.record());
                appendOrCompensate(outcome.provenance(),
                        () -> store.updateConfirmation(previous.id(), previous.confirmation()));
            }

            declaration.replace(outcome.updated());
            declaration.appendProvenance(outcome.provenance());
            declaration.markConfirmedAt(outcome.record().confirmedAt());
            declaration.computeCompletion();
        }
        log.info("{} {} '{}' by {} ({}% complete)", outcome.record().status().value(),
                current.primitiveType().value(), current.id(), request.actor().email(),
                String.format("%.1f", declaration.getCompletionPercentage()));
        return outcome;
    }

    /**
     * Replaces the structured payload of a primitive wholesale. The primitive keeps its current
     * confirmation; use {@link #confirm} to change that.
     *
     * @return the primitive as stored in the Declaration
     */
    public Primitive update(Declaration declaration, Primitive replacement, HumanIdentity actor) {
        Objects.requireNonNull(replacement, "replacement");
        Primitive current;
        Primitive updated;
        synchronized (declaration) {
            current = declaration.findPrimitive(replacement.id())
                    .filter(p -> p.primitiveType() == replacement.primitiveType())
                    .orElseThrow(() -> new UnknownPrimitiveException("No " + replacement.primitiveType().value()
                            + " '" + replacement.id() + "' in declaration " + declaration.getId()));

            updated = current instanceof Confirmable c
                    ? ((Confirmable) replacement).withConfirmation(c.confirmation())
                    : replacement;
            ProvenanceEntry entry = lifecycle.structuralUpdate(current, actor);

            if (store != null) {
                Primitive previous = current;
                String source = store.get(current.id()).map(StoredPrimitive::source).orElse("update");
                store.store(StoredPrimitive.of(updated, source, clock.instant()));
                appendOrCompensate(entry, () -> store.store(StoredPrimitive.of(previous, source, clock.instant())));
            }

            declaration.replace(updated);
            declaration.appendProvenance(entry);
            declaration.computeCompletion();
        }
        log.info("Updated {} '{}' by {}", current.primitiveType().value(), current.id(), actor.email());
        return updated;
    }

    private void appendOrCompensate(ProvenanceEntry entry, Runnable compensation) {
        try {
            store.appendProvenance(entry);
        } catch (RuntimeException e) {
            log.error("Provenance append failed for '{}'; restoring previous state", entry.primitiveId(), e);
            try {
                compensation.run();
            } catch (RuntimeException restoreFailure) {
                e.addSuppressed(restoreFailure);
            }
            throw new ConfirmationWriteException("Could not record provenance for '" + entry.primitiveId() + "'", e);
        }
    }
}
