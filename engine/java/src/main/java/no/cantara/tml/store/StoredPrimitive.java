package no.cantara.tml.store;

import no.cantara.tml.model.Confirmable;
import no.cantara.tml.model.ConfirmationStatus;
import no.cantara.tml.model.Primitive;
import no.cantara.tml.model.PrimitiveType;

import java.time.Instant;
import java.util.Objects;

/**
 * One row of the primitive store: the typed payload plus the keys it is listed by.
 *
 * @param source label of the extraction that produced the payload, e.g. {@code interview:jane@example.com}
 */
public record StoredPrimitive(
        String id,
        PrimitiveType type,
        String scopeId,
        Primitive data,
        String source,
        Instant storedAt
) {
    public StoredPrimitive {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(data, "data");
    }

    public static StoredPrimitive of(Primitive data, String source, Instant storedAt) {
        return new StoredPrimitive(data.id(), data.primitiveType(), data.owningScopeId(), data, source, storedAt);
    }

    public ConfirmationStatus confirmationStatus() {
        return data instanceof Confirmable c ? c.confirmationStatus() : ConfirmationStatus.UNCONFIRMED;
    }
}
