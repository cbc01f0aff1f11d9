package no.cantara.tml.store;

import no.cantara.tml.model.Confirmable;
import no.cantara.tml.model.ConfirmationRecord;
import no.cantara.tml.model.ConfirmationStatus;
import no.cantara.tml.model.PrimitiveType;
import no.cantara.tml.model.ProvenanceEntry;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe {@link PrimitiveStore} held in memory. Writes to one id are atomic and the last one wins.
 */
public class InMemoryPrimitiveStore implements PrimitiveStore {

    private record Slot(long sequence, StoredPrimitive row) {}

    private final Map<String, Slot> primitives = new ConcurrentHashMap<>();
    private final List<ProvenanceEntry> provenance = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryPrimitiveStore() {
        this(Clock.systemUTC());
    }

    public InMemoryPrimitiveStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void store(StoredPrimitive primitive) {
        Objects.requireNonNull(primitive, "primitive");
        primitives.compute(primitive.id(), (id, existing) -> new Slot(
                existing != null ? existing.sequence() : sequence.incrementAndGet(), primitive));
    }

    @Override
    public Optional<StoredPrimitive> get(String primitiveId) {
        Slot slot = primitiveId != null ? primitives.get(primitiveId) : null;
        return Optional.ofNullable(slot).map(Slot::row);
    }

    @Override
    public List<StoredPrimitive> list(String scopeId, PrimitiveType type, ConfirmationStatus status) {
        return primitives.values().stream()
                .sorted(Comparator.comparingLong(Slot::sequence))
                .map(Slot::row)
                .filter(r -> scopeId == null || scopeId.equals(r.scopeId()))
                .filter(r -> type == null || r.type() == type)
                .filter(r -> status == null || r.confirmationStatus() == status)
                .toList();
    }

    @Override
    public void updateConfirmation(String primitiveId, ConfirmationRecord confirmation) {
        Slot updated = primitives.computeIfPresent(primitiveId, (id, slot) -> {
            if (!(slot.row().data() instanceof Confirmable confirmable)) {
                throw new IllegalArgumentException("Primitive '" + id + "' of type '"
                        + slot.row().type().value() + "' is not confirmable");
            }
            StoredPrimitive row = slot.row();
            return new Slot(slot.sequence(), new StoredPrimitive(row.id(), row.type(), row.scopeId(),
                    confirmable.withConfirmation(confirmation), row.source(), clock.instant()));
        });
        if (updated == null) {
            throw new IllegalArgumentException("Unknown primitive '" + primitiveId + "'");
        }
    }

    @Override
    public void appendProvenance(ProvenanceEntry entry) {
        provenance.add(Objects.requireNonNull(entry, "entry"));
    }

    @Override
    public List<ProvenanceEntry> getProvenance(String scopeId, String primitiveId) {
        return provenance.stream()
                .filter(e -> scopeId == null || scopeId.equals(e.scopeId()))
                .filter(e -> primitiveId == null || primitiveId.equals(e.primitiveId()))
                .toList();
    }
}
