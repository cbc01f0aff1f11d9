package no.cantara.tml.store;

import no.cantara.tml.model.Declaration;
import no.cantara.tml.model.IdGenerator;
import no.cantara.tml.model.Primitive;
import no.cantara.tml.model.PrimitiveType;
import no.cantara.tml.model.ProvenanceEntry;
import no.cantara.tml.model.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Moves Declarations in and out of a {@link PrimitiveStore}.
 */
public class DeclarationAssembler {

    private static final Logger log = LoggerFactory.getLogger(DeclarationAssembler.class);

    private final PrimitiveStore store;
    private final IdGenerator ids;
    private final Clock clock;

    public DeclarationAssembler(PrimitiveStore store) {
        this(store, IdGenerator.random(), Clock.systemUTC());
    }

    public DeclarationAssembler(PrimitiveStore store, IdGenerator ids, Clock clock) {
        this.store = store;
        this.ids = ids;
        this.clock = clock;
    }

    /**
     * Stores every primitive of {@code declaration} and appends the provenance entries the
     * store does not already hold.
     */
    public void persist(Declaration declaration, String sourceLabel) {
        for (Primitive primitive : declaration.primitives()) {
            store.store(StoredPrimitive.of(primitive, sourceLabel, clock.instant()));
        }
        String scopeId = declaration.getScope().id();
        Set<String> known = new HashSet<>();
        store.getProvenance(scopeId, null).forEach(e -> known.add(e.id()));
        int appended = 0;
        for (ProvenanceEntry entry : declaration.getProvenance()) {
            if (known.add(entry.id())) {
                store.appendProvenance(entry);
                appended++;
            }
        }
        log.info("Persisted declaration {} for scope {}: {} primitives, {} new provenance entries",
                declaration.getId(), scopeId, declaration.primitives().size(), appended);
    }

    /**
     * Rebuilds a Declaration from everything stored under {@code scopeId}.
     *
     * @return empty if the store holds no Scope with that id
     */
    public Optional<Declaration> assemble(String scopeId) {
        Optional<StoredPrimitive> scopeRow = store.get(scopeId)
                .filter(row -> row.type() == PrimitiveType.SCOPE);
        if (scopeRow.isEmpty()) {
            log.debug("No scope '{}' in store", scopeId);
            return Optional.empty();
        }

        Declaration.Builder builder = Declaration.builder(ids.next("decl"), (Scope) scopeRow.get().data())
                .createdAt(clock.instant());
        List<StoredPrimitive> rows = store.list(scopeId, null, null);
        for (StoredPrimitive row : rows) {
            if (row.type() != PrimitiveType.SCOPE) {
                builder.add(row.data());
            }
        }
        builder.provenance(store.getProvenance(scopeId, null));

        Declaration declaration = builder.build();
        log.debug("Assembled {}", declaration);
        return Optional.of(declaration);
    }
}
