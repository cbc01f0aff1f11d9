package no.cantara.tml.ingest;

import no.cantara.tml.model.ExtractionSource;
import no.cantara.tml.model.HumanIdentity;

import java.util.Objects;

/**
 * What the structured draft itself does not say: which Scope it describes, who owns it, and
 * where the raw material came from.
 *
 * @param parentScopeId optional enclosing Scope
 */
public record IngestContext(
        String scopeName,
        HumanIdentity owner,
        ExtractionSource source,
        String parentScopeId
) {
    public IngestContext {
        Objects.requireNonNull(scopeName, "scopeName");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(source, "source");
    }

    public IngestContext(String scopeName, HumanIdentity owner, ExtractionSource source) {
        this(scopeName, owner, source, null);
    }
}
