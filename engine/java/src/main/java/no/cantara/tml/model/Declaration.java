package no.cantara.tml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The aggregate root: one Scope, every primitive scoped to it, and its provenance log.
 *
 * <p>A Declaration is created once per extraction pass and updated in place as confirmations
 * arrive. Primitives are kept as slots keyed by id; {@link #replace(Primitive)} swaps a single
 * slot and {@link #appendProvenance(ProvenanceEntry)} only ever appends. There is no deletion path.
 *
 * <p>Completion is recomputed on demand by scanning the seven confirmable collections
 * (Scope counts as one); nothing is cached.
 */
@JsonPropertyOrder({"id", "version", "scope", "archetypes", "domains", "capabilities", "views",
        "policies", "connectors", "bindings", "provenance", "created_at", "last_confirmed_at",
        "completion_percentage"})
public class Declaration {

    private final String id;
    private final String version;
    private Scope scope;
    private final List<Archetype> archetypes;
    private final List<Domain> domains;
    private final List<Capability> capabilities;
    private final List<View> views;
    private final List<Policy> policies;
    private final List<Connector> connectors;
    private final List<Binding> bindings;
    private final List<ProvenanceEntry> provenance;
    private final Instant createdAt;
    private Instant lastConfirmedAt;
    private double completionPercentage;

    @JsonCreator
    public Declaration(
            @JsonProperty("id") String id,
            @JsonProperty("version") String version,
            @JsonProperty("scope") Scope scope,
            @JsonProperty("archetypes") List<Archetype> archetypes,
            @JsonProperty("domains") List<Domain> domains,
            @JsonProperty("capabilities") List<Capability> capabilities,
            @JsonProperty("views") List<View> views,
            @JsonProperty("policies") List<Policy> policies,
            @JsonProperty("connectors") List<Connector> connectors,
            @JsonProperty("bindings") List<Binding> bindings,
            @JsonProperty("provenance") List<ProvenanceEntry> provenance,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("last_confirmed_at") Instant lastConfirmedAt,
            @JsonProperty("completion_percentage") double completionPercentage) {
        this.id = id;
        this.version = version;
        this.scope = scope;
        this.archetypes = mutableCopy(archetypes);
        this.domains = mutableCopy(domains);
        this.capabilities = mutableCopy(capabilities);
        this.views = mutableCopy(views);
        this.policies = mutableCopy(policies);
        this.connectors = mutableCopy(connectors);
        this.bindings = mutableCopy(bindings);
        this.provenance = mutableCopy(provenance);
        this.createdAt = createdAt;
        this.lastConfirmedAt = lastConfirmedAt;
        this.completionPercentage = completionPercentage;
    }

    public static Builder builder(String id, Scope scope) {
        return new Builder(id, scope);
    }

    // ── Accessors ────────────────────────────────────────────────────────────────

    public String getId() { return id; }
    public String getVersion() { return version; }
    public Scope getScope() { return scope; }
    public List<Archetype> getArchetypes() { return Collections.unmodifiableList(archetypes); }
    public List<Domain> getDomains() { return Collections.unmodifiableList(domains); }
    public List<Capability> getCapabilities() { return Collections.unmodifiableList(capabilities); }
    public List<View> getViews() { return Collections.unmodifiableList(views); }
    public List<Policy> getPolicies() { return Collections.unmodifiableList(policies); }
    public List<Connector> getConnectors() { return Collections.unmodifiableList(connectors); }
    public List<Binding> getBindings() { return Collections.unmodifiableList(bindings); }
    public List<ProvenanceEntry> getProvenance() { return Collections.unmodifiableList(provenance); }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastConfirmedAt() { return lastConfirmedAt; }
    public double getCompletionPercentage() { return completionPercentage; }

    // ── Completion accounting ────────────────────────────────────────────────────

    /**
     * The confirmable primitives in declaration order: Scope, Archetypes, Domains,
     * Capabilities, Policies, Connectors, Bindings.
     */
    public synchronized List<Confirmable> confirmables() {
        List<Confirmable> all = new ArrayList<>();
        if (scope != null) {
            all.add(scope);
        }
        all.addAll(archetypes);
        all.addAll(domains);
        all.addAll(capabilities);
        all.addAll(policies);
        all.addAll(connectors);
        all.addAll(bindings);
        return all;
    }

    /** Primitives whose status is confirmed or corrected. */
    public int confirmedCount() {
        return (int) confirmables().stream().filter(Confirmable::countsAsConfirmed).count();
    }

    /** Primitives without a confirmation, or explicitly unconfirmed. */
    public int unconfirmedCount() {
        return countWithStatus(ConfirmationStatus.UNCONFIRMED);
    }

    /** Primitives deferred for later human attention. */
    public int flaggedCount() {
        return countWithStatus(ConfirmationStatus.FLAGGED);
    }

    public int totalConfirmable() {
        return confirmables().size();
    }

    /**
     * Recomputes {@code completion_percentage} as confirmed / total * 100, or 0.0 when there is
     * nothing to confirm. Never touches the primitives themselves.
     */
    public synchronized double computeCompletion() {
        int total = totalConfirmable();
        completionPercentage = total == 0 ? 0.0 : (confirmedCount() / (double) total) * 100.0;
        return completionPercentage;
    }

    private int countWithStatus(ConfirmationStatus status) {
        return (int) confirmables().stream().filter(p -> p.confirmationStatus() == status).count();
    }

    // ── Arena operations ─────────────────────────────────────────────────────────

    /** Every primitive held by this Declaration, including Views. */
    public synchronized List<Primitive> primitives() {
        List<Primitive> all = new ArrayList<>(confirmables());
        all.addAll(views);
        return all;
    }

    public Optional<Primitive> findPrimitive(String primitiveId) {
        if (primitiveId == null) {
            return Optional.empty();
        }
        return primitives().stream().filter(p -> primitiveId.equals(p.id())).findFirst();
    }

    /**
     * Replaces the slot holding a primitive with the same id and type.
     *
     * @throws IllegalArgumentException if no such slot exists
     */
    public synchronized void replace(Primitive updated) {
        Objects.requireNonNull(updated, "updated");
        switch (updated.primitiveType()) {
            case SCOPE -> {
                if (scope == null || !scope.id().equals(updated.id())) {
                    throw noSlot(updated);
                }
                scope = (Scope) updated;
            }
            case ARCHETYPE -> replaceIn(archetypes, (Archetype) updated);
            case DOMAIN -> replaceIn(domains, (Domain) updated);
            case CAPABILITY -> replaceIn(capabilities, (Capability) updated);
            case VIEW -> replaceIn(views, (View) updated);
            case POLICY -> replaceIn(policies, (Policy) updated);
            case CONNECTOR -> replaceIn(connectors, (Connector) updated);
            case BINDING -> replaceIn(bindings, (Binding) updated);
            default -> throw new IllegalArgumentException(
                    "Primitive type '" + updated.primitiveType().value() + "' cannot be replaced");
        }
    }

    public synchronized void appendProvenance(ProvenanceEntry entry) {
        provenance.add(Objects.requireNonNull(entry, "entry"));
    }

    public synchronized void markConfirmedAt(Instant when) {
        this.lastConfirmedAt = when;
    }

    private static <T extends Primitive> void replaceIn(List<T> slots, T updated) {
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).id().equals(updated.id())) {
                slots.set(i, updated);
                return;
            }
        }
        throw noSlot(updated);
    }

    private static IllegalArgumentException noSlot(Primitive primitive) {
        return new IllegalArgumentException("No " + primitive.primitiveType().value()
                + " with id '" + primitive.id() + "' in this declaration");
    }

    private static <T> List<T> mutableCopy(List<T> source) {
        return source != null ? new ArrayList<>(source) : new ArrayList<>();
    }

    // ── Object ───────────────────────────────────────────────────────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Declaration other)) return false;
        return Double.compare(completionPercentage, other.completionPercentage) == 0
                && Objects.equals(id, other.id)
                && Objects.equals(version, other.version)
                && Objects.equals(scope, other.scope)
                && archetypes.equals(other.archetypes)
                && domains.equals(other.domains)
                && capabilities.equals(other.capabilities)
                && views.equals(other.views)
                && policies.equals(other.policies)
                && connectors.equals(other.connectors)
                && bindings.equals(other.bindings)
                && provenance.equals(other.provenance)
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(lastConfirmedAt, other.lastConfirmedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version, scope, archetypes, domains, capabilities, views, policies,
                connectors, bindings, provenance, createdAt, lastConfirmedAt, completionPercentage);
    }

    @Override
    public String toString() {
        return "Declaration{id='" + id + "', scope='" + (scope != null ? scope.id() : null)
                + "', primitives=" + primitives().size()
                + ", completion=" + completionPercentage + "%}";
    }

    /**
     * Fluent assembly of a new Declaration, used by ingestion, storage and tests.
     */
    public static final class Builder {
        private final String id;
        private final Scope scope;
        private String version = "0.1.0";
        private final List<Archetype> archetypes = new ArrayList<>();
        private final List<Domain> domains = new ArrayList<>();
        private final List<Capability> capabilities = new ArrayList<>();
        private final List<View> views = new ArrayList<>();
        private final List<Policy> policies = new ArrayList<>();
        private final List<Connector> connectors = new ArrayList<>();
        private final List<Binding> bindings = new ArrayList<>();
        private final List<ProvenanceEntry> provenance = new ArrayList<>();
        private Instant createdAt = Instant.now();

        private Builder(String id, Scope scope) {
            this.id = id;
            this.scope = scope;
        }

        public Builder version(String version) { this.version = version; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder archetypes(List<Archetype> items) { archetypes.addAll(items); return this; }
        public Builder domains(List<Domain> items) { domains.addAll(items); return this; }
        public Builder capabilities(List<Capability> items) { capabilities.addAll(items); return this; }
        public Builder views(List<View> items) { views.addAll(items); return this; }
        public Builder policies(List<Policy> items) { policies.addAll(items); return this; }
        public Builder connectors(List<Connector> items) { connectors.addAll(items); return this; }
        public Builder bindings(List<Binding> items) { bindings.addAll(items); return this; }
        public Builder provenance(List<ProvenanceEntry> items) { provenance.addAll(items); return this; }

        public Builder add(Primitive primitive) {
            switch (primitive.primitiveType()) {
                case ARCHETYPE -> archetypes.add((Archetype) primitive);
                case DOMAIN -> domains.add((Domain) primitive);
                case CAPABILITY -> capabilities.add((Capability) primitive);
                case VIEW -> views.add((View) primitive);
                case POLICY -> policies.add((Policy) primitive);
                case CONNECTOR -> connectors.add((Connector) primitive);
                case BINDING -> bindings.add((Binding) primitive);
                default -> throw new IllegalArgumentException(
                        "Cannot add a " + primitive.primitiveType().value() + " to a declaration");
            }
            return this;
        }

        /** Builds the Declaration with its completion already computed. */
        public Declaration build() {
            Declaration declaration = new Declaration(id, version, scope, archetypes, domains,
                    capabilities, views, policies, connectors, bindings, provenance, createdAt, null, 0.0);
            declaration.computeCompletion();
            return declaration;
        }
    }
}
