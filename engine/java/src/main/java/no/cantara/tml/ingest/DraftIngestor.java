package no.cantara.tml.ingest;

import no.cantara.tml.model.Archetype;
import no.cantara.tml.model.Binding;
import no.cantara.tml.model.Capability;
import no.cantara.tml.model.Confirmable;
import no.cantara.tml.model.Connector;
import no.cantara.tml.model.DecisionFactor;
import no.cantara.tml.model.Declaration;
import no.cantara.tml.model.Domain;
import no.cantara.tml.model.EnforcementLevel;
import no.cantara.tml.model.ExceptionRule;
import no.cantara.tml.model.ExtractionSource;
import no.cantara.tml.model.FactorWeight;
import no.cantara.tml.model.HumanIdentity;
import no.cantara.tml.model.IdGenerator;
import no.cantara.tml.model.Policy;
import no.cantara.tml.model.ProvenanceAction;
import no.cantara.tml.model.ProvenanceEntry;
import no.cantara.tml.model.Scope;
import no.cantara.tml.model.SkillReference;
import no.cantara.tml.model.SkillType;
import no.cantara.tml.model.TargetType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns the structuring step's draft into an unconfirmed Declaration.
 *
 * <p>The draft is a map of lists keyed by primitive type ({@code archetypes}, {@code domains},
 * {@code capabilities}, {@code policies}, {@code connectors}, {@code bindings}). Items refer
 * to each other by name only; this class assigns durable ids and resolves those references.
 * Every primitive starts without a confirmation and gets one {@code structured} provenance entry.
 */
public class DraftIngestor {

    private static final Logger log = LoggerFactory.getLogger(DraftIngestor.class);

    /** Archetypes are anchored to a real person only once someone confirms the role. */
    public static final HumanIdentity UNRESOLVED_IDENTITY =
            new HumanIdentity("unresolved@placeholder", "Unresolved Identity");

    private final IdGenerator ids;
    private final Clock clock;

    public DraftIngestor() {
        this(IdGenerator.random(), Clock.systemUTC());
    }

    public DraftIngestor(IdGenerator ids, Clock clock) {
        this.ids = ids;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if an item carries an unknown enum value or a list
     *                                  entry is not an object
     */
    public Ingestion ingest(Map<String, Object> draft, IngestContext context) {
        ExtractionSource source = context.source();
        Map<String, Confidence> confidence = new LinkedHashMap<>();

        Scope scope = new Scope(ids.next("scope"), context.scopeName(), "", context.parentScopeId(),
                context.owner(), null, source);
        String scopeId = scope.id();
        Declaration.Builder builder = Declaration.builder(ids.next("decl"), scope).createdAt(clock.instant());

        List<Archetype> archetypes = new ArrayList<>();
        for (Map<String, Object> raw : items(draft, "archetypes")) {
            Archetype archetype = new Archetype(ids.next("arch"), scopeId, UNRESOLVED_IDENTITY,
                    text(raw, "role_name"), text(raw, "role_description"),
                    strings(raw, "primary_responsibilities"), strings(raw, "decision_authority"),
                    strings(raw, "accountability_boundaries"), null, source);
            archetypes.add(archetype);
            confidence.put(archetype.id(), confidenceOf(raw));
        }
        String accountable = archetypes.isEmpty() ? "" : archetypes.get(0).id();

        List<Domain> domains = new ArrayList<>();
        for (Map<String, Object> raw : items(draft, "domains")) {
            Domain domain = new Domain(ids.next("dom"), scopeId, text(raw, "name"),
                    text(raw, "description"), text(raw, "outcome_definition"), accountable, null, source);
            domains.add(domain);
            confidence.put(domain.id(), confidenceOf(raw));
        }

        List<Capability> capabilities = new ArrayList<>();
        for (Map<String, Object> raw : items(draft, "capabilities")) {
            String domainName = text(raw, "domain_name");
            String domainId = domainIdFor(domains, domainName).orElse("");
            if (!domains.isEmpty() && domains.stream().noneMatch(d -> d.name().equals(domainName))) {
                log.warn("Capability '{}' names unknown domain '{}'; assigned to {}",
                        text(raw, "name"), domainName, domainId);
            }
            Capability capability = new Capability(ids.next("cap"), scopeId, domainId,
                    text(raw, "name"), text(raw, "description"), text(raw, "outcome"),
                    decisionFactors(raw), strings(raw, "heuristics"), strings(raw, "anti_patterns"),
                    exceptions(raw), skills(raw), null, source);
            capabilities.add(capability);
            confidence.put(capability.id(), confidenceOf(raw));
        }

        List<Policy> policies = new ArrayList<>();
        for (Map<String, Object> raw : items(draft, "policies")) {
            Policy policy = new Policy(ids.next("pol"), scopeId, text(raw, "name"), text(raw, "description"),
                    text(raw, "rule"), List.of(),
                    EnforcementLevel.fromValue(text(raw, "enforcement_level", "soft")), null, source);
            policies.add(policy);
            confidence.put(policy.id(), confidenceOf(raw));
        }

        List<Connector> connectors = new ArrayList<>();
        for (Map<String, Object> raw : items(draft, "connectors")) {
            Connector connector = new Connector(ids.next("conn"), scopeId, text(raw, "name"),
                    text(raw, "reads_from"), TargetType.fromValue(text(raw, "reads_from_type", "external_system")),
                    List.of(), text(raw, "description"), null, source);
            connectors.add(connector);
            confidence.put(connector.id(), confidenceOf(raw));
        }

        List<Binding> bindings = new ArrayList<>();
        for (Map<String, Object> raw : items(draft, "bindings")) {
            Binding binding = new Binding(ids.next("bind"), scopeId, text(raw, "name"),
                    text(raw, "writes_to"), TargetType.fromValue(text(raw, "writes_to_type", "external_system")),
                    List.of(), text(raw, "description"), null, source);
            bindings.add(binding);
            confidence.put(binding.id(), confidenceOf(raw));
        }

        builder.archetypes(archetypes).domains(domains).capabilities(capabilities)
                .policies(policies).connectors(connectors).bindings(bindings);
        Declaration declaration = builder.build();
        Instant now = clock.instant();
        for (Confirmable primitive : declaration.confirmables()) {
            declaration.appendProvenance(structured(primitive, context, now));
        }

        Ingestion ingestion = new Ingestion(declaration, confidence);
        log.info("Ingested scope '{}' from {} {}: {} primitives, {} low confidence",
                context.scopeName(), source.sourceType(), source.sourceIdentifier(),
                declaration.totalConfirmable(), ingestion.lowConfidenceIds().size());
        return ingestion;
    }

    /** Exact name match, else the first Domain. */
    static Optional<String> domainIdFor(List<Domain> domains, String domainName) {
        return domains.stream()
                .filter(d -> d.name().equals(domainName))
                .findFirst()
                .or(() -> domains.stream().findFirst())
                .map(Domain::id);
    }

    private ProvenanceEntry structured(Confirmable primitive, IngestContext context, Instant now) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field", "data");
        details.put("assertion_text", primitive.assertionText());
        details.put("source_type", context.source().sourceType());
        return new ProvenanceEntry(ids.next("prov"), primitive.owningScopeId(), primitive.id(),
                primitive.primitiveType(), ProvenanceAction.STRUCTURED, context.owner(), now, details, null);
    }

    private List<DecisionFactor> decisionFactors(Map<String, Object> raw) {
        List<DecisionFactor> factors = new ArrayList<>();
        for (Map<String, Object> item : items(raw, "decision_factors")) {
            String weight = text(item, "weight", null);
            factors.add(new DecisionFactor(text(item, "name"), text(item, "description"),
                    weight == null || weight.isBlank() ? null : FactorWeight.fromValue(weight)));
        }
        return factors;
    }

    private List<ExceptionRule> exceptions(Map<String, Object> raw) {
        List<ExceptionRule> rules = new ArrayList<>();
        for (Map<String, Object> item : items(raw, "exceptions")) {
            rules.add(new ExceptionRule(text(item, "trigger"), text(item, "override_description"),
                    text(item, "reason")));
        }
        return rules;
    }

    private List<SkillReference> skills(Map<String, Object> raw) {
        List<SkillReference> skills = new ArrayList<>();
        for (Map<String, Object> item : items(raw, "skills")) {
            skills.add(new SkillReference(ids.next("skill"), text(item, "name"), text(item, "description"),
                    SkillType.fromValue(text(item, "skill_type", "process")),
                    text(item, "execution_surface", null), text(item, "skill_uri", null)));
        }
        return skills;
    }

    private static Confidence confidenceOf(Map<String, Object> raw) {
        return Confidence.fromValue(text(raw, "confidence", null));
    }

    // ── Raw map access ───────────────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> items(Map<String, Object> raw, String key) {
        Object value = raw.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("'" + key + "' must be a list");
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map)) {
                throw new IllegalArgumentException("Entries of '" + key + "' must be objects, got: " + item);
            }
            result.add((Map<String, Object>) item);
        }
        return result;
    }

    private static List<String> strings(Map<String, Object> raw, String key) {
        Object value = raw.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream().filter(Objects::nonNull).map(Object::toString).toList();
    }

    private static String text(Map<String, Object> raw, String key) {
        return text(raw, key, "");
    }

    private static String text(Map<String, Object> raw, String key, String fallback) {
        Object value = raw.get(key);
        return value != null ? value.toString() : fallback;
    }
}
