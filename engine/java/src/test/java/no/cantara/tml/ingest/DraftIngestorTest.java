package no.cantara.tml.ingest;

import com.fasterxml.jackson.core.type.TypeReference;
import no.cantara.tml.DeclarationValidator;
import no.cantara.tml.SampleDeclarations;
import no.cantara.tml.io.TmlJson;
import no.cantara.tml.model.Capability;
import no.cantara.tml.model.ConfirmationStatus;
import no.cantara.tml.model.Declaration;
import no.cantara.tml.model.EnforcementLevel;
import no.cantara.tml.model.FactorWeight;
import no.cantara.tml.model.ProvenanceAction;
import no.cantara.tml.model.SkillType;
import no.cantara.tml.model.TargetType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import static no.cantara.tml.SampleDeclarations.ALICE;
import static no.cantara.tml.SampleDeclarations.CLOCK;
import static no.cantara.tml.SampleDeclarations.INTERVIEW;
import static org.junit.jupiter.api.Assertions.*;

class DraftIngestorTest {

    private Map<String, Object> draft;

    @BeforeEach
    void loadDraft() throws IOException {
        try (InputStream is = getClass().getResourceAsStream("/fixtures/structured-draft.json")) {
            draft = TmlJson.mapper().readValue(is, new TypeReference<Map<String, Object>>() {});
        }
    }

    private Ingestion ingest() {
        return new DraftIngestor(SampleDeclarations.sequentialIds(), CLOCK)
                .ingest(draft, new IngestContext("Support", ALICE, INTERVIEW));
    }

    @Test
    void assignsPrefixedIdsAndScope() {
        Declaration d = ingest().declaration();
        assertEquals("scope-00000001", d.getScope().id());
        assertEquals("Support", d.getScope().name());
        assertEquals(ALICE, d.getScope().ownerIdentity());
        assertTrue(d.getArchetypes().get(0).id().startsWith("arch-"));
        assertTrue(d.getDomains().get(0).id().startsWith("dom-"));
        assertTrue(d.getCapabilities().get(0).id().startsWith("cap-"));
        assertTrue(d.getCapabilities().get(0).skills().get(0).id().startsWith("skill-"));
        assertTrue(d.getPolicies().get(0).id().startsWith("pol-"));
        assertTrue(d.getConnectors().get(0).id().startsWith("conn-"));
        assertTrue(d.getBindings().get(0).id().startsWith("bind-"));
        assertTrue(d.getCapabilities().stream().allMatch(c -> c.scopeId().equals(d.getScope().id())));
    }

    @Test
    void resolvesReferencesByName() {
        Declaration d = ingest().declaration();
        String archetypeId = d.getArchetypes().get(0).id();
        assertTrue(d.getDomains().stream().allMatch(dom -> dom.accountableArchetypeId().equals(archetypeId)));

        Capability triage = d.getCapabilities().get(0);
        Capability pruning = d.getCapabilities().get(1);
        assertEquals(d.getDomains().get(0).id(), triage.domainId());
        // "Docs" names no domain; falls back to the first one
        assertEquals(d.getDomains().get(0).id(), pruning.domainId());
    }

    @Test
    void appliesDefaults() {
        Declaration d = ingest().declaration();
        Capability triage = d.getCapabilities().get(0);
        assertEquals(FactorWeight.PRIMARY, triage.decisionFactors().get(0).weight());
        assertNull(triage.decisionFactors().get(1).weight());
        assertEquals(SkillType.AGENT_SKILL, triage.skills().get(0).skillType());
        assertEquals(SkillType.PROCESS, triage.skills().get(1).skillType());
        assertEquals(EnforcementLevel.SOFT, d.getPolicies().get(0).enforcementLevel());
        assertEquals(TargetType.EXTERNAL_SYSTEM, d.getConnectors().get(0).readsFromType());
        assertEquals(DraftIngestor.UNRESOLVED_IDENTITY, d.getArchetypes().get(0).identity());
    }

    @Test
    void everythingStartsUnconfirmedWithStructuredProvenance() {
        Declaration d = ingest().declaration();
        assertEquals(0.0, d.getCompletionPercentage());
        assertEquals(d.totalConfirmable(), d.unconfirmedCount());
        assertEquals(d.totalConfirmable(), d.getProvenance().size());
        assertTrue(d.getProvenance().stream().allMatch(e -> e.action() == ProvenanceAction.STRUCTURED));
        assertEquals(d.getScope().id(), d.getProvenance().get(0).primitiveId());
        assertTrue(d.confirmables().stream().allMatch(c -> c.confirmationStatus() == ConfirmationStatus.UNCONFIRMED));
    }

    @Test
    void tracksConfidence() {
        Ingestion ingestion = ingest();
        Declaration d = ingestion.declaration();
        assertEquals(Confidence.HIGH, ingestion.confidenceById().get(d.getArchetypes().get(0).id()));
        assertEquals(Confidence.MEDIUM, ingestion.confidenceById().get(d.getConnectors().get(0).id()));
        assertEquals(List.of(d.getCapabilities().get(1).id(), d.getBindings().get(0).id()),
                ingestion.lowConfidenceIds());
    }

    @Test
    void ingestedDeclarationIsStructurallyValid() {
        DeclarationValidator.ValidationResult result = DeclarationValidator.validate(ingest().declaration());
        assertTrue(result.isValid(), () -> result.errors().toString());
    }

    @Test
    void emptyDraftYieldsScopeOnly() {
        Ingestion ingestion = new DraftIngestor(SampleDeclarations.sequentialIds(), CLOCK)
                .ingest(Map.of(), new IngestContext("Empty", ALICE, INTERVIEW));
        assertEquals(1, ingestion.declaration().totalConfirmable());
        assertTrue(ingestion.confidenceById().isEmpty());
    }

    @Test
    void capabilitiesWithoutDomainsGetEmptyDomainId() {
        Map<String, Object> onlyCapability = Map.of("capabilities", List.of(Map.of("name", "Lonely")));
        Declaration d = new DraftIngestor(SampleDeclarations.sequentialIds(), CLOCK)
                .ingest(onlyCapability, new IngestContext("X", ALICE, INTERVIEW)).declaration();
        assertEquals("", d.getCapabilities().get(0).domainId());
    }

    @Test
    void malformedEntriesAreRejected() {
        DraftIngestor ingestor = new DraftIngestor(SampleDeclarations.sequentialIds(), CLOCK);
        IngestContext context = new IngestContext("X", ALICE, INTERVIEW);
        assertThrows(IllegalArgumentException.class,
                () -> ingestor.ingest(Map.of("domains", List.of("not an object")), context));
        assertThrows(IllegalArgumentException.class,
                () -> ingestor.ingest(Map.of("policies", List.of(Map.of("enforcement_level", "medium"))), context));
    }
}
