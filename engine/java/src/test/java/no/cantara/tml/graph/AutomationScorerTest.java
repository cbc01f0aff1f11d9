package no.cantara.tml.graph;

import no.cantara.tml.SampleDeclarations;
import no.cantara.tml.model.Capability;
import no.cantara.tml.model.ConfirmationRecord;
import no.cantara.tml.model.ConfirmationStatus;
import no.cantara.tml.model.DecisionFactor;
import no.cantara.tml.model.ExceptionRule;
import no.cantara.tml.model.FactorWeight;
import no.cantara.tml.model.SkillReference;
import no.cantara.tml.model.SkillType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static no.cantara.tml.SampleDeclarations.ALICE;
import static no.cantara.tml.SampleDeclarations.NOW;
import static org.junit.jupiter.api.Assertions.*;

class AutomationScorerTest {

    private final AutomationScorer scorer = new AutomationScorer();

    private static Capability capability(List<DecisionFactor> factors, List<String> heuristics,
                                         List<ExceptionRule> exceptions, List<SkillReference> skills,
                                         List<String> antiPatterns, ConfirmationStatus status) {
        ConfirmationRecord confirmation = status == null ? null
                : new ConfirmationRecord(status, ALICE, NOW, "x", status == ConfirmationStatus.CORRECTED ? "y" : null, null);
        return new Capability("cap-x", "scope-x", "dom-x", "X", null, null, factors, heuristics,
                antiPatterns, exceptions, skills, confirmation, null);
    }

    @Test
    void heuristicsAndAntiPatternsOnlyIsCopilot() {
        Capability cap = capability(List.of(), List.of("h1", "h2"), List.of(), List.of(),
                List.of("a1"), null);
        AutomationCandidate c = scorer.score(cap, "arch-x");

        assertEquals(0.30, c.automationReadiness());
        assertEquals(AutomationTier.COPILOT, c.recommendedSkillType());
        assertEquals(List.of("Decision factors with weights", "Exception rules",
                "Automatable skills (agent_skill, tool, or workflow)", "Human confirmation"), c.missingElements());
        assertEquals("2 heuristics; 1 anti-patterns documented", c.rationale());
    }

    @Test
    void exactlySeventyIsWorkflow() {
        Capability cap = capability(
                List.of(new DecisionFactor("f", null, FactorWeight.PRIMARY)),
                List.of("h"),
                List.of(new ExceptionRule("t", "o", "r")),
                List.of(), List.of(), ConfirmationStatus.CONFIRMED);
        AutomationCandidate c = scorer.score(cap, "");

        assertEquals(0.70, c.automationReadiness());
        assertEquals(AutomationTier.WORKFLOW, c.recommendedSkillType());
    }

    @Test
    void fullyDocumentedCorrectedCapabilityIsAgentSkill() {
        Capability cap = SampleDeclarations.budgetApproval().withConfirmation(
                new ConfirmationRecord(ConfirmationStatus.CORRECTED, ALICE, NOW, "x", "y", null));
        AutomationCandidate c = scorer.score(cap, "arch-cfo");

        assertEquals(1.0, c.automationReadiness());
        assertEquals(AutomationTier.AGENT_SKILL, c.recommendedSkillType());
        assertTrue(c.missingElements().isEmpty());
        assertEquals("1 weighted decision factors; 1 heuristics; 1 exception rules documented; "
                + "1 automatable skills; 1 anti-patterns documented; Confirmed by human", c.rationale());
    }

    @Test
    void unweightedFactorsManualSkillsAndFlagsDoNotCount() {
        Capability cap = capability(
                List.of(new DecisionFactor("f", null, null)),
                List.of(), List.of(),
                List.of(new SkillReference("s", "s", null, SkillType.MANUAL, null, null),
                        new SkillReference("p", "p", null, SkillType.PROCESS, null, null)),
                List.of(), ConfirmationStatus.FLAGGED);
        AutomationCandidate c = scorer.score(cap, "");
        assertEquals(0.0, c.automationReadiness());
        assertEquals(6, c.missingElements().size());
        assertEquals("", c.rationale());
    }

    @Test
    void tierBoundaries() {
        assertEquals(AutomationTier.COPILOT, AutomationScorer.tierFor(0.40));
        assertEquals(AutomationTier.WORKFLOW, AutomationScorer.tierFor(0.41));
        assertEquals(AutomationTier.WORKFLOW, AutomationScorer.tierFor(0.70));
        assertEquals(AutomationTier.AGENT_SKILL, AutomationScorer.tierFor(0.71));
    }

    @Test
    void archetypeIsResolvedThroughDomain() {
        List<AutomationCandidate> candidates = scorer.score(List.of(SampleDeclarations.finance(),
                SampleDeclarations.engineering()));
        assertEquals(2, candidates.size());
        assertEquals("arch-cfo", candidates.get(0).archetypeId());
        assertEquals(0.85, candidates.get(0).automationReadiness());
        assertEquals("arch-cto", candidates.get(1).archetypeId());
        assertEquals(0.20, candidates.get(1).automationReadiness());
        assertEquals(AutomationTier.COPILOT, candidates.get(1).recommendedSkillType());
    }

    @Test
    void tierReadsWireValuesAndNamesTheChoicesOnError() {
        assertEquals(AutomationTier.AGENT_SKILL, AutomationTier.fromValue("agent-skill"));
        assertEquals(AutomationTier.WORKFLOW, AutomationTier.fromValue(" Workflow "));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> AutomationTier.fromValue("robot"));
        assertEquals("Unknown AutomationTier 'robot'; expected one of [agent_skill, workflow, copilot]",
                e.getMessage());
    }
}
