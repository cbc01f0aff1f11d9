package no.cantara.tml.graph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyDeriverTest {

    private final DependencyDeriver deriver = new DependencyDeriver(GraphPolicy.defaults());

    private static DecisionFlow flow(String from, String to, String description) {
        return new DecisionFlow("arch-a", from, "arch-b", to, "bind-1", "conn-1", description);
    }

    @Test
    void classifiesByKeywordsBlockingFirst() {
        assertEquals(DependencyType.BLOCKING, deriver.classify("Sign-off requires legal review"));
        assertEquals(DependencyType.GATING, deriver.classify("Manager approval of the plan"));
        assertEquals(DependencyType.INFORMING, deriver.classify("Weekly status digest"));
    }

    @Test
    void keywordsMatchAsSubstrings() {
        // "reviewer" contains "review"
        assertEquals(DependencyType.GATING, deriver.classify("Sent to the REVIEWER"));
    }

    @Test
    void firstFlowPerPairWins() {
        List<Dependency> deps = deriver.derive(List.of(
                flow("cap-1", "cap-2", "Budget must be approved"),
                flow("cap-1", "cap-2", "FYI digest"),
                flow("cap-2", "cap-1", "FYI digest")));

        assertEquals(2, deps.size());
        assertEquals(DependencyType.BLOCKING, deps.get(0).dependencyType());
        assertEquals("Budget must be approved", deps.get(0).description());
        assertEquals("cap-2", deps.get(1).upstreamCapabilityId());
        assertEquals(DependencyType.INFORMING, deps.get(1).dependencyType());
    }

    @Test
    void flowsWithUnresolvedCapabilitiesAreIgnored() {
        assertTrue(deriver.derive(List.of(flow("", "cap-2", "x"), flow("cap-1", "", "x"))).isEmpty());
    }

    @Test
    void customKeywordsReplaceDefaults() {
        DependencyDeriver custom = new DependencyDeriver(
                new GraphPolicy(TargetMatchMode.SUBSTRING, List.of("Hard Stop"), List.of("sign-off")));
        assertEquals(DependencyType.BLOCKING, custom.classify("This is a hard stop"));
        assertEquals(DependencyType.GATING, custom.classify("needs sign-off"));
        assertEquals(DependencyType.INFORMING, custom.classify("must be done"));
    }

    @Test
    void dependencyTypeRejectsUnknownValuesWithTheChoices() {
        assertEquals(DependencyType.GATING, DependencyType.fromValue("GATING"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> DependencyType.fromValue("optional"));
        assertTrue(e.getMessage().contains("[blocking, gating, informing]"), e.getMessage());
    }
}
