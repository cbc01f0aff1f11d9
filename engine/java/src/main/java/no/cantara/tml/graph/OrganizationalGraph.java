package no.cantara.tml.graph;

import no.cantara.tml.model.Declaration;
import no.cantara.tml.model.Scope;

import java.util.List;

/**
 * Composed view across Declarations. Derived, never stored: recompute it from the
 * Declarations it embeds.
 */
public record OrganizationalGraph(
        Scope rootScope,
        List<Declaration> declarations,
        List<DecisionFlow> decisionFlows,
        List<Dependency> dependencyMap,
        List<AutomationCandidate> automationCandidates
) {
    public OrganizationalGraph {
        declarations = List.copyOf(declarations);
        decisionFlows = List.copyOf(decisionFlows);
        dependencyMap = List.copyOf(dependencyMap);
        automationCandidates = List.copyOf(automationCandidates);
    }
}
