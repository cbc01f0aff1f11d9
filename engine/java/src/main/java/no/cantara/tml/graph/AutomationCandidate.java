package no.cantara.tml.graph;

import java.util.List;

/**
 * A Capability scored for automation readiness.
 *
 * @param archetypeId          accountable Archetype via the Capability's Domain, or empty if unresolved
 * @param automationReadiness  score in [0, 1]
 * @param missingElements      what a follow-up interview should ask for
 * @param recommendedSkillType tier derived from the score
 */
public record AutomationCandidate(
        String capabilityId,
        String archetypeId,
        double automationReadiness,
        List<String> missingElements,
        AutomationTier recommendedSkillType,
        String rationale
) {
    public AutomationCandidate {
        missingElements = missingElements != null ? List.copyOf(missingElements) : List.of();
    }
}
