package no.cantara.tml.graph;

import no.cantara.tml.model.Capability;
import no.cantara.tml.model.Declaration;
import no.cantara.tml.model.Domain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores every Capability for automation readiness.
 *
 * <table>
 *   <caption>Score contributions</caption>
 *   <tr><td>weighted decision factors</td><td>0.20</td></tr>
 *   <tr><td>heuristics</td><td>0.20</td></tr>
 *   <tr><td>exception rules</td><td>0.15</td></tr>
 *   <tr><td>automatable skills</td><td>0.20</td></tr>
 *   <tr><td>anti-patterns</td><td>0.10</td></tr>
 *   <tr><td>confirmed or corrected</td><td>0.15</td></tr>
 * </table>
 *
 * Points are summed as integer hundredths so that tier boundaries compare exactly.
 */
public class AutomationScorer {

    private static final Logger log = LoggerFactory.getLogger(AutomationScorer.class);

    public List<AutomationCandidate> score(List<Declaration> declarations) {
        List<AutomationCandidate> candidates = new ArrayList<>();
        for (Declaration declaration : declarations) {
            Map<String, String> accountableByDomain = new HashMap<>();
            for (Domain domain : declaration.getDomains()) {
                if (domain.accountableArchetypeId() != null) {
                    accountableByDomain.put(domain.id(), domain.accountableArchetypeId());
                }
            }
            for (Capability capability : declaration.getCapabilities()) {
                candidates.add(score(capability, accountableByDomain.getOrDefault(capability.domainId(), "")));
            }
        }
        return candidates;
    }

    AutomationCandidate score(Capability capability, String archetypeId) {
        int points = 0;
        List<String> missing = new ArrayList<>();
        List<String> rationale = new ArrayList<>();

        long weighted = capability.decisionFactors().stream().filter(f -> f.weight() != null).count();
        if (weighted > 0) {
            points += 20;
            rationale.add(weighted + " weighted decision factors");
        } else {
            missing.add("Decision factors with weights");
        }

        if (!capability.heuristics().isEmpty()) {
            points += 20;
            rationale.add(capability.heuristics().size() + " heuristics");
        } else {
            missing.add("Heuristics (rules of thumb)");
        }

        if (!capability.exceptions().isEmpty()) {
            points += 15;
            rationale.add(capability.exceptions().size() + " exception rules documented");
        } else {
            missing.add("Exception rules");
        }

        long automatable = capability.skills().stream()
                .filter(s -> s.skillType() != null && s.skillType().isAutomatable())
                .count();
        if (automatable > 0) {
            points += 20;
            rationale.add(automatable + " automatable skills");
        } else {
            missing.add("Automatable skills (agent_skill, tool, or workflow)");
        }

        if (!capability.antiPatterns().isEmpty()) {
            points += 10;
            rationale.add(capability.antiPatterns().size() + " anti-patterns documented");
        } else {
            missing.add("Anti-patterns");
        }

        if (capability.countsAsConfirmed()) {
            points += 15;
            rationale.add("Confirmed by human");
        } else {
            missing.add("Human confirmation");
        }

        AutomationTier tier = tierFor(points);
        log.debug("Scored {}: {} points, {}", capability.id(), points, tier.value());
        return new AutomationCandidate(capability.id(), archetypeId, points / 100.0, missing,
                tier, String.join("; ", rationale));
    }

    /** Tier for a readiness score in [0, 1]. */
    public static AutomationTier tierFor(double score) {
        return AutomationTier.forScore(score);
    }

    static AutomationTier tierFor(int points) {
        if (points > 70) {
            return AutomationTier.AGENT_SKILL;
        }
        if (points > 40) {
            return AutomationTier.WORKFLOW;
        }
        return AutomationTier.COPILOT;
    }
}
