package no.cantara.tml.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Collapses decision flows into Capability-to-Capability dependencies.
 *
 * <p>Flows with an unresolved Capability on either side are ignored. The first flow seen for an
 * (upstream, downstream) pair determines the dependency type and description.
 */
public class DependencyDeriver {

    private final GraphPolicy policy;

    public DependencyDeriver(GraphPolicy policy) {
        this.policy = policy;
    }

    public List<Dependency> derive(List<DecisionFlow> flows) {
        List<Dependency> dependencies = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (DecisionFlow flow : flows) {
            if (flow.fromCapabilityId().isEmpty() || flow.toCapabilityId().isEmpty()) {
                continue;
            }
            if (!seen.add(flow.fromCapabilityId() + "\u0000" + flow.toCapabilityId())) {
                continue;
            }
            dependencies.add(new Dependency(flow.fromCapabilityId(), flow.toCapabilityId(),
                    classify(flow.description()), flow.description()));
        }
        return dependencies;
    }

    /** Blocking keywords win over gating ones; anything else only informs. */
    public DependencyType classify(String description) {
        String text = description == null ? "" : description.toLowerCase(Locale.ROOT);
        if (policy.blockingKeywords().stream().anyMatch(text::contains)) {
            return DependencyType.BLOCKING;
        }
        if (policy.gatingKeywords().stream().anyMatch(text::contains)) {
            return DependencyType.GATING;
        }
        return DependencyType.INFORMING;
    }
}
