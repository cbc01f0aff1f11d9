package no.cantara.tml.graph;

import no.cantara.tml.model.Binding;
import no.cantara.tml.model.Connector;
import no.cantara.tml.model.Declaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Traces decision flows: every Binding whose target matches a Connector's source, in the
 * same or in another Declaration.
 *
 * <p>Pairs are visited Declaration by Declaration, Binding by Binding, then over all
 * Connectors in Declaration order, which fixes the order of the result. A pair is skipped when
 * either Declaration has no Archetype.
 */
public class DecisionFlowTracer {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowTracer.class);

    private final TargetMatcher matcher;

    public DecisionFlowTracer(GraphPolicy policy) {
        this.matcher = new TargetMatcher(policy.targetMatch());
    }

    public List<DecisionFlow> trace(List<Declaration> declarations) {
        List<DecisionFlow> flows = new ArrayList<>();
        for (Declaration from : declarations) {
            for (Binding binding : from.getBindings()) {
                for (Declaration to : declarations) {
                    for (Connector connector : to.getConnectors()) {
                        if (!matcher.matches(binding.writesTo(), connector.readsFrom())) {
                            continue;
                        }
                        Optional<String> fromArchetype = CapabilityLocator.archetypeOf(from);
                        Optional<String> toArchetype = CapabilityLocator.archetypeOf(to);
                        if (fromArchetype.isEmpty() || toArchetype.isEmpty()) {
                            log.debug("Skipping {} -> {}: no archetype to anchor the flow",
                                    binding.id(), connector.id());
                            continue;
                        }
                        log.debug("Flow {} -> {} via '{}'", binding.id(), connector.id(), binding.writesTo());
                        flows.add(new DecisionFlow(
                                fromArchetype.get(),
                                CapabilityLocator.capabilityNear(from, binding.name()).orElse(""),
                                toArchetype.get(),
                                CapabilityLocator.capabilityNear(to, connector.name()).orElse(""),
                                binding.id(),
                                connector.id(),
                                describe(binding, connector)));
                    }
                }
            }
        }
        return flows;
    }

    static String describe(Binding binding, Connector connector) {
        String details = binding.description() != null ? binding.description() : "";
        return binding.name() + " → " + connector.name() + ": " + details;
    }
}
