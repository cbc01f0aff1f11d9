package no.cantara.tml.graph;

/**
 * A traced path from one role's output (a Binding) to another role's input (a Connector).
 * Capability ids are best guesses and may be empty.
 */
public record DecisionFlow(
        String fromArchetypeId,
        String fromCapabilityId,
        String toArchetypeId,
        String toCapabilityId,
        String viaBindingId,
        String viaConnectorId,
        String description
) {}
