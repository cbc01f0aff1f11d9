package no.cantara.tml.graph;

/**
 * Upstream Capability whose output the downstream Capability consumes.
 */
public record Dependency(
        String upstreamCapabilityId,
        String downstreamCapabilityId,
        DependencyType dependencyType,
        String description
) {}
