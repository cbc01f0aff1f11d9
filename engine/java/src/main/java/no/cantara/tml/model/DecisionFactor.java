package no.cantara.tml.model;

/**
 * A factor weighed when a Capability's decision is made. {@code weight} may be {@code null}.
 */
public record DecisionFactor(
        String name,
        String description,
        FactorWeight weight
) {}
