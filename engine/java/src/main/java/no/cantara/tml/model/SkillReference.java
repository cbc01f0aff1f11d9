package no.cantara.tml.model;

/**
 * An executable skill that operationalises a Capability.
 */
public record SkillReference(
        String id,
        String name,
        String description,
        SkillType skillType,
        String executionSurface,
        String skillUri
) {}
