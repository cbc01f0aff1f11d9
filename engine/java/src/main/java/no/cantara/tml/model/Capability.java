package no.cantara.tml.model;

import java.util.List;

/**
 * The atomic unit of decision logic. Belongs to exactly one Domain.
 */
public record Capability(
        String id,
        String scopeId,
        String domainId,
        String name,
        String description,
        String outcome,
        List<DecisionFactor> decisionFactors,
        List<String> heuristics,
        List<String> antiPatterns,
        List<ExceptionRule> exceptions,
        List<SkillReference> skills,
        ConfirmationRecord confirmation,
        ExtractionSource source
) implements Confirmable {
    public Capability {
        decisionFactors = decisionFactors != null ? List.copyOf(decisionFactors) : List.of();
        heuristics = heuristics != null ? List.copyOf(heuristics) : List.of();
        antiPatterns = antiPatterns != null ? List.copyOf(antiPatterns) : List.of();
        exceptions = exceptions != null ? List.copyOf(exceptions) : List.of();
        skills = skills != null ? List.copyOf(skills) : List.of();
    }

    @Override
    public PrimitiveType primitiveType() {
        return PrimitiveType.CAPABILITY;
    }

    @Override
    public String owningScopeId() {
        return scopeId;
    }

    @Override
    public Capability withConfirmation(ConfirmationRecord confirmation) {
        return new Capability(id, scopeId, domainId, name, description, outcome, decisionFactors,
                heuristics, antiPatterns, exceptions, skills, confirmation, source);
    }

    @Override
    public String assertionText() {
        return description != null && !description.isBlank() ? description : name;
    }
}
