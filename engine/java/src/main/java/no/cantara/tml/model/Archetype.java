package no.cantara.tml.model;

import java.util.List;

/**
 * Role definition anchored to a real-world identity.
 */
public record Archetype(
        String id,
        String scopeId,
        HumanIdentity identity,
        String roleName,
        String roleDescription,
        List<String> primaryResponsibilities,
        List<String> decisionAuthority,
        List<String> accountabilityBoundaries,
        ConfirmationRecord confirmation,
        ExtractionSource source
) implements Confirmable {
    public Archetype {
        primaryResponsibilities = primaryResponsibilities != null ? List.copyOf(primaryResponsibilities) : List.of();
        decisionAuthority = decisionAuthority != null ? List.copyOf(decisionAuthority) : List.of();
        accountabilityBoundaries = accountabilityBoundaries != null ? List.copyOf(accountabilityBoundaries) : List.of();
    }

    @Override
    public PrimitiveType primitiveType() {
        return PrimitiveType.ARCHETYPE;
    }

    @Override
    public String owningScopeId() {
        return scopeId;
    }

    @Override
    public Archetype withConfirmation(ConfirmationRecord confirmation) {
        return new Archetype(id, scopeId, identity, roleName, roleDescription, primaryResponsibilities,
                decisionAuthority, accountabilityBoundaries, confirmation, source);
    }

    @Override
    public String assertionText() {
        return roleDescription != null && !roleDescription.isBlank() ? roleDescription : roleName;
    }
}
