package no.cantara.tml.model;

/**
 * Outcome-based accountability area, owned by exactly one accountable Archetype.
 * Every Domain is expected to own at least one Capability.
 */
public record Domain(
        String id,
        String scopeId,
        String name,
        String description,
        String outcomeDefinition,
        String accountableArchetypeId,
        ConfirmationRecord confirmation,
        ExtractionSource source
) implements Confirmable {

    @Override
    public PrimitiveType primitiveType() {
        return PrimitiveType.DOMAIN;
    }

    @Override
    public String owningScopeId() {
        return scopeId;
    }

    @Override
    public Domain withConfirmation(ConfirmationRecord confirmation) {
        return new Domain(id, scopeId, name, description, outcomeDefinition, accountableArchetypeId,
                confirmation, source);
    }

    @Override
    public String assertionText() {
        return outcomeDefinition != null && !outcomeDefinition.isBlank()
                ? name + ": " + outcomeDefinition
                : name;
    }
}
