package no.cantara.tml.model;

/**
 * Bounded ownership context. The only primitive without a {@code scope_id}; may be nested
 * under another Scope via {@code parentScopeId}.
 */
public record Scope(
        String id,
        String name,
        String description,
        String parentScopeId,
        HumanIdentity ownerIdentity,
        ConfirmationRecord confirmation,
        ExtractionSource source
) implements Confirmable {

    @Override
    public PrimitiveType primitiveType() {
        return PrimitiveType.SCOPE;
    }

    @Override
    public String owningScopeId() {
        return id;
    }

    @Override
    public Scope withConfirmation(ConfirmationRecord confirmation) {
        return new Scope(id, name, description, parentScopeId, ownerIdentity, confirmation, source);
    }

    @Override
    public String assertionText() {
        return name;
    }
}
