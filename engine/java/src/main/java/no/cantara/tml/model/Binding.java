package no.cantara.tml.model;

import java.util.List;

/**
 * Governed write pathway: how expertise flows out of a Scope.
 */
public record Binding(
        String id,
        String scopeId,
        String name,
        String writesTo,
        TargetType writesToType,
        List<String> governedByPolicyIds,
        String description,
        ConfirmationRecord confirmation,
        ExtractionSource source
) implements Confirmable {
    public Binding {
        governedByPolicyIds = governedByPolicyIds != null ? List.copyOf(governedByPolicyIds) : List.of();
    }

    @Override
    public PrimitiveType primitiveType() {
        return PrimitiveType.BINDING;
    }

    @Override
    public String owningScopeId() {
        return scopeId;
    }

    @Override
    public Binding withConfirmation(ConfirmationRecord confirmation) {
        return new Binding(id, scopeId, name, writesTo, writesToType, governedByPolicyIds,
                description, confirmation, source);
    }

    @Override
    public String assertionText() {
        return name + " writes to " + writesTo;
    }
}
