package no.cantara.tml.model;

import java.util.List;

/**
 * Governed read pathway: how expertise flows into a Scope.
 */
public record Connector(
        String id,
        String scopeId,
        String name,
        String readsFrom,
        TargetType readsFromType,
        List<String> governedByPolicyIds,
        String description,
        ConfirmationRecord confirmation,
        ExtractionSource source
) implements Confirmable {
    public Connector {
        governedByPolicyIds = governedByPolicyIds != null ? List.copyOf(governedByPolicyIds) : List.of();
    }

    @Override
    public PrimitiveType primitiveType() {
        return PrimitiveType.CONNECTOR;
    }

    @Override
    public String owningScopeId() {
        return scopeId;
    }

    @Override
    public Connector withConfirmation(ConfirmationRecord confirmation) {
        return new Connector(id, scopeId, name, readsFrom, readsFromType, governedByPolicyIds,
                description, confirmation, source);
    }

    @Override
    public String assertionText() {
        return name + " reads from " + readsFrom;
    }
}
