package no.cantara.tml.model;

import java.util.List;

/**
 * Rule constraining the primitives listed in {@code attachesTo}.
 */
public record Policy(
        String id,
        String scopeId,
        String name,
        String description,
        String rule,
        List<String> attachesTo,
        EnforcementLevel enforcementLevel,
        ConfirmationRecord confirmation,
        ExtractionSource source
) implements Confirmable {
    public Policy {
        attachesTo = attachesTo != null ? List.copyOf(attachesTo) : List.of();
    }

    @Override
    public PrimitiveType primitiveType() {
        return PrimitiveType.POLICY;
    }

    @Override
    public String owningScopeId() {
        return scopeId;
    }

    @Override
    public Policy withConfirmation(ConfirmationRecord confirmation) {
        return new Policy(id, scopeId, name, description, rule, attachesTo, enforcementLevel,
                confirmation, source);
    }

    @Override
    public String assertionText() {
        return rule != null && !rule.isBlank() ? rule : name;
    }
}
