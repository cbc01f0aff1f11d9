package no.cantara.tml.model;

import java.util.List;

/**
 * Named projection over one or more Capabilities. Not confirmable.
 */
public record View(
        String id,
        String scopeId,
        String name,
        String description,
        List<String> capabilityIds,
        String targetArchetypeId,
        ProjectionFormat projectionFormat
) implements Primitive {
    public View {
        capabilityIds = capabilityIds != null ? List.copyOf(capabilityIds) : List.of();
    }

    @Override
    public PrimitiveType primitiveType() {
        return PrimitiveType.VIEW;
    }

    @Override
    public String owningScopeId() {
        return scopeId;
    }
}
