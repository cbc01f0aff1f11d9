package no.cantara.tml.graph;

import no.cantara.tml.model.Archetype;
import no.cantara.tml.model.Capability;
import no.cantara.tml.model.Declaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Best-effort resolution of the Archetype and Capability on either end of a decision flow.
 *
 * <p>A Binding or Connector does not reference a Capability, so the Capability is guessed by
 * name: the first Capability whose name contains, or is contained in, the pathway's name.
 * Failing that the first Capability of the Declaration is used.
 */
final class CapabilityLocator {

    private static final Logger log = LoggerFactory.getLogger(CapabilityLocator.class);

    private CapabilityLocator() {}

    /** The first Archetype of the Declaration. */
    static Optional<String> archetypeOf(Declaration declaration) {
        return declaration.getArchetypes().stream().findFirst().map(Archetype::id);
    }

    static Optional<String> capabilityNear(Declaration declaration, String pathwayName) {
        String needle = pathwayName == null ? "" : pathwayName.trim().toLowerCase(Locale.ROOT);
        if (!needle.isEmpty()) {
            for (Capability capability : declaration.getCapabilities()) {
                String name = capability.name() == null ? "" : capability.name().trim().toLowerCase(Locale.ROOT);
                if (!name.isEmpty() && (name.contains(needle) || needle.contains(name))) {
                    return Optional.of(capability.id());
                }
            }
        }
        Optional<String> first = declaration.getCapabilities().stream().findFirst().map(Capability::id);
        first.ifPresent(id -> log.warn("No capability named like '{}' in {}; using first capability {}",
                pathwayName, declaration.getId(), id));
        return first;
    }
}
