package no.cantara.tml.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Lowercase wire names for the closed enums of the primitive grid and of the computed graph.
 * Parsing tolerates surrounding whitespace, either case and hyphens for underscores.
 */
public final class WireValues {

    private WireValues() {}

    public static String of(Enum<?> constant) {
        return constant.name().toLowerCase(Locale.ROOT);
    }

    public static <E extends Enum<E>> E parse(Class<E> type, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(type.getSimpleName() + " value is required");
        }
        String normalised = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(normalised)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " '" + value
                + "'; expected one of " + Arrays.stream(type.getEnumConstants())
                .map(WireValues::of)
                .collect(Collectors.joining(", ", "[", "]")));
    }
}
