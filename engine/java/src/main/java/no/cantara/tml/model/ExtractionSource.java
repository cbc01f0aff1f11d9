package no.cantara.tml.model;

import java.time.Instant;

/**
 * Where a primitive was extracted from, e.g. {@code web} + URL or {@code interview} + e-mail.
 */
public record ExtractionSource(
        String sourceType,
        String sourceIdentifier,
        Instant extractedAt
) {}
