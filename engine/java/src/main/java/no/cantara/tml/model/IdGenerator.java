package no.cantara.tml.model;

import java.util.UUID;

/**
 * Assigns durable primitive ids of the form {@code <prefix>-<8 hex chars>}.
 */
@FunctionalInterface
public interface IdGenerator {

    String next(String prefix);

    static IdGenerator random() {
        return prefix -> prefix + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
