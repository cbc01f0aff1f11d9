package no.cantara.tml.model;

/**
 * An edge case that overrides a Capability's normal decision logic.
 */
public record ExceptionRule(
        String trigger,
        String overrideDescription,
        String reason
) {}
