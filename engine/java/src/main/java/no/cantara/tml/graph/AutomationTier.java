package no.cantara.tml.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import no.cantara.tml.model.WireValues;

/**
 * How far a Capability's decision logic can be handed to an automated agent.
 */
public enum AutomationTier {
    /** Readiness above 0.70. */
    AGENT_SKILL,
    /** Readiness above 0.40, up to and including 0.70. */
    WORKFLOW,
    /** Readiness of 0.40 or less: a human decides, assisted. */
    COPILOT;

    @JsonValue
    public String value() {
        return WireValues.of(this);
    }

    @JsonCreator
    public static AutomationTier fromValue(String value) {
        return WireValues.parse(AutomationTier.class, value);
    }

    public static AutomationTier forScore(double score) {
        if (score > 0.70) {
            return AGENT_SKILL;
        }
        if (score > 0.40) {
            return WORKFLOW;
        }
        return COPILOT;
    }
}
