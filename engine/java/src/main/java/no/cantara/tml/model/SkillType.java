package no.cantara.tml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a skill referenced by a Capability is executed.
 */
public enum SkillType {
    AGENT_SKILL,
    WORKFLOW,
    TOOL,
    PROCESS,
    MANUAL;

    @JsonValue
    public String value() {
        return WireValues.of(this);
    }

    @JsonCreator
    public static SkillType fromValue(String value) {
        return WireValues.parse(SkillType.class, value);
    }

    /** Agent skills, workflows and tools can run without a human in the loop. */
    public boolean isAutomatable() {
        return this == AGENT_SKILL || this == WORKFLOW || this == TOOL;
    }
}
