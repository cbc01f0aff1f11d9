package no.cantara.tml.graph;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TargetMatcherTest {

    @Test
    void matchesIgnoringCaseAndWhitespace() {
        assertTrue(TargetMatcher.targetsMatch("  Budget Ledger ", "budget ledger"));
    }

    @Test
    void matchesContainmentEitherWay() {
        assertTrue(TargetMatcher.targetsMatch("Salesforce", "Salesforce opportunities"));
        assertTrue(TargetMatcher.targetsMatch("Jira board ENG", "jira board"));
    }

    @Test
    void unrelatedTargetsDoNotMatch() {
        assertFalse(TargetMatcher.targetsMatch("Slack", "Jira"));
    }

    @Test
    void blankTargetIsContainedInEveryTarget() {
        assertTrue(TargetMatcher.targetsMatch("", "Dispatch Team"));
        assertTrue(TargetMatcher.targetsMatch("Dispatch Team", "   "));
        assertTrue(TargetMatcher.targetsMatch(null, "Jira"));
        assertTrue(TargetMatcher.targetsMatch(null, null));
    }

    @Test
    void exactModeMatchesBlankOnlyAgainstBlank() {
        TargetMatcher exact = new TargetMatcher(TargetMatchMode.EXACT);
        assertFalse(exact.matches("", "Dispatch Team"));
        assertTrue(exact.matches(" ", null));
    }

    @Test
    void exactModeRequiresEquality() {
        TargetMatcher exact = new TargetMatcher(TargetMatchMode.EXACT);
        assertTrue(exact.matches("Budget Ledger", "budget ledger "));
        assertFalse(exact.matches("Salesforce", "Salesforce opportunities"));
    }
}
