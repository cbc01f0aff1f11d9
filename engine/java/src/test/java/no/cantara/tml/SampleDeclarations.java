package no.cantara.tml;

import no.cantara.tml.model.Archetype;
import no.cantara.tml.model.Binding;
import no.cantara.tml.model.Capability;
import no.cantara.tml.model.Connector;
import no.cantara.tml.model.DecisionFactor;
import no.cantara.tml.model.Declaration;
import no.cantara.tml.model.Domain;
import no.cantara.tml.model.ExceptionRule;
import no.cantara.tml.model.ExtractionSource;
import no.cantara.tml.model.FactorWeight;
import no.cantara.tml.model.HumanIdentity;
import no.cantara.tml.model.IdGenerator;
import no.cantara.tml.model.Policy;
import no.cantara.tml.model.EnforcementLevel;
import no.cantara.tml.model.ProjectionFormat;
import no.cantara.tml.model.Scope;
import no.cantara.tml.model.SkillReference;
import no.cantara.tml.model.SkillType;
import no.cantara.tml.model.TargetType;
import no.cantara.tml.model.View;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Two small organisations' worth of Declarations: finance publishes an approved budget to a
 * ledger that engineering reads from.
 */
public final class SampleDeclarations {

    public static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    public static final HumanIdentity ALICE = new HumanIdentity("alice@acme.test", "Alice Example");
    public static final HumanIdentity BOB = new HumanIdentity("bob@acme.test", "Bob Example");
    public static final ExtractionSource INTERVIEW = new ExtractionSource("interview", "alice@acme.test", NOW);

    private SampleDeclarations() {}

    /** {@code prefix-00000001}, {@code prefix-00000002}, ... */
    public static IdGenerator sequentialIds() {
        AtomicInteger counter = new AtomicInteger();
        return prefix -> prefix + "-" + String.format("%08d", counter.incrementAndGet());
    }

    public static Declaration finance() {
        Scope scope = new Scope("scope-fin", "Finance", "Corporate finance", null, ALICE, null, INTERVIEW);
        return Declaration.builder("decl-fin", scope)
                .createdAt(NOW)
                .archetypes(List.of(new Archetype("arch-cfo", "scope-fin", ALICE, "CFO",
                        "Owns the budget", List.of("Budgeting"), List.of("Approve spend over 10k"),
                        List.of("Not payroll"), null, INTERVIEW)))
                .domains(List.of(new Domain("dom-fin", "scope-fin", "Budgeting", "Annual budget",
                        "Spend stays within plan", "arch-cfo", null, INTERVIEW)))
                .capabilities(List.of(budgetApproval()))
                .policies(List.of(new Policy("pol-4eyes", "scope-fin", "Four eyes",
                        "Two approvers on large spend", "Spend over 10k needs two approvers",
                        List.of("cap-budget"), EnforcementLevel.HARD, null, INTERVIEW)))
                .bindings(List.of(new Binding("bind-budget", "scope-fin", "Budget approval publish",
                        "Budget Ledger", TargetType.EXTERNAL_SYSTEM, List.of("pol-4eyes"),
                        "Approved budget must be posted before spending", null, INTERVIEW)))
                .views(List.of(new View("view-cfo", "scope-fin", "CFO summary", null,
                        List.of("cap-budget"), "arch-cfo", ProjectionFormat.SUMMARY)))
                .build();
    }

    public static Declaration engineering() {
        Scope scope = new Scope("scope-eng", "Engineering", null, null, BOB, null, INTERVIEW);
        return Declaration.builder("decl-eng", scope)
                .createdAt(NOW)
                .archetypes(List.of(new Archetype("arch-cto", "scope-eng", BOB, "CTO", "Runs engineering",
                        null, null, null, null, INTERVIEW)))
                .domains(List.of(new Domain("dom-eng", "scope-eng", "Delivery", null,
                        "Features ship on time", "arch-cto", null, INTERVIEW)))
                .capabilities(List.of(new Capability("cap-plan", "scope-eng", "dom-eng", "Sprint planning",
                        "Plan the next sprint within budget", "A committed sprint", null,
                        List.of("Keep 20% slack"), null, null, null, null, INTERVIEW)))
                .connectors(List.of(new Connector("conn-ledger", "scope-eng", "Sprint planning intake",
                        "budget ledger", TargetType.EXTERNAL_SYSTEM, null, "Reads remaining budget",
                        null, INTERVIEW)))
                .build();
    }

    /** Weighted factors, heuristics, exceptions, an automatable skill and anti-patterns; unconfirmed. */
    public static Capability budgetApproval() {
        return new Capability("cap-budget", "scope-fin", "dom-fin", "Budget approval",
                "Approve departmental budget requests", "Approved or rejected request",
                List.of(new DecisionFactor("Strategic fit", "Does it serve the plan", FactorWeight.PRIMARY),
                        new DecisionFactor("Timing", null, null)),
                List.of("Reject anything without a business case"),
                List.of("Approving by default at quarter end"),
                List.of(new ExceptionRule("Regulatory deadline", "Approve immediately", "Fines exceed cost")),
                List.of(new SkillReference("skill-1", "Budget check", null, SkillType.TOOL, "erp", null)),
                null, INTERVIEW);
    }
}
