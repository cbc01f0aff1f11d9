package no.cantara.tml;

import no.cantara.tml.model.Binding;
import no.cantara.tml.model.Capability;
import no.cantara.tml.model.Confirmable;
import no.cantara.tml.model.ConfirmationStatus;
import no.cantara.tml.model.Connector;
import no.cantara.tml.model.Declaration;
import no.cantara.tml.model.Domain;
import no.cantara.tml.model.Policy;
import no.cantara.tml.model.Primitive;
import no.cantara.tml.model.View;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks the structural integrity of a {@link Declaration}.
 *
 * <p>Returns a {@link ValidationResult} with separate {@code errors} (the Declaration cannot be
 * trusted) and {@code warnings} (dangling or suspicious references a reviewer should look at).
 */
public class DeclarationValidator {

    /**
     * Immutable result of validating a Declaration.
     *
     * @param errors   Conditions that make the Declaration invalid (MUST fix).
     * @param warnings Conditions that are permitted but suspicious (SHOULD fix).
     */
    public record ValidationResult(List<String> errors, List<String> warnings) {
        public ValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean isValid() { return errors.isEmpty(); }
        public boolean hasWarnings() { return !warnings.isEmpty(); }
    }

    public static ValidationResult validate(Declaration declaration) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (declaration.getId() == null || declaration.getId().isBlank()) {
            errors.add("declaration: 'id' is required");
        }
        if (declaration.getVersion() == null || declaration.getVersion().isBlank()) {
            errors.add("declaration: 'version' is required");
        }
        if (declaration.getScope() == null) {
            errors.add("declaration: 'scope' is required");
            return new ValidationResult(errors, warnings);
        }
        String scopeId = declaration.getScope().id();
        if (scopeId == null || scopeId.isBlank()) {
            errors.add("scope: 'id' is required");
        }

        // Duplicate ids: first occurrence wins on lookup
        Set<String> seen = new HashSet<>();
        for (Primitive primitive : declaration.primitives()) {
            String p = label(primitive);
            if (primitive.id() == null || primitive.id().isBlank()) {
                errors.add(primitive.primitiveType().value() + ": 'id' is required");
                continue;
            }
            if (!seen.add(primitive.id())) {
                warnings.add(p + ": duplicate 'id' (first occurrence takes precedence)");
            }
            if (scopeId != null && !scopeId.equals(primitive.owningScopeId())) {
                errors.add(p + ": 'scope_id' '" + primitive.owningScopeId()
                        + "' does not match declaration scope '" + scopeId + "'");
            }
        }

        for (Confirmable primitive : declaration.confirmables()) {
            if (primitive.confirmationStatus() == ConfirmationStatus.CORRECTED
                    && isBlank(primitive.confirmation().correctedText())) {
                errors.add(label(primitive) + ": corrected confirmation without 'corrected_text'");
            }
        }

        Set<String> archetypeIds = ids(declaration.getArchetypes());
        Set<String> domainIds = ids(declaration.getDomains());
        Set<String> capabilityIds = ids(declaration.getCapabilities());
        Set<String> policyIds = ids(declaration.getPolicies());
        Set<String> allIds = ids(declaration.primitives());

        Set<String> ownedDomains = declaration.getCapabilities().stream()
                .map(Capability::domainId)
                .collect(Collectors.toSet());
        for (Domain domain : declaration.getDomains()) {
            String p = label(domain);
            if (isBlank(domain.accountableArchetypeId())) {
                errors.add(p + ": 'accountable_archetype_id' is required");
            } else if (!archetypeIds.contains(domain.accountableArchetypeId())) {
                warnings.add(p + ": 'accountable_archetype_id' references unknown archetype '"
                        + domain.accountableArchetypeId() + "'");
            }
            if (!ownedDomains.contains(domain.id())) {
                warnings.add(p + ": owns no capability");
            }
        }

        for (Capability capability : declaration.getCapabilities()) {
            String p = label(capability);
            if (isBlank(capability.domainId())) {
                errors.add(p + ": 'domain_id' is required");
            } else if (!domainIds.contains(capability.domainId())) {
                warnings.add(p + ": 'domain_id' references unknown domain '" + capability.domainId() + "'");
            }
        }

        for (View view : declaration.getViews()) {
            String p = label(view);
            if (view.capabilityIds().isEmpty()) {
                errors.add(p + ": 'capability_ids' must not be empty");
            }
            for (String ref : view.capabilityIds()) {
                if (!capabilityIds.contains(ref)) {
                    warnings.add(p + ": 'capability_ids' references unknown capability '" + ref + "'");
                }
            }
            if (!isBlank(view.targetArchetypeId()) && !archetypeIds.contains(view.targetArchetypeId())) {
                warnings.add(p + ": 'target_archetype_id' references unknown archetype '"
                        + view.targetArchetypeId() + "'");
            }
        }

        for (Policy policy : declaration.getPolicies()) {
            for (String ref : policy.attachesTo()) {
                if (!allIds.contains(ref)) {
                    warnings.add(label(policy) + ": 'attaches_to' references unknown primitive '" + ref + "'");
                }
            }
        }

        for (Connector connector : declaration.getConnectors()) {
            if (isBlank(connector.readsFrom())) {
                warnings.add(label(connector) + ": 'reads_from' is blank; it matches every binding");
            }
            checkPolicies(label(connector), connector.governedByPolicyIds(), policyIds, warnings);
        }
        for (Binding binding : declaration.getBindings()) {
            if (isBlank(binding.writesTo())) {
                warnings.add(label(binding) + ": 'writes_to' is blank; it matches every connector");
            }
            checkPolicies(label(binding), binding.governedByPolicyIds(), policyIds, warnings);
        }

        return new ValidationResult(errors, warnings);
    }

    private static void checkPolicies(String p, List<String> refs, Set<String> policyIds, List<String> warnings) {
        for (String ref : refs) {
            if (!policyIds.contains(ref)) {
                warnings.add(p + ": 'governed_by_policy_ids' references unknown policy '" + ref + "'");
            }
        }
    }

    private static String label(Primitive primitive) {
        return primitive.primitiveType().value() + " '" + primitive.id() + "'";
    }

    private static Set<String> ids(List<? extends Primitive> primitives) {
        return primitives.stream().map(Primitive::id).collect(Collectors.toSet());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
