package dev.changeguard.synthesis;

import dev.changeguard.domain.enums.OverallStatus;
import dev.changeguard.domain.enums.VerdictSource;
import dev.changeguard.domain.valueobject.ChangeContext;
import dev.changeguard.domain.valueobject.FactBundle;
import dev.changeguard.domain.valueobject.Verdict;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Deterministic verdict from the check map alone. Same checks in, same verdict out.
 *
 * <ul>
 *   <li>PASSED when every check is true</li>
 *   <li>FAILED when a check named {@code has_*} or {@code is_*} is false</li>
 *   <li>WARNING otherwise, including when there are no checks at all</li>
 * </ul>
 */
@Component
public class RulesSynthesisStrategy {

    static final String DOCUMENTATION_ACTION =
            "Provide complete documentation (implementation, rollback and test plans) before resubmission.";
    static final String UNRECOGNIZED_ACTION =
            "Confirm the component type and review the change manually.";

    public static OverallStatus statusFor(Map<String, Boolean> checks) {
        if (checks.isEmpty()) return OverallStatus.WARNING;
        if (checks.values().stream().allMatch(Boolean.TRUE::equals)) return OverallStatus.PASSED;
        boolean hardFailure = checks.entrySet().stream()
                .anyMatch(e -> !Boolean.TRUE.equals(e.getValue()) && isHardRequirement(e.getKey()));
        return hardFailure ? OverallStatus.FAILED : OverallStatus.WARNING;
    }

    static boolean isHardRequirement(String check) {
        return check.startsWith("has_") || check.startsWith("is_");
    }

    public Verdict synthesize(FactBundle facts) {
        Map<String, Boolean> checks = facts.checks();
        OverallStatus status = statusFor(checks);
        List<String> failed = checks.entrySet().stream()
                .filter(e -> !Boolean.TRUE.equals(e.getValue()))
                .map(e -> label(e.getKey()))
                .toList();

        String synthesis;
        List<String> remediation;
        if (!facts.isComponentRecognized()) {
            synthesis = "Component type '%s' is not recognized, so no automated configuration checks could run. Manual review required."
                    .formatted(facts.componentType());
            remediation = List.of(UNRECOGNIZED_ACTION);
        } else if (checks.isEmpty()) {
            synthesis = "No automated configuration checks were available for this change. Manual review required.";
            remediation = List.of(DOCUMENTATION_ACTION);
        } else {
            synthesis = switch (status) {
                case PASSED -> "Change validation passed. All %d configuration checks completed successfully."
                        .formatted(checks.size());
                case FAILED -> "Change validation failed. Missing or invalid configuration: %s. Remediate before proceeding."
                        .formatted(String.join(", ", failed));
                case WARNING -> "Change validation returned warnings. Review the following checks before deployment: %s."
                        .formatted(String.join(", ", failed));
            };
            remediation = failed.stream().map(check -> "Resolve configuration gap: " + check).toList();
        }

        return new Verdict(status, checks, synthesis, remediation, failed,
                documentationAssessment(facts.changeContext()), VerdictSource.RULES);
    }

    static String label(String check) {
        return check.replace('_', ' ');
    }

    private static String documentationAssessment(ChangeContext context) {
        List<String> missing = context.missingDocumentation();
        String assessment = missing.isEmpty()
                ? "Implementation plan, rollback plan, test plan and justification are documented."
                : "Missing documentation: " + String.join(", ", missing) + ".";
        return context.isArchived() ? assessment + " Assessed from the archived webhook payload." : assessment;
    }
}
