package dev.changeguard.domain.valueobject;

import dev.changeguard.domain.enums.OverallStatus;
import dev.changeguard.domain.enums.VerdictSource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one processing attempt. Immutable once attached to a validation request.
 * Check order is preserved so work notes list checks the way they were derived.
 */
public record Verdict(
        OverallStatus overallStatus,
        Map<String, Boolean> checks,
        String synthesis,
        List<String> remediationSteps,
        List<String> risks,
        String documentationAssessment,
        VerdictSource source
) {
    public Verdict {
        Objects.requireNonNull(overallStatus, "overallStatus");
        checks = checks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(checks));
        remediationSteps = nonBlank(remediationSteps);
        risks = nonBlank(risks);
        if (source == null) source = VerdictSource.RULES;
    }

    public List<String> failedChecks() {
        return checks.entrySet().stream()
                .filter(e -> !Boolean.TRUE.equals(e.getValue()))
                .map(Map.Entry::getKey)
                .toList();
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) return List.of();
        return values.stream().filter(v -> v != null && !v.isBlank()).toList();
    }
}
