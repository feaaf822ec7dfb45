package dev.changeguard.orchestrator;

import dev.changeguard.domain.valueobject.Verdict;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a verdict as a plain-text work note for the change record.
 */
@Component
public class WorkNoteFormatter {

    public String format(Verdict verdict, Instant completedAt) {
        List<String> sections = new ArrayList<>();
        if (verdict.synthesis() != null) sections.add(verdict.synthesis());
        if (verdict.documentationAssessment() != null)
            sections.add("Documentation: " + verdict.documentationAssessment());
        if (!verdict.risks().isEmpty()) sections.add(bullets("Risks", verdict.risks()));
        if (!verdict.remediationSteps().isEmpty())
            sections.add(bullets("Required Actions", verdict.remediationSteps()));
        if (!verdict.checks().isEmpty()) {
            List<String> checks = new ArrayList<>();
            for (Map.Entry<String, Boolean> check : verdict.checks().entrySet()) {
                checks.add(check.getKey() + ": " + (Boolean.TRUE.equals(check.getValue()) ? "✓" : "✗"));
            }
            sections.add(bullets("Checks", checks));
        }
        String body = sections.isEmpty() ? "No additional details captured." : String.join("\n\n", sections);

        return "%s Automated Validation Result: %s%n%n%s%n%nVerdict source: %s%nValidation completed at %s".formatted(
                marker(verdict), verdict.overallStatus(), body,
                verdict.source().name().toLowerCase(), completedAt);
    }

    private static String marker(Verdict verdict) {
        return switch (verdict.overallStatus()) {
            case PASSED -> "✅";
            case FAILED -> "❌";
            case WARNING -> "⚠️";
        };
    }

    private static String bullets(String title, List<String> items) {
        StringBuilder sb = new StringBuilder(title).append(':');
        items.forEach(item -> sb.append("\n  • ").append(item));
        return sb.toString();
    }
}
