package dev.changeguard.domain.valueobject;

import java.util.ArrayList;
import java.util.List;

/** Change documentation, either read live from the change record or archived from the webhook. */
public record DocumentationFields(String implementationPlan, String rollbackPlan,
                                  String testPlan, String justification) {

    public static DocumentationFields empty() {
        return new DocumentationFields(null, null, null, null);
    }

    /** Field-by-field merge: values present here win, gaps are filled from {@code fallback}. */
    public DocumentationFields orElse(DocumentationFields fallback) {
        if (fallback == null) return this;
        return new DocumentationFields(
                firstPresent(implementationPlan, fallback.implementationPlan),
                firstPresent(rollbackPlan, fallback.rollbackPlan),
                firstPresent(testPlan, fallback.testPlan),
                firstPresent(justification, fallback.justification));
    }

    public List<String> missing() {
        List<String> missing = new ArrayList<>();
        if (isBlank(implementationPlan)) missing.add("implementation plan");
        if (isBlank(rollbackPlan)) missing.add("rollback plan");
        if (isBlank(testPlan)) missing.add("test plan");
        if (isBlank(justification)) missing.add("justification");
        return missing;
    }

    private static String firstPresent(String a, String b) {
        return isBlank(a) ? (isBlank(b) ? null : b.trim()) : a.trim();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
