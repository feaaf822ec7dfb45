package dev.changeguard.domain.enums;

import java.util.Locale;
import java.util.Optional;

public enum OverallStatus {
    PASSED, FAILED, WARNING;

    /**
     * Accepts both the verdict vocabulary and the CAB vocabulary
     * (APPROVE, APPROVE_WITH_CONDITIONS, REJECT) a model may answer with.
     */
    public static Optional<OverallStatus> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "PASSED", "PASS", "APPROVE", "APPROVED" -> Optional.of(PASSED);
            case "FAILED", "FAIL", "REJECT", "REJECTED" -> Optional.of(FAILED);
            case "WARNING", "APPROVE_WITH_CONDITIONS" -> Optional.of(WARNING);
            default -> Optional.empty();
        };
    }
}
