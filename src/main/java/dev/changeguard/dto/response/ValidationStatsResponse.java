package dev.changeguard.dto.response;

import dev.changeguard.domain.valueobject.ValidationStats;

public record ValidationStatsResponse(
        long days,
        long total,
        long passed,
        long failed,
        long warning,
        long pending,
        long processingFailures,
        Double averageProcessingMs
) {
    public static ValidationStatsResponse from(ValidationStats stats) {
        return new ValidationStatsResponse(stats.window().toDays(), stats.total(), stats.passed(), stats.failed(),
                stats.warning(), stats.pending(), stats.processingFailures(), stats.averageProcessingMs());
    }
}
