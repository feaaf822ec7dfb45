package dev.changeguard.domain.valueobject;

import java.time.Duration;

/**
 * Aggregate counts over a time window. {@code pending} covers requests not yet terminal;
 * {@code processingFailures} counts rows in FAILED status, as opposed to FAILED verdicts.
 */
public record ValidationStats(
        Duration window,
        long total,
        long passed,
        long failed,
        long warning,
        long pending,
        long processingFailures,
        Double averageProcessingMs
) {
}
