package dev.changeguard.dto.response;

import dev.changeguard.domain.enums.ValidationStatus;
import dev.changeguard.domain.valueobject.Verdict;

import java.time.Instant;
import java.util.UUID;

public record ValidationResponse(
        UUID id,
        String changeId,
        String changeNumber,
        String componentType,
        String componentId,
        String requestedBy,
        ValidationStatus status,
        Verdict verdict,
        String failureReason,
        Long processingDurationMs,
        int retryCount,
        Instant createdAt,
        Instant updatedAt,
        Instant processedAt
) {
}
