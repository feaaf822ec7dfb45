package dev.changeguard.service;

import dev.changeguard.domain.entity.ValidationRequest;
import dev.changeguard.domain.enums.ValidationStatus;
import dev.changeguard.dto.response.ValidationResponse;
import dev.changeguard.dto.response.ValidationStatsResponse;
import dev.changeguard.store.ValidationStore;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/** Read side for operators: single lookups, recent lists and window statistics. */
@Service
public class ValidationQueryService {

    static final int MAX_LIMIT = 200;
    static final int MAX_DAYS = 365;

    private final ValidationStore store;

    public ValidationQueryService(ValidationStore store) {
        this.store = store;
    }

    public Optional<ValidationResponse> findByChangeId(String changeId) {
        return store.findByChangeId(changeId).map(ValidationQueryService::toResponse);
    }

    public List<ValidationResponse> findRecentByStatus(ValidationStatus status, int days, int limit) {
        return store.findRecentByStatus(status, window(days), clampLimit(limit)).stream()
                .map(ValidationQueryService::toResponse)
                .toList();
    }

    public List<ValidationResponse> findByComponentType(String componentType, int limit) {
        return store.findByComponentType(componentType, clampLimit(limit)).stream()
                .map(ValidationQueryService::toResponse)
                .toList();
    }

    public ValidationStatsResponse stats(int days) {
        return ValidationStatsResponse.from(store.stats(window(days)));
    }

    private static Duration window(int days) {
        if (days < 1 || days > MAX_DAYS)
            throw new IllegalArgumentException("days must be between 1 and " + MAX_DAYS);
        return Duration.ofDays(days);
    }

    private static int clampLimit(int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be positive");
        return Math.min(limit, MAX_LIMIT);
    }

    static ValidationResponse toResponse(ValidationRequest r) {
        return new ValidationResponse(r.getId(), r.getChangeId(), r.getChangeNumber(), r.getComponentType(),
                r.getComponentId(), r.getRequestedBy(), r.getStatus(), r.getVerdict(), r.getFailureReason(),
                r.getProcessingDurationMs(), r.getRetryCount(), r.getCreatedAt(), r.getUpdatedAt(),
                r.getProcessedAt());
    }
}
