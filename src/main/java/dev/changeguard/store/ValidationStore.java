package dev.changeguard.store;

import dev.changeguard.domain.entity.ValidationRequest;
import dev.changeguard.domain.enums.ValidationStatus;
import dev.changeguard.domain.valueobject.ValidationStats;
import dev.changeguard.domain.valueobject.Verdict;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for validation requests.
 *
 * <p>Transition helpers load the row by change id, apply the entity's transition and save it.
 * A row that is already terminal is returned unchanged. Every operation retries transient
 * failures and reports exhaustion as {@link dev.changeguard.exception.StoreUnavailableException}.
 */
public interface ValidationStore {

    /** @throws dev.changeguard.exception.DuplicateValidationException if the change id is taken */
    ValidationRequest create(ValidationRequest request);

    Optional<ValidationRequest> findByChangeId(String changeId);

    /** @throws dev.changeguard.exception.ValidationNotFoundException if no row exists */
    ValidationRequest markProcessing(String changeId);

    ValidationRequest markCompleted(String changeId, Verdict verdict, long durationMs);

    ValidationRequest markFailed(String changeId, String reason, long durationMs);

    List<ValidationRequest> findRecentByStatus(ValidationStatus status, Duration window, int limit);

    List<ValidationRequest> findByComponentType(String componentType, int limit);

    ValidationStats stats(Duration window);
}
