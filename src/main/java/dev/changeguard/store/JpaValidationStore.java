package dev.changeguard.store;

import dev.changeguard.domain.entity.ValidationRequest;
import dev.changeguard.domain.enums.OverallStatus;
import dev.changeguard.domain.enums.ValidationStatus;
import dev.changeguard.domain.valueobject.ValidationStats;
import dev.changeguard.domain.valueobject.Verdict;
import dev.changeguard.exception.DuplicateValidationException;
import dev.changeguard.exception.StoreUnavailableException;
import dev.changeguard.exception.ValidationNotFoundException;
import dev.changeguard.repository.ValidationRequestRepository;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * JPA-backed store. Each call runs in its own short transaction; the retry wraps the whole
 * transaction so an optimistic-lock conflict reloads the row before trying again.
 */
@Component
public class JpaValidationStore implements ValidationStore {

    private static final Logger log = LoggerFactory.getLogger(JpaValidationStore.class);

    private final ValidationRequestRepository repository;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;
    private final Retry writeRetry;
    private final Retry readRetry;

    public JpaValidationStore(ValidationRequestRepository repository,
                              PlatformTransactionManager transactionManager,
                              @Qualifier("storeWriteRetry") Retry writeRetry,
                              @Qualifier("storeReadRetry") Retry readRetry) {
        this.repository = repository;
        this.writeTx = new TransactionTemplate(transactionManager);
        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
        this.writeRetry = writeRetry;
        this.readRetry = readRetry;
    }

    @Override
    public ValidationRequest create(ValidationRequest request) {
        try {
            return write("create", () -> repository.saveAndFlush(request));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateValidationException(request.getChangeId(), e);
        }
    }

    @Override
    public Optional<ValidationRequest> findByChangeId(String changeId) {
        return read("findByChangeId", () -> repository.findByChangeId(changeId));
    }

    @Override
    public ValidationRequest markProcessing(String changeId) {
        return transition("markProcessing", changeId, ValidationRequest::markProcessing);
    }

    @Override
    public ValidationRequest markCompleted(String changeId, Verdict verdict, long durationMs) {
        return transition("markCompleted", changeId, r -> r.markCompleted(verdict, durationMs));
    }

    @Override
    public ValidationRequest markFailed(String changeId, String reason, long durationMs) {
        return transition("markFailed", changeId, r -> r.markFailed(reason, durationMs));
    }

    @Override
    public List<ValidationRequest> findRecentByStatus(ValidationStatus status, Duration window, int limit) {
        Instant since = Instant.now().minus(window);
        return read("findRecentByStatus", () -> repository.findByStatusAndCreatedAtAfterOrderByCreatedAtDesc(
                status, since, PageRequest.of(0, limit)));
    }

    @Override
    public List<ValidationRequest> findByComponentType(String componentType, int limit) {
        return read("findByComponentType", () -> repository.findByComponentTypeOrderByCreatedAtDesc(
                componentType, PageRequest.of(0, limit)));
    }

    @Override
    public ValidationStats stats(Duration window) {
        Instant since = Instant.now().minus(window);
        return read("stats", () -> {
            long total = 0, pending = 0, processingFailures = 0;
            for (Object[] row : repository.countByStatusSince(since)) {
                ValidationStatus status = (ValidationStatus) row[0];
                long count = ((Number) row[1]).longValue();
                total += count;
                if (!status.isTerminal()) pending += count;
                if (status == ValidationStatus.FAILED) processingFailures += count;
            }
            long passed = 0, failed = 0, warning = 0;
            for (Object[] row : repository.countByVerdictSince(since)) {
                long count = ((Number) row[1]).longValue();
                Optional<OverallStatus> verdict = OverallStatus.parse((String) row[0]);
                if (verdict.isEmpty()) continue;
                switch (verdict.get()) {
                    case PASSED -> passed += count;
                    case FAILED -> failed += count;
                    case WARNING -> warning += count;
                }
            }
            return new ValidationStats(window, total, passed, failed, warning, pending, processingFailures,
                    repository.averageProcessingMsSince(since));
        });
    }

    private ValidationRequest transition(String operation, String changeId, Predicate<ValidationRequest> step) {
        return write(operation, () -> {
            ValidationRequest request = repository.findByChangeId(changeId)
                    .orElseThrow(() -> new ValidationNotFoundException(changeId));
            if (!step.test(request)) {
                log.debug("{} left change {} in {}", operation, changeId, request.getStatus());
                return request;
            }
            return repository.saveAndFlush(request);
        });
    }

    private <T> T write(String operation, Supplier<T> work) {
        return withRetry(writeRetry, operation, () -> writeTx.execute(status -> work.get()));
    }

    private <T> T read(String operation, Supplier<T> work) {
        return withRetry(readRetry, operation, () -> readTx.execute(status -> work.get()));
    }

    private <T> T withRetry(Retry retry, String operation, Supplier<T> call) {
        try {
            return Retry.decorateSupplier(retry, call).get();
        } catch (RuntimeException e) {
            if (retry.getRetryConfig().getExceptionPredicate().test(e)) {
                log.error("Store {} failed after {} attempts: {}", operation,
                        retry.getRetryConfig().getMaxAttempts(), e.getMessage());
                throw new StoreUnavailableException(operation, e);
            }
            throw e;
        }
    }
}
