package dev.changeguard.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.changeguard.collector.FactCollector;
import dev.changeguard.config.ValidationProperties;
import dev.changeguard.domain.entity.ValidationRequest;
import dev.changeguard.domain.enums.ValidationStatus;
import dev.changeguard.domain.valueobject.ChangeSnapshot;
import dev.changeguard.domain.valueobject.Deadline;
import dev.changeguard.domain.valueobject.DocumentationFields;
import dev.changeguard.domain.valueobject.FactBundle;
import dev.changeguard.domain.valueobject.Verdict;
import dev.changeguard.dto.request.ChangeWebhookPayload;
import dev.changeguard.exception.DuplicateValidationException;
import dev.changeguard.exception.PayloadValidationException;
import dev.changeguard.exception.ValidationNotFoundException;
import dev.changeguard.exception.ValidationProcessingException;
import dev.changeguard.infrastructure.servicenow.TicketClient;
import dev.changeguard.store.ValidationStore;
import dev.changeguard.synthesis.Synthesizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Drives a change validation from receipt to a terminal state.
 *
 * <pre>
 *  receive:  validate payload -> store RECEIVED (idempotent on change id)
 *  process:  PROCESSING -> collect facts (deadline) -> synthesize -> COMPLETED -> post work note
 *                                   \ any failure before a verdict -> FAILED
 * </pre>
 *
 * <p>Not transactional as a whole: each store call is its own short transaction, and
 * collector threads only ever see an immutable {@link ChangeSnapshot}.
 * Posting the work note happens after the verdict is stored; a posting failure is logged and
 * the validation still counts as completed. An attempt whose verdict was not the one stored
 * (a concurrent attempt finished first) returns the stored verdict and posts nothing.
 */
@Component
public class ValidationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ValidationOrchestrator.class);
    static final String MDC_CHANGE_ID = "changeId";

    private final ValidationStore store;
    private final FactCollector collector;
    private final Synthesizer synthesizer;
    private final TicketClient ticketClient;
    private final WorkNoteFormatter noteFormatter;
    private final ValidationProperties properties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Timer orchestrationTimer;

    public ValidationOrchestrator(ValidationStore store, FactCollector collector, Synthesizer synthesizer,
                                  TicketClient ticketClient, WorkNoteFormatter noteFormatter,
                                  ValidationProperties properties, ObjectMapper objectMapper,
                                  MeterRegistry meterRegistry) {
        this.store = store;
        this.collector = collector;
        this.synthesizer = synthesizer;
        this.ticketClient = ticketClient;
        this.noteFormatter = noteFormatter;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.orchestrationTimer = Timer.builder("changeguard.orchestration.duration")
                .description("End-to-end change validation time")
                .register(meterRegistry);
    }

    public record Receipt(ValidationRequest request, boolean duplicate) {
    }

    /**
     * Records an inbound change. A change id seen before returns the stored request unchanged.
     *
     * @throws PayloadValidationException if required fields are missing
     */
    public Receipt receive(ChangeWebhookPayload payload, String rawPayload, String signature, String requestedBy) {
        List<String> missing = payload.missingRequiredFields();
        if (!missing.isEmpty()) throw new PayloadValidationException(missing);

        Optional<ValidationRequest> existing = store.findByChangeId(payload.changeSysId());
        if (existing.isPresent()) {
            log.info("Duplicate webhook for change {} ({}), keeping request {}",
                    payload.changeNumber(), payload.changeSysId(), existing.get().getId());
            return new Receipt(existing.get(), true);
        }

        ValidationRequest request = ValidationRequest.receive(payload.changeSysId(), payload.changeNumber(),
                payload.componentType(), payload.componentSysId(), rawPayload, signature, requestedBy);
        try {
            ValidationRequest created = store.create(request);
            log.info("Received change {} ({}) for component {} {}", created.getChangeNumber(),
                    created.getChangeId(), created.getComponentType(), created.getComponentId());
            return new Receipt(created, false);
        } catch (DuplicateValidationException e) {
            return store.findByChangeId(payload.changeSysId())
                    .map(winner -> new Receipt(winner, true))
                    .orElseThrow(() -> e);
        }
    }

    /**
     * Runs one processing attempt. A completed request returns its stored verdict.
     *
     * @throws ValidationNotFoundException if the change was never received
     * @throws ValidationProcessingException if the attempt failed; the request is then FAILED
     */
    public Verdict process(String changeId) {
        Timer.Sample sample = Timer.start(meterRegistry);
        MDC.put(MDC_CHANGE_ID, changeId);
        long started = System.nanoTime();
        try {
            ValidationRequest request = store.findByChangeId(changeId)
                    .orElseThrow(() -> new ValidationNotFoundException(changeId));
            if (request.getStatus() == ValidationStatus.COMPLETED) {
                log.info("Change {} already validated, returning stored verdict", request.getChangeNumber());
                return request.getVerdict();
            }

            request = store.markProcessing(changeId);
            if (request.getStatus() == ValidationStatus.COMPLETED) return request.getVerdict();
            log.info("Processing change {} (attempt {})", request.getChangeNumber(), request.getRetryCount() + 1);

            Verdict verdict;
            ValidationRequest completed;
            try {
                ChangeSnapshot snapshot = toSnapshot(request);
                FactBundle facts = collector.collect(snapshot, Deadline.after(properties.collectionDeadline()));
                verdict = synthesizer.synthesize(snapshot, facts);
                completed = store.markCompleted(changeId, verdict, elapsedMs(started));
            } catch (RuntimeException e) {
                recordFailure(changeId, e, elapsedMs(started));
                throw new ValidationProcessingException(changeId, e);
            }

            if (!verdict.equals(completed.getVerdict())) {
                return keepStoredOutcome(completed);
            }

            log.info("Change {} validated: {} ({} verdict, {} ms)", request.getChangeNumber(),
                    verdict.overallStatus(), verdict.source(), elapsedMs(started));
            meterRegistry.counter("changeguard.validation.verdicts", "status", verdict.overallStatus().name())
                    .increment();
            postNote(request, verdict);
            return verdict;
        } finally {
            sample.stop(orchestrationTimer);
            MDC.remove(MDC_CHANGE_ID);
        }
    }

    /** Another attempt reached a terminal state first; its outcome stands and this one is discarded. */
    private Verdict keepStoredOutcome(ValidationRequest stored) {
        if (stored.getVerdict() == null) {
            throw new ValidationProcessingException(stored.getChangeId(),
                    new IllegalStateException("verdict not recorded, request is " + stored.getStatus()));
        }
        log.info("Change {} was completed by another attempt, keeping its {} verdict",
                stored.getChangeNumber(), stored.getVerdict().overallStatus());
        return stored.getVerdict();
    }

    private void postNote(ValidationRequest request, Verdict verdict) {
        try {
            ticketClient.postNote(request.getChangeId(), noteFormatter.format(verdict, Instant.now()));
        } catch (RuntimeException e) {
            meterRegistry.counter("changeguard.worknote.failures").increment();
            log.warn("Could not post work note on change {}: {}", request.getChangeNumber(), e.getMessage());
        }
    }

    private void recordFailure(String changeId, RuntimeException cause, long durationMs) {
        log.error("Validation of change {} failed", changeId, cause);
        try {
            store.markFailed(changeId, cause.getClass().getSimpleName() + ": " + cause.getMessage(), durationMs);
        } catch (RuntimeException e) {
            log.error("Could not record failure of change {}: {}", changeId, e.getMessage());
        }
    }

    private ChangeSnapshot toSnapshot(ValidationRequest request) {
        ChangeWebhookPayload payload = null;
        try {
            payload = objectMapper.readValue(request.getRawPayload(), ChangeWebhookPayload.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Archived payload of change {} is unreadable: {}", request.getChangeNumber(), e.getMessage());
        }
        return new ChangeSnapshot(
                request.getChangeId(),
                request.getChangeNumber(),
                request.getComponentType(),
                request.getComponentId(),
                request.getRequestedBy(),
                payload != null ? payload.shortDescription() : null,
                payload != null ? payload.templateName() : null,
                payload != null ? payload.documentation() : DocumentationFields.empty());
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
