package dev.changeguard.service;

import dev.changeguard.config.ValidationProperties;
import dev.changeguard.domain.entity.ValidationRequest;
import dev.changeguard.domain.enums.ValidationStatus;
import dev.changeguard.domain.event.ValidationRequestedEvent;
import dev.changeguard.dto.request.ChangeWebhookPayload;
import dev.changeguard.exception.ChangeGuardException;
import dev.changeguard.orchestrator.ValidationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Command side of the webhook. Records the change, then either hands it to the queue
 * (async mode) or processes it on the request thread (sync mode).
 *
 * <p>A duplicate delivery is acknowledged. It is handed on again only while the stored request
 * is still RECEIVED, which is how a delivery whose queue send failed gets recovered.
 */
@Service
public class ValidationIntakeService {

    private static final Logger log = LoggerFactory.getLogger(ValidationIntakeService.class);

    public static final String MODE_ASYNC = "async";
    public static final String MODE_SYNC = "sync";

    private final ValidationOrchestrator orchestrator;
    private final ApplicationEventPublisher eventPublisher;
    private final ValidationProperties properties;

    public ValidationIntakeService(ValidationOrchestrator orchestrator, ApplicationEventPublisher eventPublisher,
                                   ValidationProperties properties) {
        this.orchestrator = orchestrator;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
    }

    public record Intake(ValidationRequest request, boolean duplicate, String processingMode) {
    }

    public boolean isEnabled() {
        return properties.enabled();
    }

    public Intake accept(ChangeWebhookPayload payload, String rawBody, String signature) {
        ValidationOrchestrator.Receipt receipt = orchestrator.receive(payload, rawBody, signature, payload.submittedBy());
        ValidationRequest request = receipt.request();
        String mode = properties.asyncEnabled() ? MODE_ASYNC : MODE_SYNC;

        if (!receipt.duplicate() || request.getStatus() == ValidationStatus.RECEIVED) {
            if (receipt.duplicate()) {
                log.info("Change {} redelivered while still RECEIVED, handing it on again", request.getChangeNumber());
            }
            if (properties.asyncEnabled()) {
                eventPublisher.publishEvent(new ValidationRequestedEvent(request.getChangeId(), request.getChangeNumber()));
            } else {
                processInline(request);
            }
        }
        return new Intake(request, receipt.duplicate(), mode);
    }

    private void processInline(ValidationRequest request) {
        try {
            orchestrator.process(request.getChangeId());
        } catch (ChangeGuardException e) {
            log.error("Inline validation of change {} failed: {}", request.getChangeNumber(), e.getMessage());
        }
    }
}
