package dev.changeguard.infrastructure.aws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.changeguard.domain.event.ValidationRequestedEvent;
import dev.changeguard.dto.request.ValidationTaskMessage;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Bridges {@link ValidationRequestedEvent} to the validation queue.
 *
 * <p>A plain {@code @EventListener}: the request row is already committed by the store
 * before the event is published. If the send fails the exception reaches the webhook
 * caller, which redelivers; the duplicate receipt then finds the row still RECEIVED.
 */
@Component
@Profile("!local")
public class ValidationTaskPublisher {

    private static final Logger log = LoggerFactory.getLogger(ValidationTaskPublisher.class);

    private final SqsTemplate sqsTemplate;
    private final ObjectMapper objectMapper;
    private final String queueName;

    public ValidationTaskPublisher(SqsTemplate sqsTemplate, ObjectMapper objectMapper,
                                   @Value("${changeguard.sqs.validation-queue}") String queueName) {
        this.sqsTemplate = sqsTemplate;
        this.objectMapper = objectMapper;
        this.queueName = queueName;
    }

    @EventListener
    public void onValidationRequested(ValidationRequestedEvent event) {
        log.info("Queueing validation of change {} ({})", event.changeNumber(), event.changeId());
        sqsTemplate.send(queueName, toJson(new ValidationTaskMessage(event.changeId(), event.changeNumber())));
        log.debug("Validation task published to queue: {}", queueName);
    }

    private String toJson(ValidationTaskMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize validation task for " + message.changeId(), e);
        }
    }
}
