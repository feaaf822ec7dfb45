package dev.changeguard.infrastructure.aws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.changeguard.dto.request.ValidationTaskMessage;
import dev.changeguard.exception.ValidationNotFoundException;
import dev.changeguard.orchestrator.ValidationOrchestrator;
import io.awspring.cloud.sqs.annotation.SqsListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * SQS consumer for validation tasks.
 *
 * <pre>
 * Webhook -> ValidationIntakeService -> ApplicationEvent -> Publisher -> [SQS] -> THIS -> Orchestrator
 * </pre>
 *
 * <p>An exception thrown from {@link #onValidationTask} leaves the message unacknowledged, so SQS
 * redelivers it after the visibility timeout and moves it to the DLQ after {@code maxReceiveCount}.
 * There is no retry loop here. Messages that can never succeed (unparseable, unknown change)
 * are logged and acknowledged.
 */
@Component
@Profile("!local")
public class ValidationTaskListener {

    private static final Logger log = LoggerFactory.getLogger(ValidationTaskListener.class);

    private final ValidationOrchestrator orchestrator;
    private final ObjectMapper objectMapper;

    public ValidationTaskListener(ValidationOrchestrator orchestrator, ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
    }

    @SqsListener(value = "${changeguard.sqs.validation-queue}", maxConcurrentMessages = "5", maxMessagesPerPoll = "5")
    public void onValidationTask(String message) {
        ValidationTaskMessage task;
        try {
            task = objectMapper.readValue(message, ValidationTaskMessage.class);
        } catch (JsonProcessingException e) {
            log.error("Unreadable validation task on queue: {}", message);
            return;
        }
        if (task == null || !task.isValid()) {
            log.error("Validation task without change id: {}", message);
            return;
        }

        log.info("Processing validation task from SQS: change {} ({})", task.changeNumber(), task.changeId());
        try {
            orchestrator.process(task.changeId());
        } catch (ValidationNotFoundException e) {
            log.error("Dropping task for unknown change {}", task.changeId());
        }
    }
}
