package dev.changeguard.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.changeguard.dto.request.ChangeWebhookPayload;
import dev.changeguard.exception.WebhookAuthenticationException;
import dev.changeguard.infrastructure.servicenow.WebhookAuthenticator;
import dev.changeguard.service.ValidationIntakeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * ServiceNow change webhook receiver. Authenticates against the raw body, records the change
 * and returns 202 Accepted; validation itself runs on the queue unless async mode is off.
 */
@RestController
@RequestMapping("/webhooks")
public class ChangeWebhookController {
    private static final Logger log = LoggerFactory.getLogger(ChangeWebhookController.class);
    private final WebhookAuthenticator authenticator;
    private final ValidationIntakeService intakeService;
    private final ObjectMapper objectMapper;

    public ChangeWebhookController(WebhookAuthenticator authenticator,
                                   ValidationIntakeService intakeService,
                                   ObjectMapper objectMapper) {
        this.authenticator = authenticator;
        this.intakeService = intakeService;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/servicenow/change")
    public ResponseEntity<Map<String, Object>> handleChangeWebhook(
            @RequestHeader(value = "x-api-key", required = false) String apiKey,
            @RequestHeader(value = "x-functions-key", required = false) String functionsKey,
            @RequestHeader(value = "x-servicenow-signature", required = false) String serviceNowSignature,
            @RequestHeader(value = "signature", required = false) String signature,
            @RequestParam(value = "code", required = false) String code,
            @RequestBody(required = false) String rawBody) {

        if (!intakeService.isEnabled()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("status", "disabled", "reason", "change validation is disabled"));
        }

        String body = rawBody == null ? "" : rawBody;
        String presentedSignature = serviceNowSignature != null ? serviceNowSignature : signature;
        WebhookAuthenticator.AuthResult auth = authenticator.authenticate(body.getBytes(StandardCharsets.UTF_8),
                new WebhookAuthenticator.Credentials(apiKey != null ? apiKey : functionsKey, code, presentedSignature));
        if (!auth.authenticated()) {
            throw new WebhookAuthenticationException("missing or invalid webhook credentials");
        }

        ChangeWebhookPayload payload;
        try {
            payload = objectMapper.readValue(body, ChangeWebhookPayload.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable change webhook body: {}", e.getOriginalMessage());
            return invalidPayload();
        }
        if (payload == null) {
            log.warn("Change webhook body is a JSON null");
            return invalidPayload();
        }

        log.info("Change webhook: change={}, component={}, auth={}",
                payload.changeNumber(), payload.componentType(), auth.method());

        ValidationIntakeService.Intake intake = intakeService.accept(payload, body, presentedSignature);

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "status", "accepted",
                "change_number", intake.request().getChangeNumber(),
                "change_sys_id", intake.request().getChangeId(),
                "request_id", intake.request().getId().toString(),
                "processing_mode", intake.processingMode()));
    }

    private static ResponseEntity<Map<String, Object>> invalidPayload() {
        return ResponseEntity.badRequest().body(Map.of("status", "error", "reason", "invalid JSON payload"));
    }
}
