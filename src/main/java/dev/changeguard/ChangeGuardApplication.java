package dev.changeguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * ChangeGuard: automated validation of ServiceNow change requests.
 *
 * <p>Architecture overview:
 * <pre>
 * ServiceNow Webhook → ChangeWebhookController → ValidationStore (RECEIVED)
 *   → SQS (or inline) → ValidationTaskListener → ValidationOrchestrator
 *   → FactCollector → Synthesizer (model, rules fallback)
 *   → ValidationStore (COMPLETED | FAILED) → work note on the change record
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>Webhooks return 202 as soon as the request is recorded</li>
 *   <li>Every external fetch runs under its own timeout inside an overall deadline</li>
 *   <li>Unretrievable facts become failing checks, never passing ones</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ChangeGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChangeGuardApplication.class, args);
    }
}
