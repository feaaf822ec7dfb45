package dev.changeguard.collector.source;

import dev.changeguard.domain.valueobject.facts.ChangeTemplateFacts;
import dev.changeguard.domain.valueobject.facts.ComponentTypes;
import dev.changeguard.infrastructure.servicenow.TicketClient;
import dev.changeguard.infrastructure.servicenow.TicketRecord;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Standard change templates. The component id is the producer version; activity, workflow
 * and publication come from the record producer it points at.
 */
@Component
public class ChangeTemplateFactSource implements ComponentFactSource<ChangeTemplateFacts> {

    static final Duration UPDATE_WINDOW = Duration.ofDays(120);
    static final double SUCCESS_RATE_THRESHOLD = 95.0;

    private static final List<String> VERSION_FIELDS = List.of("sys_id", "name", "sys_updated_on",
            "percent_successful", "closed_change_count", "std_change_producer");
    private static final List<String> PRODUCER_FIELDS = List.of("sys_id", "name", "active", "workflow",
            "published_ref", "sys_updated_on");

    private final TicketClient ticketClient;

    public ChangeTemplateFactSource(TicketClient ticketClient) {
        this.ticketClient = ticketClient;
    }

    @Override
    public String componentType() {
        return ComponentTypes.STD_CHANGE_TEMPLATE;
    }

    @Override
    public List<String> checkNames() {
        return List.of("is_active", "is_published", "has_workflow", "recently_updated", "success_rate_above_95");
    }

    @Override
    public Optional<ChangeTemplateFacts> fetch(String versionId) {
        return ticketClient.getRecord("std_change_producer_version", versionId, VERSION_FIELDS)
                .map(version -> {
                    String producerId = version.text("std_change_producer");
                    Optional<TicketRecord> producer = producerId == null ? Optional.empty()
                            : ticketClient.getRecord("std_change_record_producer", producerId, PRODUCER_FIELDS);
                    return toFacts(version, producer.orElse(TicketRecord.of(Map.of())));
                });
    }

    private ChangeTemplateFacts toFacts(TicketRecord version, TicketRecord producer) {
        Instant lastUpdated = version.instant("sys_updated_on")
                .or(() -> producer.instant("sys_updated_on"))
                .orElse(null);
        return new ChangeTemplateFacts(
                version.text("sys_id"),
                version.text("name") != null ? version.text("name") : producer.text("name"),
                producer.text("sys_id"),
                producer.flag("active"),
                producer.has("published_ref"),
                producer.text("workflow"),
                lastUpdated,
                version.number("percent_successful").orElse(null),
                version.number("closed_change_count").map(Double::intValue).orElse(null));
    }

    @Override
    public Map<String, Boolean> deriveChecks(ChangeTemplateFacts facts) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put("is_active", facts.active());
        checks.put("is_published", facts.published());
        checks.put("has_workflow", facts.workflow() != null);
        checks.put("recently_updated", facts.lastUpdated() != null
                && facts.lastUpdated().isAfter(Instant.now().minus(UPDATE_WINDOW)));
        checks.put("success_rate_above_95", facts.successRate() != null
                && facts.successRate() >= SUCCESS_RATE_THRESHOLD);
        return checks;
    }
}
