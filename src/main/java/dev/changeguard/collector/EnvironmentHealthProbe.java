package dev.changeguard.collector;

import dev.changeguard.config.ValidationProperties;
import dev.changeguard.domain.enums.CloneFreshnessStatus;
import dev.changeguard.domain.valueobject.ChangeSnapshot;
import dev.changeguard.domain.valueobject.EnvironmentHealth;
import dev.changeguard.domain.valueobject.facts.ComponentTypes;
import dev.changeguard.infrastructure.servicenow.TicketClient;
import dev.changeguard.infrastructure.servicenow.TicketRecord;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Checks that the test instance was cloned from production recently enough to make a
 * platform update rehearsal meaningful. Only platform update templates are probed.
 */
@Component
public class EnvironmentHealthProbe {

    static final String PLATFORM_UPDATE_MARKER = "servicenow platform update";
    private static final String CLONE_TABLE = "clone_instance";
    private static final List<String> CLONE_FIELDS =
            List.of("sys_id", "target_instance", "source_instance", "state", "completed");

    private final TicketClient ticketClient;
    private final ValidationProperties properties;

    public EnvironmentHealthProbe(TicketClient ticketClient, ValidationProperties properties) {
        this.ticketClient = ticketClient;
        this.properties = properties;
    }

    public boolean applies(ChangeSnapshot change) {
        return ComponentTypes.STD_CHANGE_TEMPLATE.equals(change.componentType())
                && change.templateName() != null
                && change.templateName().toLowerCase(Locale.ROOT).contains(PLATFORM_UPDATE_MARKER);
    }

    public EnvironmentHealth skipped() {
        return EnvironmentHealth.skipped(properties.cloneTargetInstance(), properties.cloneSourceInstance(),
                "Clone freshness is only checked for platform update templates");
    }

    public EnvironmentHealth failed(String message) {
        return EnvironmentHealth.unavailable(CloneFreshnessStatus.ERROR,
                properties.cloneTargetInstance(), properties.cloneSourceInstance(), message);
    }

    /** @throws RuntimeException when the clone table cannot be queried */
    public EnvironmentHealth probe(ChangeSnapshot change) {
        if (!applies(change)) return skipped();
        String target = properties.cloneTargetInstance();
        String source = properties.cloneSourceInstance();
        if (!properties.cloneCheckConfigured()) {
            return failed("Clone source and target instances are not configured");
        }

        String query = "target_instance.instance_name=%s^source_instance.instance_name=%s^state=Completed^ORDERBYDESCcompleted"
                .formatted(target, source);
        List<TicketRecord> clones = ticketClient.queryRecords(CLONE_TABLE, query, CLONE_FIELDS, 1);
        if (clones.isEmpty()) {
            return EnvironmentHealth.unavailable(CloneFreshnessStatus.NOT_FOUND, target, source,
                    "No completed clone from %s to %s".formatted(source, target));
        }

        TicketRecord clone = clones.get(0);
        Optional<Instant> completed = clone.instant("completed");
        if (completed.isEmpty()) {
            return failed("Latest clone record has no completion date");
        }
        long ageDays = Duration.between(completed.get(), Instant.now()).toDays();
        boolean fresh = ageDays <= properties.cloneMaxAge().toDays();
        return new EnvironmentHealth(fresh ? CloneFreshnessStatus.OK : CloneFreshnessStatus.STALE,
                target, source, clone.text("completed"), ageDays, fresh,
                fresh ? null : "Last clone is %d days old (limit %d)".formatted(ageDays, properties.cloneMaxAge().toDays()));
    }
}
