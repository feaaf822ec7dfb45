package dev.changeguard.collector.source;

import dev.changeguard.domain.valueobject.facts.ComponentTypes;
import dev.changeguard.domain.valueobject.facts.MidServerFacts;
import dev.changeguard.infrastructure.servicenow.TicketClient;
import dev.changeguard.infrastructure.servicenow.TicketRecord;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MID Server agents. An agent counts as recently checked in when its last check-in
 * is less than a day old.
 */
@Component
public class MidServerFactSource extends TableFactSource<MidServerFacts> {

    static final Duration CHECK_IN_WINDOW = Duration.ofDays(1);

    public MidServerFactSource(TicketClient ticketClient) {
        super(ticketClient, "ecc_agent",
                List.of("sys_id", "name", "status", "capabilities", "last_check_in", "version"));
    }

    @Override
    public String componentType() {
        return ComponentTypes.MID_SERVER;
    }

    @Override
    public List<String> checkNames() {
        return List.of("is_up", "has_capabilities", "recently_checked_in");
    }

    @Override
    protected MidServerFacts toFacts(TicketRecord r) {
        return new MidServerFacts(r.text("sys_id"), r.text("name"), r.text("status"), r.text("version"),
                r.list("capabilities"), r.instant("last_check_in").orElse(null));
    }

    @Override
    public Map<String, Boolean> deriveChecks(MidServerFacts facts) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put("is_up", "up".equalsIgnoreCase(facts.status()));
        checks.put("has_capabilities", !facts.capabilities().isEmpty());
        checks.put("recently_checked_in", facts.lastCheckIn() != null
                && facts.lastCheckIn().isAfter(Instant.now().minus(CHECK_IN_WINDOW)));
        return checks;
    }
}
