package dev.changeguard.collector.source;

import dev.changeguard.domain.valueobject.facts.ComponentTypes;
import dev.changeguard.domain.valueobject.facts.LdapServerFacts;
import dev.changeguard.infrastructure.servicenow.TicketClient;
import dev.changeguard.infrastructure.servicenow.TicketRecord;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class LdapServerFactSource extends TableFactSource<LdapServerFacts> {

    public LdapServerFactSource(TicketClient ticketClient) {
        super(ticketClient, "cmdb_ci_ldap_server",
                List.of("sys_id", "name", "listener_enabled", "mid_server", "urls", "paging_enabled"));
    }

    @Override
    public String componentType() {
        return ComponentTypes.LDAP_SERVER;
    }

    @Override
    public List<String> checkNames() {
        return List.of("has_listener_enabled", "has_mid_server", "has_urls");
    }

    @Override
    protected LdapServerFacts toFacts(TicketRecord r) {
        return new LdapServerFacts(r.text("sys_id"), r.text("name"), r.flag("listener_enabled"),
                r.text("mid_server"), r.list("urls"), r.flag("paging_enabled"));
    }

    @Override
    public Map<String, Boolean> deriveChecks(LdapServerFacts facts) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put("has_listener_enabled", facts.listenerEnabled());
        checks.put("has_mid_server", facts.midServer() != null);
        checks.put("has_urls", !facts.urls().isEmpty());
        return checks;
    }
}
