package dev.changeguard.collector.source;

import dev.changeguard.domain.valueobject.facts.LdapServerFacts;
import dev.changeguard.infrastructure.servicenow.TicketClient;
import dev.changeguard.infrastructure.servicenow.TicketRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LdapServerFactSourceTest {

    private final TicketClient ticketClient = mock(TicketClient.class);
    private final LdapServerFactSource source = new LdapServerFactSource(ticketClient);

    @Test
    @DisplayName("reads listener, MID server reference and the URL list")
    void fetch() {
        when(ticketClient.getRecord(eq("cmdb_ci_ldap_server"), eq("ldap-1"), anyList()))
                .thenReturn(Optional.of(TicketRecord.of(Map.of("sys_id", "ldap-1", "name", "corp-ldap",
                        "listener_enabled", true,
                        "mid_server", Map.of("value", "mid-1", "display_value", "mid-east"),
                        "urls", "ldaps://dc1.corp:636, ldaps://dc2.corp:636",
                        "paging_enabled", "false"))));

        LdapServerFacts facts = source.fetch("ldap-1").orElseThrow();

        assertThat(facts.midServer()).isEqualTo("mid-east");
        assertThat(facts.urls()).containsExactly("ldaps://dc1.corp:636", "ldaps://dc2.corp:636");
        assertThat(facts.pagingEnabled()).isFalse();
        assertThat(source.deriveChecks(facts)).containsExactly(
                Map.entry("has_listener_enabled", true),
                Map.entry("has_mid_server", true),
                Map.entry("has_urls", true));
    }

    @Test
    @DisplayName("a server without listener, MID server or URLs fails every check")
    void unconfigured() {
        when(ticketClient.getRecord(eq("cmdb_ci_ldap_server"), eq("ldap-2"), anyList()))
                .thenReturn(Optional.of(TicketRecord.of(Map.of("sys_id", "ldap-2", "name", "lab-ldap",
                        "listener_enabled", "false", "mid_server", "", "urls", " , "))));

        LdapServerFacts facts = source.fetch("ldap-2").orElseThrow();

        assertThat(facts.urls()).isEmpty();
        assertThat(source.deriveChecks(facts)).containsOnly(
                Map.entry("has_listener_enabled", false),
                Map.entry("has_mid_server", false),
                Map.entry("has_urls", false));
    }

    @Test
    @DisplayName("check names match the derived checks")
    void checkNames() {
        LdapServerFacts facts = new LdapServerFacts("ldap-3", "x", true, "mid", List.of("ldap://x"), true);

        assertThat(source.deriveChecks(facts).keySet()).containsExactlyElementsOf(source.checkNames());
    }
}
