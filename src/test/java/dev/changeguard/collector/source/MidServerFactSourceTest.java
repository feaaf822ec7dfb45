package dev.changeguard.collector.source;

import dev.changeguard.domain.valueobject.facts.MidServerFacts;
import dev.changeguard.infrastructure.servicenow.TicketClient;
import dev.changeguard.infrastructure.servicenow.TicketRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MidServerFactSourceTest {

    private final TicketClient ticketClient = mock(TicketClient.class);
    private final MidServerFactSource source = new MidServerFactSource(ticketClient);

    @Test
    @DisplayName("reads status, capabilities and check-in time")
    void fetch() {
        when(ticketClient.getRecord(eq("ecc_agent"), eq("mid-1"), anyList()))
                .thenReturn(Optional.of(TicketRecord.of(Map.of("sys_id", "mid-1", "name", "mid-east",
                        "status", "Up", "capabilities", "ALL, ldap", "last_check_in", "2026-03-01 09:00:00"))));

        MidServerFacts facts = source.fetch("mid-1").orElseThrow();

        assertThat(facts.capabilities()).containsExactly("ALL", "ldap");
        assertThat(facts.lastCheckIn()).isEqualTo(Instant.parse("2026-03-01T09:00:00Z"));
        assertThat(source.deriveChecks(facts)).containsEntry("is_up", true).containsEntry("has_capabilities", true);
    }

    @Test
    @DisplayName("an agent silent for more than a day is not recently checked in")
    void staleCheckIn() {
        MidServerFacts stale = new MidServerFacts("mid-1", "mid-east", "up", "1.0", List.of("ALL"),
                Instant.now().minus(Duration.ofDays(2)));
        MidServerFacts fresh = new MidServerFacts("mid-1", "mid-east", "down", "1.0", List.of(),
                Instant.now().minus(Duration.ofHours(2)));

        assertThat(source.deriveChecks(stale)).containsEntry("recently_checked_in", false);
        assertThat(source.deriveChecks(fresh)).containsEntry("recently_checked_in", true)
                .containsEntry("is_up", false)
                .containsEntry("has_capabilities", false);
    }
}
