package dev.changeguard.collector.source;

import dev.changeguard.domain.valueobject.facts.CmdbCiFacts;
import dev.changeguard.infrastructure.servicenow.TicketClient;
import dev.changeguard.infrastructure.servicenow.TicketRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CmdbCiFactSourceTest {

    private final TicketClient ticketClient = mock(TicketClient.class);
    private final CmdbCiFactSource source = new CmdbCiFactSource(ticketClient);

    private void ci(String installStatus) {
        when(ticketClient.getRecord(eq("cmdb_ci"), eq("ci-1"), anyList()))
                .thenReturn(Optional.of(TicketRecord.of(Map.of("sys_id", "ci-1", "name", "db01",
                        "owned_by", "ops", "environment", "production", "install_status", installStatus))));
    }

    @Test
    @DisplayName("attaches first-degree relationships")
    void relationships() {
        ci("1");
        when(ticketClient.queryRecords(eq("cmdb_rel_ci"), eq("parent=ci-1^ORchild=ci-1"), anyList(), eq(10)))
                .thenReturn(List.of(TicketRecord.of(Map.of("type", "Depends on::Used by",
                        "parent", "app-1", "child", "ci-1"))));

        CmdbCiFacts facts = source.fetch("ci-1").orElseThrow();

        assertThat(facts.relationships()).containsExactly(
                new CmdbCiFacts.Relationship("Depends on::Used by", "app-1", "ci-1"));
        assertThat(source.deriveChecks(facts).values()).containsOnly(true);
    }

    @Test
    @DisplayName("unreadable relationships still return the CI")
    void relationshipsBestEffort() {
        ci("retired");
        when(ticketClient.queryRecords(eq("cmdb_rel_ci"), eq("parent=ci-1^ORchild=ci-1"), anyList(), anyInt()))
                .thenThrow(new IllegalStateException("403"));

        CmdbCiFacts facts = source.fetch("ci-1").orElseThrow();

        assertThat(facts.relationships()).isEmpty();
        assertThat(source.deriveChecks(facts)).containsEntry("is_operational", false)
                .containsEntry("has_owner", true);
    }
}
