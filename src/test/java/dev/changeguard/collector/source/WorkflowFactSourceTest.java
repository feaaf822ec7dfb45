package dev.changeguard.collector.source;

import dev.changeguard.domain.valueobject.facts.WorkflowFacts;
import dev.changeguard.infrastructure.servicenow.TicketClient;
import dev.changeguard.infrastructure.servicenow.TicketRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WorkflowFactSourceTest {

    private final TicketClient ticketClient = mock(TicketClient.class);
    private final WorkflowFactSource source = new WorkflowFactSource(ticketClient);

    @Test
    @DisplayName("a published, checked-in, scoped workflow passes every check")
    void published() {
        when(ticketClient.getRecord(eq("wf_workflow"), eq("wf-1"), anyList()))
                .thenReturn(Optional.of(TicketRecord.of(Map.of("sys_id", "wf-1", "name", "Laptop fulfilment",
                        "published", "true", "checked_out", "false",
                        "scoped_app", Map.of("value", "app-1", "display_value", "Hardware Requests")))));

        WorkflowFacts facts = source.fetch("wf-1").orElseThrow();

        assertThat(facts.scope()).isEqualTo("Hardware Requests");
        assertThat(source.deriveChecks(facts)).containsExactly(
                Map.entry("is_published", true),
                Map.entry("not_checked_out", true),
                Map.entry("has_scope", true));
    }

    @Test
    @DisplayName("a draft that is checked out and unscoped fails every check")
    void draft() {
        when(ticketClient.getRecord(eq("wf_workflow"), eq("wf-2"), anyList()))
                .thenReturn(Optional.of(TicketRecord.of(Map.of("sys_id", "wf-2", "name", "Draft",
                        "published", "false", "checked_out", "1"))));

        WorkflowFacts facts = source.fetch("wf-2").orElseThrow();

        assertThat(facts.checkedOut()).isTrue();
        assertThat(source.deriveChecks(facts)).containsOnly(
                Map.entry("is_published", false),
                Map.entry("not_checked_out", false),
                Map.entry("has_scope", false));
    }
}
