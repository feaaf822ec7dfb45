package dev.changeguard.collector.source;

import dev.changeguard.domain.valueobject.facts.ComponentTypes;
import dev.changeguard.domain.valueobject.facts.WorkflowFacts;
import dev.changeguard.infrastructure.servicenow.TicketClient;
import dev.changeguard.infrastructure.servicenow.TicketRecord;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class WorkflowFactSource extends TableFactSource<WorkflowFacts> {

    public WorkflowFactSource(TicketClient ticketClient) {
        super(ticketClient, "wf_workflow",
                List.of("sys_id", "name", "published", "checked_out", "scoped_app", "description"));
    }

    @Override
    public String componentType() {
        return ComponentTypes.WORKFLOW;
    }

    @Override
    public List<String> checkNames() {
        return List.of("is_published", "not_checked_out", "has_scope");
    }

    @Override
    protected WorkflowFacts toFacts(TicketRecord r) {
        return new WorkflowFacts(r.text("sys_id"), r.text("name"), r.flag("published"),
                r.flag("checked_out"), r.text("scoped_app"), r.text("description"));
    }

    @Override
    public Map<String, Boolean> deriveChecks(WorkflowFacts facts) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put("is_published", facts.published());
        checks.put("not_checked_out", !facts.checkedOut());
        checks.put("has_scope", facts.scope() != null);
        return checks;
    }
}
