package dev.changeguard.collector.source;

import dev.changeguard.domain.valueobject.facts.CatalogItemFacts;
import dev.changeguard.domain.valueobject.facts.ComponentTypes;
import dev.changeguard.infrastructure.servicenow.TicketClient;
import dev.changeguard.infrastructure.servicenow.TicketRecord;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class CatalogItemFactSource extends TableFactSource<CatalogItemFacts> {

    public CatalogItemFactSource(TicketClient ticketClient) {
        super(ticketClient, "sc_cat_item",
                List.of("sys_id", "name", "short_description", "category", "workflow", "owner", "active", "sys_updated_on"));
    }

    @Override
    public String componentType() {
        return ComponentTypes.CATALOG_ITEM;
    }

    @Override
    public List<String> checkNames() {
        return List.of("has_name", "has_category", "has_workflow", "is_active");
    }

    @Override
    protected CatalogItemFacts toFacts(TicketRecord r) {
        return new CatalogItemFacts(r.text("sys_id"), r.text("name"), r.text("short_description"),
                r.text("category"), r.text("workflow"), r.text("owner"), r.flag("active"),
                r.text("sys_updated_on"));
    }

    @Override
    public Map<String, Boolean> deriveChecks(CatalogItemFacts facts) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put("has_name", facts.name() != null);
        checks.put("has_category", facts.category() != null);
        checks.put("has_workflow", facts.workflow() != null);
        checks.put("is_active", facts.active());
        return checks;
    }
}
