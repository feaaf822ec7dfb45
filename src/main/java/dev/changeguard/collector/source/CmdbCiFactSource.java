package dev.changeguard.collector.source;

import dev.changeguard.domain.valueobject.facts.CmdbCiFacts;
import dev.changeguard.domain.valueobject.facts.ComponentTypes;
import dev.changeguard.infrastructure.servicenow.TicketClient;
import dev.changeguard.infrastructure.servicenow.TicketRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration items plus up to ten first-degree relationships. Relationships are
 * supplementary: if they cannot be read the CI facts are still returned.
 */
@Component
public class CmdbCiFactSource extends TableFactSource<CmdbCiFacts> {

    private static final Logger log = LoggerFactory.getLogger(CmdbCiFactSource.class);
    private static final int RELATIONSHIP_LIMIT = 10;
    private static final Set<String> RETIRED_STATES = Set.of("retired", "retiring", "7");

    public CmdbCiFactSource(TicketClient ticketClient) {
        super(ticketClient, "cmdb_ci", List.of("sys_id", "name", "sys_class_name", "owned_by", "environment",
                "operational_status", "install_status", "business_criticality"));
    }

    @Override
    public String componentType() {
        return ComponentTypes.CMDB_CI;
    }

    @Override
    public List<String> checkNames() {
        return List.of("has_owner", "has_environment", "is_operational");
    }

    @Override
    public Optional<CmdbCiFacts> fetch(String componentId) {
        return super.fetch(componentId).map(ci -> withRelationships(ci, componentId));
    }

    @Override
    protected CmdbCiFacts toFacts(TicketRecord r) {
        return new CmdbCiFacts(r.text("sys_id"), r.text("name"), r.text("sys_class_name"), r.text("owned_by"),
                r.text("environment"), r.text("operational_status"), r.text("install_status"),
                r.text("business_criticality"), List.of());
    }

    @Override
    public Map<String, Boolean> deriveChecks(CmdbCiFacts facts) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put("has_owner", facts.owner() != null);
        checks.put("has_environment", facts.environment() != null);
        String status = facts.installStatus() == null ? "" : facts.installStatus().toLowerCase();
        checks.put("is_operational", !RETIRED_STATES.contains(status));
        return checks;
    }

    private CmdbCiFacts withRelationships(CmdbCiFacts ci, String ciId) {
        try {
            List<CmdbCiFacts.Relationship> relationships = ticketClient.queryRecords("cmdb_rel_ci",
                            "parent=%s^ORchild=%s".formatted(ciId, ciId),
                            List.of("type", "parent", "child"), RELATIONSHIP_LIMIT).stream()
                    .map(r -> new CmdbCiFacts.Relationship(r.text("type"), r.text("parent"), r.text("child")))
                    .toList();
            return new CmdbCiFacts(ci.sysId(), ci.name(), ci.className(), ci.owner(), ci.environment(),
                    ci.operationalStatus(), ci.installStatus(), ci.businessCriticality(), relationships);
        } catch (RuntimeException e) {
            log.warn("Could not read relationships of CI {}: {}", ciId, e.getMessage());
            return ci;
        }
    }
}
