package dev.changeguard.collector.source;

import dev.changeguard.domain.valueobject.facts.ComponentFacts;
import dev.changeguard.infrastructure.servicenow.TicketClient;
import dev.changeguard.infrastructure.servicenow.TicketRecord;

import java.util.List;
import java.util.Optional;

/**
 * Base for sources backed by a single platform table row.
 */
public abstract class TableFactSource<F extends ComponentFacts> implements ComponentFactSource<F> {

    protected final TicketClient ticketClient;
    private final String table;
    private final List<String> fields;

    protected TableFactSource(TicketClient ticketClient, String table, List<String> fields) {
        this.ticketClient = ticketClient;
        this.table = table;
        this.fields = List.copyOf(fields);
    }

    @Override
    public Optional<F> fetch(String componentId) {
        return ticketClient.getRecord(table, componentId, fields).map(this::toFacts);
    }

    protected abstract F toFacts(TicketRecord record);
}
