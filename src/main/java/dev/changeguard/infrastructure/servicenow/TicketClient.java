package dev.changeguard.infrastructure.servicenow;

import java.util.List;
import java.util.Optional;

/**
 * Narrow view of the ticketing platform: read a record, query a table, append a work note.
 */
public interface TicketClient {

    /** Empty when the record does not exist. Transport failures propagate. */
    Optional<TicketRecord> getRecord(String table, String id, List<String> fields);

    List<TicketRecord> queryRecords(String table, String query, List<String> fields, int limit);

    /** @throws dev.changeguard.exception.PostingException if the note could not be written */
    void postNote(String changeId, String text);
}
