package dev.changeguard.domain.event;

/** Published once a new validation request has been stored and should be processed off-thread. */
public record ValidationRequestedEvent(String changeId, String changeNumber) {
}
