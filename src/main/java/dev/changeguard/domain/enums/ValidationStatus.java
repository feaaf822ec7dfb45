package dev.changeguard.domain.enums;

/**
 * Lifecycle: RECEIVED → PROCESSING → COMPLETED | FAILED.
 * A FAILED request may re-enter PROCESSING on a fresh processing attempt.
 */
public enum ValidationStatus {
    RECEIVED, PROCESSING, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
