package dev.changeguard.exception;

/** Persistence kept failing after retries were exhausted. */
public class StoreUnavailableException extends ChangeGuardException {

    public StoreUnavailableException(String operation, Throwable cause) {
        super("Validation store unavailable during " + operation, cause);
    }
}
