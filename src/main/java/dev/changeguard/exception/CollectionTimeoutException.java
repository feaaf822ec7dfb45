package dev.changeguard.exception;

import java.time.Duration;

/** A fact fetch ran past its budget. Absorbed by the collector as a collection error. */
public class CollectionTimeoutException extends ChangeGuardException {

    public CollectionTimeoutException(String what, Duration budget) {
        super("%s timed out after %d ms".formatted(what, budget.toMillis()));
    }

    private CollectionTimeoutException(String message) {
        super(message);
    }

    /** The fetch was still running when the attempt's overall deadline passed. */
    public static CollectionTimeoutException atDeadline(String what) {
        return new CollectionTimeoutException(what + " abandoned at collection deadline");
    }
}
