package dev.changeguard.exception;

/** Base type for every failure the validation pipeline reports by name. */
public abstract class ChangeGuardException extends RuntimeException {

    protected ChangeGuardException(String message) {
        super(message);
    }

    protected ChangeGuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
