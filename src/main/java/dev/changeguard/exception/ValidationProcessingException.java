package dev.changeguard.exception;

/**
 * A processing attempt failed before a verdict existed. The request has been marked FAILED
 * and the invoking worker decides whether to retry.
 */
public class ValidationProcessingException extends ChangeGuardException {

    private final String changeId;

    public ValidationProcessingException(String changeId, Throwable cause) {
        super("Validation of change %s failed: %s".formatted(changeId, cause.getMessage()), cause);
        this.changeId = changeId;
    }

    public String getChangeId() {
        return changeId;
    }
}
