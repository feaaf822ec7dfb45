package dev.changeguard.exception;

/** A validation request already exists for this change id. */
public class DuplicateValidationException extends ChangeGuardException {

    private final String changeId;

    public DuplicateValidationException(String changeId, Throwable cause) {
        super("Validation request already exists for change " + changeId, cause);
        this.changeId = changeId;
    }

    public String getChangeId() {
        return changeId;
    }
}
