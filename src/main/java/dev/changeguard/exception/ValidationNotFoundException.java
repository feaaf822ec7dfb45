package dev.changeguard.exception;

public class ValidationNotFoundException extends ChangeGuardException {

    public ValidationNotFoundException(String changeId) {
        super("No validation request for change " + changeId);
    }
}
