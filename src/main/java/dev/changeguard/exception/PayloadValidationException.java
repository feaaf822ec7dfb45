package dev.changeguard.exception;

import java.util.List;

/** Inbound webhook payload is missing required fields. Not retryable. */
public class PayloadValidationException extends ChangeGuardException {

    private final List<String> missingFields;

    public PayloadValidationException(List<String> missingFields) {
        super("Missing required fields: " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
