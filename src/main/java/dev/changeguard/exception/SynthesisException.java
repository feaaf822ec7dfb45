package dev.changeguard.exception;

/** The language model could not produce a usable verdict. Triggers the rules fallback. */
public class SynthesisException extends ChangeGuardException {

    public SynthesisException(String message) {
        super(message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
