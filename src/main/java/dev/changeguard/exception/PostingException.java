package dev.changeguard.exception;

/** Writing the verdict back to the change record failed. Logged, never fatal. */
public class PostingException extends ChangeGuardException {

    public PostingException(String message, Throwable cause) {
        super(message, cause);
    }
}
