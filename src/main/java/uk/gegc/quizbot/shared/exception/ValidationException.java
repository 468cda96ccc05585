package uk.gegc.quizbot.shared.exception;

/**
 * Thrown when an inbound event or answer does not have the expected shape
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
