package uk.gegc.quizbot.shared.exception;

/**
 * Thrown when a referenced message handle, record or person does not exist
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
