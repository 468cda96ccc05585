package uk.gegc.quizbot.shared.exception;

/**
 * Thrown when a record is asked to move to a state it cannot reach from its current one
 */
public class RecordStateException extends RuntimeException {

    public RecordStateException(String message) {
        super(message);
    }

    public RecordStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
