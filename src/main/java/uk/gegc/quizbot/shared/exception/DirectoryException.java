package uk.gegc.quizbot.shared.exception;

/**
 * Thrown when the people directory cannot be queried
 */
public class DirectoryException extends RuntimeException {

    public DirectoryException(String message) {
        super(message);
    }

    public DirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
