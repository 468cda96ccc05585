package uk.gegc.quizbot.shared.exception;

import lombok.Getter;

/**
 * Thrown when the chat gateway rejects a message, cannot be reached, or answers with a body
 * that does not carry a usable message handle.
 */
@Getter
public class GatewayException extends RuntimeException {

    /**
     * HTTP status returned by the gateway, or {@code null} when no response was received.
     */
    private final Integer statusCode;

    public GatewayException(String message) {
        this(message, null, null);
    }

    public GatewayException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public GatewayException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
