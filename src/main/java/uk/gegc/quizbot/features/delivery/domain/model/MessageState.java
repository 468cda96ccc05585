package uk.gegc.quizbot.features.delivery.domain.model;

/**
 * {@code CREATED -> SENT -> (ACK_RECEIVED | REPLY_RECEIVED)}.
 */
public enum MessageState {
    CREATED,
    SENT,
    ACK_RECEIVED,
    REPLY_RECEIVED
}
