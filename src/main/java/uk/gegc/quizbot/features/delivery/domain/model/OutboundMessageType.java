package uk.gegc.quizbot.features.delivery.domain.model;

public enum OutboundMessageType {
    SIMPLE,
    WITH_BUTTONS,
    REPLY
}
