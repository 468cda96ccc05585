package uk.gegc.quizbot.features.delivery.api.dto;

public enum WebhookEventType {
    FEEDBACK,
    SESSION
}
