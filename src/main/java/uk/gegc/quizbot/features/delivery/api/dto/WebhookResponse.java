package uk.gegc.quizbot.features.delivery.api.dto;

public record WebhookResponse(String status) {

    public static WebhookResponse handled() {
        return new WebhookResponse("handled");
    }
}
