package uk.gegc.quizbot.features.delivery.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;

/**
 * Event posted by the gateway: either an answer to a message or a change of a person's session.
 * A {@code FEEDBACK} event may also carry the session it arrived in.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookEvent(
        @NotNull(message = "Event type is required") WebhookEventType type,
        SessionPayload session,
        FeedbackPayload feedback
) {
}
