package uk.gegc.quizbot.features.delivery.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import uk.gegc.quizbot.features.delivery.domain.model.AnswerType;
import uk.gegc.quizbot.features.delivery.domain.model.InboundAnswer;

/**
 * A person's reply to a message, identified by the handle the gateway assigned when it was sent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FeedbackPayload(
        @JsonProperty("message_id") String messageId,
        @JsonProperty("type") AnswerType type,
        @JsonProperty("button_id") Integer buttonId,
        @JsonProperty("text") String text
) {

    public InboundAnswer toAnswer() {
        return new InboundAnswer(type, buttonId, text);
    }
}
