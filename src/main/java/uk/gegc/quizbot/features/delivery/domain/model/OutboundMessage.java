package uk.gegc.quizbot.features.delivery.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One message in the gateway's wire format.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutboundMessage(
        @JsonProperty("user_id") String userId,
        @JsonProperty("type") OutboundMessageType type,
        @JsonProperty("text") String text,
        @JsonProperty("buttons") List<String> buttons,
        @JsonProperty("reply_to") String replyTo
) {

    public static OutboundMessage simple(String userId, String text) {
        return new OutboundMessage(userId, OutboundMessageType.SIMPLE, text, null, null);
    }
}
