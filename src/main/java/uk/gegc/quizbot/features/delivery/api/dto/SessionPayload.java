package uk.gegc.quizbot.features.delivery.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionPayload(
        @JsonProperty("user_id") String userId,
        @JsonProperty("state") String state
) {

    public static final String OPEN = "OPEN";

    public boolean isOpen() {
        return OPEN.equals(state);
    }
}
