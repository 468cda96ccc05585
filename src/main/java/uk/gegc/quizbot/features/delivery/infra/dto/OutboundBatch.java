package uk.gegc.quizbot.features.delivery.infra.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import uk.gegc.quizbot.features.delivery.domain.model.OutboundMessage;

import java.util.List;

public record OutboundBatch(
        @JsonProperty("service_id") String serviceId,
        @JsonProperty("messages") List<OutboundMessage> messages
) {
}
