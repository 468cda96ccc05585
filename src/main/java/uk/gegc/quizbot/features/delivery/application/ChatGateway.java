package uk.gegc.quizbot.features.delivery.application;

import uk.gegc.quizbot.features.delivery.domain.model.OutboundMessage;

/**
 * Outbound side of the chat gateway.
 */
public interface ChatGateway {

    /**
     * Sends one message.
     *
     * @return the handle the gateway assigned to it; replies refer to it
     * @throws uk.gegc.quizbot.shared.exception.GatewayException when the message was not accepted
     */
    String send(OutboundMessage message);
}
