package uk.gegc.quizbot.features.delivery.domain.model;

import lombok.Getter;
import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;

import java.util.Optional;

/**
 * A message exchanged with one person through the chat gateway.
 */
@Getter
public abstract class GatewayMessage {

    private final String personId;
    private MessageState state;
    private String handle;

    protected GatewayMessage(String personId, String handle) {
        this.personId = personId;
        this.handle = handle;
        this.state = handle == null ? MessageState.CREATED : MessageState.SENT;
    }

    public abstract OutboundMessage toOutbound();

    /**
     * Record whose state follows this message once it is sent; empty for messages that only inform.
     */
    public Optional<AnswerRecord> transferTarget() {
        return Optional.empty();
    }

    public void markSent(String handle) {
        if (state != MessageState.CREATED) {
            throw new IllegalStateException("Message to " + personId + " is already " + state);
        }
        this.handle = handle;
        this.state = MessageState.SENT;
    }

    protected void markReceived(MessageState received) {
        if (state != MessageState.SENT) {
            throw new IllegalStateException("Message " + handle + " cannot receive an answer in state " + state);
        }
        this.state = received;
    }
}
