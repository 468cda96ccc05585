package uk.gegc.quizbot.features.delivery.domain.model;

import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;

/**
 * Points the person back at a question they were sent but have not answered yet.
 */
public class ReminderMessage extends GatewayMessage {

    static final String TEXT = "You still have an unanswered question, please answer it first.";

    private final String outstandingHandle;

    public ReminderMessage(AnswerRecord outstanding) {
        super(outstanding.getPersonId(), null);
        if (outstanding.getMessageHandle() == null) {
            throw new IllegalArgumentException("Record " + outstanding.getId() + " was never sent");
        }
        this.outstandingHandle = outstanding.getMessageHandle();
    }

    @Override
    public OutboundMessage toOutbound() {
        return new OutboundMessage(getPersonId(), OutboundMessageType.REPLY, TEXT, null, outstandingHandle);
    }
}
