package uk.gegc.quizbot.features.delivery.domain.model;

public class FeedbackMessage extends GatewayMessage {

    private final String text;

    public FeedbackMessage(String personId, String text) {
        super(personId, null);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public OutboundMessage toOutbound() {
        return OutboundMessage.simple(getPersonId(), text);
    }
}
