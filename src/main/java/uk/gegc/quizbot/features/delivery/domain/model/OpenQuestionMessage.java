package uk.gegc.quizbot.features.delivery.domain.model;

import uk.gegc.quizbot.features.record.domain.model.OpenRecord;
import uk.gegc.quizbot.shared.exception.ValidationException;

import java.util.Locale;

public class OpenQuestionMessage extends QuestionMessage {

    public OpenQuestionMessage(OpenRecord record) {
        super(record);
    }

    @Override
    public OutboundMessage toOutbound() {
        return OutboundMessage.simple(getPersonId(), getRecord().getQuestion().getText());
    }

    @Override
    protected String extractAnswer(InboundAnswer answer) {
        if (answer.type() == AnswerType.BUTTON) {
            throw new ValidationException("Open question " + getHandle() + " does not accept button answers");
        }
        if (answer.text() == null || answer.text().isBlank()) {
            throw new ValidationException("Answer to " + getHandle() + " has no text");
        }
        return answer.text();
    }

    @Override
    protected MessageState receivedState() {
        return MessageState.REPLY_RECEIVED;
    }

    @Override
    protected String feedbackText(double points) {
        return String.format(Locale.ROOT,
                "Your answer is provisionally scored %.2f, a reviewer may still change it.", points);
    }
}
