package uk.gegc.quizbot.features.delivery.domain.model;

import uk.gegc.quizbot.features.record.domain.model.TestRecord;
import uk.gegc.quizbot.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Multiple choice question. Button 0 is "don't know", button {@code i} is option {@code i}.
 */
public class TestQuestionMessage extends QuestionMessage {

    static final String CORRECT = "Correct answer!";
    static final String WRONG = "Wrong answer ;(";

    private final String dontKnowLabel;

    public TestQuestionMessage(TestRecord record, String dontKnowLabel) {
        super(record);
        this.dontKnowLabel = dontKnowLabel;
    }

    @Override
    public OutboundMessage toOutbound() {
        return new OutboundMessage(getPersonId(), OutboundMessageType.WITH_BUTTONS,
                getRecord().getQuestion().getText(), buttons(), null);
    }

    List<String> buttons() {
        List<String> buttons = new ArrayList<>();
        buttons.add(dontKnowLabel);
        buttons.addAll(getRecord().getQuestion().answerOptions());
        return buttons;
    }

    @Override
    protected String extractAnswer(InboundAnswer answer) {
        if (answer.type() != AnswerType.BUTTON) {
            throw new ValidationException("Test question " + getHandle() + " only accepts button answers, got " + answer.type());
        }
        if (answer.buttonId() == null) {
            throw new ValidationException("Button answer to " + getHandle() + " has no button_id");
        }
        int optionCount = getRecord().getQuestion().answerOptions().size();
        if (answer.buttonId() < 0 || answer.buttonId() > optionCount) {
            throw new ValidationException("Button " + answer.buttonId() + " does not exist on message " + getHandle());
        }
        return String.valueOf(answer.buttonId());
    }

    @Override
    protected MessageState receivedState() {
        return MessageState.ACK_RECEIVED;
    }

    @Override
    protected String feedbackText(double points) {
        return points >= 1.0 ? CORRECT : WRONG;
    }
}
