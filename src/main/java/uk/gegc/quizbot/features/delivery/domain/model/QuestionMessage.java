package uk.gegc.quizbot.features.delivery.domain.model;

import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;
import uk.gegc.quizbot.features.scoring.application.PointsCalculator;

import java.time.Instant;
import java.util.Optional;

/**
 * A question asked through the gateway, bound to the record it was created for.
 */
public abstract class QuestionMessage extends GatewayMessage {

    private final AnswerRecord record;

    protected QuestionMessage(AnswerRecord record) {
        super(record.getPersonId(), record.getMessageHandle());
        this.record = record;
    }

    public AnswerRecord getRecord() {
        return record;
    }

    @Override
    public Optional<AnswerRecord> transferTarget() {
        return Optional.of(record);
    }

    /**
     * Applies the person's answer to the record and builds the confirmation to send back.
     *
     * @throws uk.gegc.quizbot.shared.exception.ValidationException if the answer has the wrong shape for this question
     */
    public FeedbackMessage handleAnswer(InboundAnswer answer, PointsCalculator calculator, Instant answeredAt) {
        String text = extractAnswer(answer);
        record.setAnswer(text);
        record.setAnswerTime(answeredAt);
        double points = record.score(calculator);
        markReceived(receivedState());
        return new FeedbackMessage(record.getPersonId(), feedbackText(points));
    }

    protected abstract String extractAnswer(InboundAnswer answer);

    protected abstract MessageState receivedState();

    protected abstract String feedbackText(double points);
}
