package uk.gegc.quizbot.features.record.domain.model;

import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;
import lombok.NoArgsConstructor;
import uk.gegc.quizbot.features.delivery.application.MessageFactory;
import uk.gegc.quizbot.features.question.domain.model.QuestionType;
import uk.gegc.quizbot.features.scoring.application.PointsCalculator;

@Entity
@NoArgsConstructor
@DiscriminatorValue("TEST")
public class TestRecord extends AnswerRecord {

    @Override
    public QuestionType type() {
        return QuestionType.TEST;
    }

    @Override
    public <M> M dispatch(MessageFactory<M> factory) {
        return factory.createTest(this);
    }

    @Override
    protected AnswerState applyScore(PointsCalculator calculator) {
        setPoints(calculator.scoreTest(this));
        return AnswerState.ANSWERED;
    }
}
