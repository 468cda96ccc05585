package uk.gegc.quizbot.features.record.domain.model;

import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;
import lombok.NoArgsConstructor;
import uk.gegc.quizbot.features.delivery.application.MessageFactory;
import uk.gegc.quizbot.features.question.domain.model.QuestionType;
import uk.gegc.quizbot.features.scoring.application.PointsCalculator;

/**
 * Free-text answer. Scoring only yields a provisional mark, so the record stays {@code PENDING}
 * until a reviewer confirms it.
 */
@Entity
@NoArgsConstructor
@DiscriminatorValue("OPEN")
public class OpenRecord extends AnswerRecord {

    @Override
    public QuestionType type() {
        return QuestionType.OPEN;
    }

    @Override
    public <M> M dispatch(MessageFactory<M> factory) {
        return factory.createOpen(this);
    }

    @Override
    protected AnswerState applyScore(PointsCalculator calculator) {
        setPoints(calculator.scoreOpen(this));
        return AnswerState.PENDING;
    }
}
