package uk.gegc.quizbot.features.question.domain.model;

import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;
import lombok.NoArgsConstructor;
import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;
import uk.gegc.quizbot.features.record.domain.model.OpenRecord;

@Entity
@NoArgsConstructor
@DiscriminatorValue("OPEN")
public class OpenQuestion extends Question {

    @Override
    public QuestionType type() {
        return QuestionType.OPEN;
    }

    @Override
    public AnswerRecord initRecord(String personId) {
        return bind(new OpenRecord(), personId);
    }
}
