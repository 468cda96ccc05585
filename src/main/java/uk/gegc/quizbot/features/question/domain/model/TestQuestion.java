package uk.gegc.quizbot.features.question.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;
import uk.gegc.quizbot.features.record.domain.model.TestRecord;

import java.util.ArrayList;
import java.util.List;

@Entity
@Getter
@Setter
@NoArgsConstructor
@DiscriminatorValue("TEST")
public class TestQuestion extends Question {

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "options", length = 4000)
    private List<String> options = new ArrayList<>();

    @Override
    public QuestionType type() {
        return QuestionType.TEST;
    }

    @Override
    public AnswerRecord initRecord(String personId) {
        return bind(new TestRecord(), personId);
    }

    @Override
    public List<String> answerOptions() {
        return options == null ? List.of() : List.copyOf(options);
    }
}
