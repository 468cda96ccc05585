package uk.gegc.quizbot.features.generator.application;

import uk.gegc.quizbot.features.question.domain.model.Question;
import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;

import java.time.Instant;

/**
 * One item picked by a {@link Generator}: either a record that is already due or a question
 * that still needs a record.
 */
public interface ScheduledItem {

    /**
     * True when {@link #toRecord} creates a new record that still has to be saved.
     */
    boolean isFresh();

    AnswerRecord toRecord(String personId, Instant askTime);

    static ScheduledItem planned(AnswerRecord record) {
        return new Planned(record);
    }

    static ScheduledItem fresh(Question question) {
        return new Fresh(question);
    }

    record Planned(AnswerRecord record) implements ScheduledItem {

        @Override
        public boolean isFresh() {
            return false;
        }

        @Override
        public AnswerRecord toRecord(String personId, Instant askTime) {
            return record;
        }
    }

    record Fresh(Question question) implements ScheduledItem {

        @Override
        public boolean isFresh() {
            return true;
        }

        @Override
        public AnswerRecord toRecord(String personId, Instant askTime) {
            AnswerRecord record = question.initRecord(personId);
            record.setAskTime(askTime);
            return record;
        }
    }
}
