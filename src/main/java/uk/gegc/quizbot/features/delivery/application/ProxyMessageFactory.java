package uk.gegc.quizbot.features.delivery.application;

import uk.gegc.quizbot.features.delivery.domain.model.OpenQuestionMessage;
import uk.gegc.quizbot.features.delivery.domain.model.QuestionMessage;
import uk.gegc.quizbot.features.delivery.domain.model.TestQuestionMessage;
import uk.gegc.quizbot.features.record.domain.model.OpenRecord;
import uk.gegc.quizbot.features.record.domain.model.TestRecord;

/**
 * Rebuilds the typed message for an already sent record without queueing anything.
 */
class ProxyMessageFactory implements MessageFactory<QuestionMessage> {

    private final String dontKnowLabel;

    ProxyMessageFactory(String dontKnowLabel) {
        this.dontKnowLabel = dontKnowLabel;
    }

    @Override
    public QuestionMessage createTest(TestRecord record) {
        return new TestQuestionMessage(record, dontKnowLabel);
    }

    @Override
    public QuestionMessage createOpen(OpenRecord record) {
        return new OpenQuestionMessage(record);
    }
}
