package uk.gegc.quizbot.features.delivery.application;

import uk.gegc.quizbot.features.record.domain.model.OpenRecord;
import uk.gegc.quizbot.features.record.domain.model.TestRecord;

/**
 * Target of {@link uk.gegc.quizbot.features.record.domain.model.AnswerRecord#dispatch}: one method per record variant.
 *
 * @param <M> what the factory produces for a record
 */
public interface MessageFactory<M> {

    M createTest(TestRecord record);

    M createOpen(OpenRecord record);
}
