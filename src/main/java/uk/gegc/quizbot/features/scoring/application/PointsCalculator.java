package uk.gegc.quizbot.features.scoring.application;

import uk.gegc.quizbot.features.record.domain.model.OpenRecord;
import uk.gegc.quizbot.features.record.domain.model.TestRecord;

/**
 * Scores a person's answer against the canonical answer of the record's question.
 */
public interface PointsCalculator {

    /**
     * @return 1 when the chosen option is the canonical answer, 0 otherwise
     */
    double scoreTest(TestRecord record);

    /**
     * @return provisional score in {@code [0, 1]}
     */
    double scoreOpen(OpenRecord record);
}
