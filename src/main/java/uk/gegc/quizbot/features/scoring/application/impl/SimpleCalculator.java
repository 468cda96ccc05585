package uk.gegc.quizbot.features.scoring.application.impl;

import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;
import uk.gegc.quizbot.features.record.domain.model.OpenRecord;
import uk.gegc.quizbot.features.record.domain.model.TestRecord;
import uk.gegc.quizbot.features.scoring.application.PointsCalculator;

public class SimpleCalculator implements PointsCalculator {

    private final double defaultOpenScore;

    public SimpleCalculator(double defaultOpenScore) {
        if (defaultOpenScore < 0 || defaultOpenScore > 1) {
            throw new IllegalArgumentException("Default open score must be within [0, 1]: " + defaultOpenScore);
        }
        this.defaultOpenScore = defaultOpenScore;
    }

    @Override
    public double scoreTest(TestRecord record) {
        return matchesCanonical(record) ? 1.0 : 0.0;
    }

    @Override
    public double scoreOpen(OpenRecord record) {
        return defaultOpenScore;
    }

    static boolean matchesCanonical(AnswerRecord record) {
        String given = record.getPersonAnswer();
        String expected = record.getQuestion().getAnswer();
        return given != null && expected != null && given.trim().equals(expected.trim());
    }
}
