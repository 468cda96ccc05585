package uk.gegc.quizbot.features.record.domain.repository;

import java.time.Instant;
import java.util.UUID;

/**
 * Aggregated answers of one person to one question.
 */
public record AnswerHistory(UUID questionId, Double pointsSum, Instant firstAskTime, Instant lastAskTime) {
}
