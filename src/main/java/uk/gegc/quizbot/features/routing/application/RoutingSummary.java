package uk.gegc.quizbot.features.routing.application;

/**
 * Outcome of one routing run over all people.
 */
public record RoutingSummary(int people, int failedPeople, int preparedRecords, int sentMessages) {
}
