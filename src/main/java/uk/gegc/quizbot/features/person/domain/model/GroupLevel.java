package uk.gegc.quizbot.features.person.domain.model;

/**
 * Membership of a person in a group together with their proficiency there.
 */
public record GroupLevel(String groupId, int level) {
}
