package uk.gegc.quizbot.features.delivery.domain.model;

/**
 * How a person answered: by pressing a button, by sending a message, or by replying to one.
 */
public enum AnswerType {
    BUTTON,
    SIMPLE,
    REPLY
}
