package uk.gegc.quizbot.features.question.domain.model;

public enum QuestionType {
    TEST,
    OPEN
}
