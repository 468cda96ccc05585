package uk.gegc.quizbot.features.delivery.domain.model;

public record InboundAnswer(AnswerType type, Integer buttonId, String text) {
}
