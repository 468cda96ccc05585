package uk.gegc.quizbot.features.record.domain.model;

/**
 * Lifecycle of one question asked of one person.
 * {@code NOT_ANSWERED -> TRANSFERRED -> (PENDING | ANSWERED)}; a reviewer may revise a pending answer
 * any number of times before confirming it as {@code ANSWERED}.
 */
public enum AnswerState {
    NOT_ANSWERED,
    TRANSFERRED,
    PENDING,
    ANSWERED;

    public boolean canTransitionTo(AnswerState target) {
        return switch (this) {
            case NOT_ANSWERED -> target == TRANSFERRED;
            case TRANSFERRED -> target == PENDING || target == ANSWERED;
            case PENDING -> target == PENDING || target == ANSWERED;
            case ANSWERED -> false;
        };
    }
}
