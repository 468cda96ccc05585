package uk.gegc.quizbot.features.record.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.quizbot.features.delivery.application.MessageFactory;
import uk.gegc.quizbot.features.question.domain.model.Question;
import uk.gegc.quizbot.features.question.domain.model.QuestionType;
import uk.gegc.quizbot.features.scoring.application.PointsCalculator;
import uk.gegc.quizbot.shared.exception.RecordStateException;
import uk.gegc.quizbot.shared.exception.ValidationException;

import java.time.Instant;
import java.util.UUID;

/**
 * One question asked of one person.
 *
 * <p>State and points only change through {@link #transfer(String)}, {@link #score(PointsCalculator)}
 * and the review operations {@link #revise(double)} and {@link #confirm(double)}. Every one of them checks
 * {@link AnswerState#canTransitionTo(AnswerState)} and rejects a call made from the wrong state with
 * {@link RecordStateException}.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "answers",
        indexes = @Index(name = "idx_answers_person_state", columnList = "person_id, state, ask_time"))
@Inheritance(strategy = InheritanceType.SINGLE_TABLE)
@DiscriminatorColumn(name = "type", discriminatorType = DiscriminatorType.STRING, length = 20)
public abstract class AnswerRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    // Messages render question text after the loading transaction is gone
    @ManyToOne(optional = false, fetch = FetchType.EAGER)
    @JoinColumn(name = "question_id", nullable = false, updatable = false)
    private Question question;

    @Column(name = "person_id", nullable = false, length = 100)
    private String personId;

    @Setter(AccessLevel.NONE)
    @Column(name = "person_answer", length = 4000)
    private String personAnswer;

    @Setter(AccessLevel.NONE)
    @Column(name = "message_handle", unique = true, length = 64)
    private String messageHandle;

    @Column(name = "ask_time", nullable = false)
    private Instant askTime;

    @Column(name = "answer_time")
    private Instant answerTime;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private AnswerState state = AnswerState.NOT_ANSWERED;

    @Setter(AccessLevel.NONE)
    @Column(name = "points", nullable = false)
    private double points = 0;

    @Version
    @Setter(AccessLevel.NONE)
    @Column(name = "version")
    private Long version;

    public abstract QuestionType type();

    /**
     * Hands this record to the factory method matching its variant.
     */
    public abstract <M> M dispatch(MessageFactory<M> factory);

    /**
     * Asks the calculator for this variant's score and returns the state the record ends in.
     */
    protected abstract AnswerState applyScore(PointsCalculator calculator);

    public void transfer(String handle) {
        if (handle == null || handle.isBlank()) {
            throw new IllegalArgumentException("Message handle must not be blank");
        }
        if (!state.canTransitionTo(AnswerState.TRANSFERRED)) {
            throw new RecordStateException(
                    "Record " + id + " was already sent (state " + state + ", handle " + messageHandle + ")");
        }
        this.messageHandle = handle;
        this.state = AnswerState.TRANSFERRED;
    }

    /**
     * Scores the person's reply. Only a record waiting for its first reply can be scored.
     */
    public double score(PointsCalculator calculator) {
        if (state != AnswerState.TRANSFERRED) {
            throw new RecordStateException("Record " + id + " cannot be scored in state " + state);
        }
        moveTo(applyScore(calculator));
        return points;
    }

    /**
     * Reviewer adjusts the points of a pending answer; the record stays pending.
     */
    public void revise(double points) {
        review(points, AnswerState.PENDING);
    }

    /**
     * Reviewer settles a pending answer with its final points.
     */
    public void confirm(double points) {
        review(points, AnswerState.ANSWERED);
    }

    private void review(double reviewed, AnswerState target) {
        if (state != AnswerState.PENDING) {
            throw new RecordStateException("Record " + id + " is not awaiting review (state " + state + ")");
        }
        if (Double.isNaN(reviewed) || reviewed < 0 || reviewed > 1) {
            throw new ValidationException("Points must be between 0 and 1, got " + reviewed);
        }
        this.points = reviewed;
        moveTo(target);
    }

    private void moveTo(AnswerState target) {
        if (!state.canTransitionTo(target)) {
            throw new RecordStateException("Record " + id + " cannot move from " + state + " to " + target);
        }
        this.state = target;
    }

    public void setAnswer(String answer) {
        this.personAnswer = answer;
    }

    protected void setPoints(double points) {
        this.points = points;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", personId=" + personId
                + ", state=" + state + ", handle=" + messageHandle + "}";
    }
}
