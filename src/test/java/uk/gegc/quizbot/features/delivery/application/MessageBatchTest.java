package uk.gegc.quizbot.features.delivery.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.quizbot.features.delivery.domain.model.FeedbackMessage;
import uk.gegc.quizbot.features.delivery.domain.model.GatewayMessage;
import uk.gegc.quizbot.features.delivery.domain.model.OpenQuestionMessage;
import uk.gegc.quizbot.features.delivery.domain.model.QuestionMessage;
import uk.gegc.quizbot.features.delivery.domain.model.TestQuestionMessage;
import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.quizbot.QuizBotFixtures.openQuestion;
import static uk.gegc.quizbot.QuizBotFixtures.savedRecord;
import static uk.gegc.quizbot.QuizBotFixtures.testQuestion;

@DisplayName("MessageBatch")
class MessageBatchTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    @DisplayName("dispatching a record queues the message matching its type")
    void dispatchQueuesTypedMessages() {
        MessageBatch batch = new MessageBatch("Don't know");
        AnswerRecord test = savedRecord(testQuestion("1", List.of("a"), "g1"), "alice", NOW);
        AnswerRecord open = savedRecord(openQuestion("x", "g1"), "alice", NOW);

        QuestionMessage first = test.dispatch(batch);
        QuestionMessage second = open.dispatch(batch);

        assertThat(first).isInstanceOf(TestQuestionMessage.class);
        assertThat(second).isInstanceOf(OpenQuestionMessage.class);
        assertThat(batch.drain()).containsExactly(first, second);
        assertThat(batch.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("truncate keeps only the messages queued before the mark")
    void truncate() {
        MessageBatch batch = new MessageBatch("Don't know");
        FeedbackMessage kept = batch.add(new FeedbackMessage("alice", "one"));
        batch.add(new FeedbackMessage("bob", "two"));
        batch.add(new FeedbackMessage("carol", "three"));

        batch.truncate(1);

        List<GatewayMessage> drained = batch.drain();
        assertThat(drained).containsExactly(kept);
    }

    @Test
    @DisplayName("truncate beyond the current size is rejected")
    void truncateOutOfRange() {
        MessageBatch batch = new MessageBatch("Don't know");
        batch.add(new FeedbackMessage("alice", "one"));

        assertThatThrownBy(() -> batch.truncate(2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> batch.truncate(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(batch.size()).isEqualTo(1);
    }
}
