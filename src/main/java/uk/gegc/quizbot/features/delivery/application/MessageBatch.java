package uk.gegc.quizbot.features.delivery.application;

import uk.gegc.quizbot.features.delivery.domain.model.GatewayMessage;
import uk.gegc.quizbot.features.delivery.domain.model.OpenQuestionMessage;
import uk.gegc.quizbot.features.delivery.domain.model.QuestionMessage;
import uk.gegc.quizbot.features.delivery.domain.model.TestQuestionMessage;
import uk.gegc.quizbot.features.record.domain.model.OpenRecord;
import uk.gegc.quizbot.features.record.domain.model.TestRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Messages queued by one unit of work until {@link MessageDispatcher#sendMessages} flushes them.
 * Not thread-safe; each routing run or webhook call uses its own batch.
 */
public class MessageBatch implements MessageFactory<QuestionMessage> {

    private final String dontKnowLabel;
    private final List<GatewayMessage> messages = new ArrayList<>();

    public MessageBatch(String dontKnowLabel) {
        this.dontKnowLabel = dontKnowLabel;
    }

    @Override
    public QuestionMessage createTest(TestRecord record) {
        return add(new TestQuestionMessage(record, dontKnowLabel));
    }

    @Override
    public QuestionMessage createOpen(OpenRecord record) {
        return add(new OpenQuestionMessage(record));
    }

    public <M extends GatewayMessage> M add(M message) {
        messages.add(message);
        return message;
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    /**
     * Drops every message queued after the first {@code size} ones.
     */
    public void truncate(int size) {
        if (size < 0 || size > messages.size()) {
            throw new IllegalArgumentException("Cannot truncate " + messages.size() + " messages to " + size);
        }
        messages.subList(size, messages.size()).clear();
    }

    /**
     * Returns the queued messages in order and empties the batch.
     */
    public List<GatewayMessage> drain() {
        List<GatewayMessage> drained = new ArrayList<>(messages);
        messages.clear();
        return drained;
    }
}
