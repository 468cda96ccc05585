package uk.gegc.quizbot.features.delivery.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.quizbot.features.delivery.config.GatewayProperties;
import uk.gegc.quizbot.features.delivery.domain.model.FeedbackMessage;
import uk.gegc.quizbot.features.delivery.domain.model.GatewayMessage;
import uk.gegc.quizbot.features.delivery.domain.model.InboundAnswer;
import uk.gegc.quizbot.features.delivery.domain.model.QuestionMessage;
import uk.gegc.quizbot.features.delivery.domain.model.ReminderMessage;
import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;
import uk.gegc.quizbot.features.record.domain.model.AnswerState;
import uk.gegc.quizbot.features.record.domain.repository.AnswerRecordRepository;
import uk.gegc.quizbot.features.scoring.application.PointsCalculator;
import uk.gegc.quizbot.shared.exception.GatewayException;
import uk.gegc.quizbot.shared.exception.RecordStateException;
import uk.gegc.quizbot.shared.exception.ResourceNotFoundException;
import uk.gegc.quizbot.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sends queued messages through the {@link ChatGateway} and applies answers that come back.
 *
 * <p>A record becomes {@code TRANSFERRED} only after the gateway has accepted its message and returned a handle.
 * Answers are applied under a row lock so a repeated acknowledgement of the same handle is rejected.
 *
 * <p>Delivery is at least once: if the gateway accepts a message but the transaction that records its handle
 * fails to commit, the record stays {@code NOT_ANSWERED} and is sent again by a later run. The orphaned handle
 * is logged so the duplicate can be traced.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageDispatcher {

    private final ChatGateway gateway;
    private final AnswerRecordRepository recordRepository;
    private final PointsCalculator calculator;
    private final GatewayProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public MessageBatch newBatch() {
        return new MessageBatch(properties.getDontKnowLabel());
    }

    /**
     * Queues a reminder about a question the person was sent but has not answered.
     */
    public void remind(AnswerRecord outstanding, MessageBatch batch) {
        if (outstanding.getState() != AnswerState.TRANSFERRED) {
            throw new RecordStateException("Record " + outstanding.getId() + " is not awaiting an answer");
        }
        batch.add(new ReminderMessage(outstanding));
    }

    /**
     * Sends every queued message, each in its own transaction. Failures do not stop the remaining messages;
     * they are reported together once the batch is done.
     *
     * @return number of messages the gateway accepted
     * @throws GatewayException if at least one message could not be sent
     */
    public int sendMessages(MessageBatch batch) {
        List<GatewayMessage> messages = batch.drain();
        if (messages.isEmpty()) {
            return 0;
        }
        log.debug("Sending {} messages", messages.size());

        int sent = 0;
        List<RuntimeException> failures = new ArrayList<>();
        for (GatewayMessage message : messages) {
            try {
                if (send(message)) {
                    sent++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to send message to person {}", message.getPersonId(), e);
                failures.add(e);
            }
        }

        log.info("Sent {} of {} messages", sent, messages.size());
        if (!failures.isEmpty()) {
            GatewayException error = new GatewayException(
                    failures.size() + " of " + messages.size() + " messages could not be sent", failures.get(0));
            failures.stream().skip(1).forEach(error::addSuppressed);
            throw error;
        }
        return sent;
    }

    private boolean send(GatewayMessage message) {
        AnswerRecord target = message.transferTarget().orElse(null);
        if (target == null) {
            message.markSent(gateway.send(message.toOutbound()));
            return true;
        }
        AtomicReference<String> accepted = new AtomicReference<>();
        try {
            Boolean sent = transactionTemplate.execute(status -> {
                AnswerRecord record = recordRepository.findByIdForUpdate(target.getId())
                        .orElseThrow(() -> new ResourceNotFoundException("Record " + target.getId() + " not found"));
                if (record.getState() != AnswerState.NOT_ANSWERED) {
                    log.warn("Record {} is already {}, not sending it again", record.getId(), record.getState());
                    return false;
                }
                // Row lock stays held across the gateway call; a concurrent run for this record waits here.
                String handle = gateway.send(message.toOutbound());
                accepted.set(handle);
                record.transfer(handle);
                recordRepository.save(record);
                log.debug("Record {} transferred as message {}", record.getId(), handle);
                return true;
            });
            if (Boolean.TRUE.equals(sent)) {
                message.markSent(accepted.get());
                return true;
            }
            return false;
        } catch (RuntimeException e) {
            if (accepted.get() != null) {
                log.error("Gateway accepted message {} for record {} but the record was not updated; it will be sent again",
                        accepted.get(), target.getId());
            }
            throw e;
        }
    }

    /**
     * Rebuilds the typed message for a sent record.
     */
    public QuestionMessage getMessage(String handle) {
        AnswerRecord record = recordRepository.findByMessageHandle(handle)
                .orElseThrow(() -> new ResourceNotFoundException("No record for message " + handle));
        return typedMessage(record);
    }

    /**
     * Applies a person's answer to the record behind {@code handle}, then tells them the result.
     * A failed confirmation is logged; the scored answer stays committed.
     *
     * @throws ResourceNotFoundException if no record was sent with this handle
     * @throws RecordStateException      if the record is not awaiting an answer
     * @throws ValidationException       if the answer does not fit the question type
     */
    public AnswerRecord handleFeedback(String handle, InboundAnswer answer) {
        if (handle == null || handle.isBlank()) {
            throw new ValidationException("Feedback without message_id");
        }
        if (answer == null || answer.type() == null) {
            throw new ValidationException("Feedback for message " + handle + " has no answer type");
        }
        Instant now = clock.instant();
        Outcome outcome = transactionTemplate.execute(status -> {
            AnswerRecord record = recordRepository.findByMessageHandleForUpdate(handle)
                    .orElseThrow(() -> new ResourceNotFoundException("No record for message " + handle));
            if (record.getState() != AnswerState.TRANSFERRED) {
                throw new RecordStateException("Message " + handle + " was already answered (state " + record.getState() + ")");
            }
            FeedbackMessage feedback = typedMessage(record).handleAnswer(answer, calculator, now);
            AnswerRecord saved = recordRepository.save(record);
            log.info("Scored answer to message {} for person {}: {} points, state {}",
                    handle, saved.getPersonId(), saved.getPoints(), saved.getState());
            return new Outcome(saved, feedback);
        });

        try {
            outcome.feedback().markSent(gateway.send(outcome.feedback().toOutbound()));
        } catch (RuntimeException e) {
            log.error("Failed to send feedback for message {} to person {}", handle, outcome.record().getPersonId(), e);
        }
        return outcome.record();
    }

    private QuestionMessage typedMessage(AnswerRecord record) {
        return record.dispatch(new ProxyMessageFactory(properties.getDontKnowLabel()));
    }

    private record Outcome(AnswerRecord record, FeedbackMessage feedback) {
    }
}
