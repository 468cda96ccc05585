package uk.gegc.quizbot.features.delivery.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.quizbot.features.delivery.api.dto.FeedbackPayload;
import uk.gegc.quizbot.features.delivery.api.dto.SessionPayload;
import uk.gegc.quizbot.features.delivery.api.dto.WebhookEvent;
import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;
import uk.gegc.quizbot.features.record.domain.model.AnswerState;
import uk.gegc.quizbot.features.record.domain.repository.AnswerRecordRepository;
import uk.gegc.quizbot.features.routing.application.PersonRouter;
import uk.gegc.quizbot.shared.exception.ValidationException;

import java.util.List;
import java.util.Optional;

/**
 * Handles events posted by the chat gateway.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryService {

    private final PersonRouter router;
    private final MessageDispatcher dispatcher;
    private final AnswerRecordRepository recordRepository;

    /**
     * {@code FEEDBACK} applies the answer and, when the session is open, delivers the next question.
     * A failure of that follow-up delivery is logged since the answer itself was accepted.
     * {@code SESSION} delivers the next question when the session opens and is ignored otherwise.
     */
    public void handle(WebhookEvent event) {
        if (event == null || event.type() == null) {
            throw new ValidationException("Webhook event type is required");
        }
        SessionPayload session = event.session();
        FeedbackPayload feedback = event.feedback();
        DeliveryLoggingContext context = DeliveryLoggingContext.builder()
                .eventType(event.type().name())
                .personId(session != null ? session.userId() : null)
                .messageHandle(feedback != null ? feedback.messageId() : null)
                .build();
        context.setMDC();
        try {
            switch (event.type()) {
                case FEEDBACK -> handleFeedback(feedback, session);
                case SESSION -> handleSession(session);
            }
        } finally {
            DeliveryLoggingContext.clearMDC();
        }
    }

    private void handleFeedback(FeedbackPayload feedback, SessionPayload session) {
        if (feedback == null) {
            throw new ValidationException("FEEDBACK event without feedback section");
        }
        log.debug("Received answer to message {}", feedback.messageId());
        dispatcher.handleFeedback(feedback.messageId(), feedback.toAnswer());
        if (session != null && session.isOpen()) {
            try {
                requestDelivery(requirePerson(session));
            } catch (RuntimeException e) {
                log.error("Delivery after answer to message {} failed", feedback.messageId(), e);
            }
        }
    }

    private void handleSession(SessionPayload session) {
        if (session == null) {
            throw new ValidationException("SESSION event without session section");
        }
        if (!session.isOpen()) {
            log.debug("Ignoring session state {} for person {}", session.state(), session.userId());
            return;
        }
        requestDelivery(requirePerson(session));
    }

    /**
     * Sends the person something to answer: a reminder about an unanswered question if there is one,
     * otherwise their next question.
     *
     * @return number of messages sent
     */
    public int requestDelivery(String personId) {
        MessageBatch batch = dispatcher.newBatch();
        Optional<AnswerRecord> outstanding =
                recordRepository.findFirstByPersonIdAndStateOrderByAskTimeDesc(personId, AnswerState.TRANSFERRED);
        if (outstanding.isPresent()) {
            log.debug("Person {} still has message {} unanswered, sending a reminder",
                    personId, outstanding.get().getMessageHandle());
            dispatcher.remind(outstanding.get(), batch);
        } else {
            List<AnswerRecord> prepared = router.prepareNext(personId, batch);
            log.debug("Prepared {} records for person {}", prepared.size(), personId);
        }
        return dispatcher.sendMessages(batch);
    }

    private static String requirePerson(SessionPayload session) {
        if (session.userId() == null || session.userId().isBlank()) {
            throw new ValidationException("Session without user_id");
        }
        return session.userId();
    }
}
