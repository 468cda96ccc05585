package uk.gegc.quizbot.features.delivery.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.slf4j.MDC;
import uk.gegc.quizbot.BaseUnitTest;
import uk.gegc.quizbot.features.delivery.api.dto.FeedbackPayload;
import uk.gegc.quizbot.features.delivery.api.dto.SessionPayload;
import uk.gegc.quizbot.features.delivery.api.dto.WebhookEvent;
import uk.gegc.quizbot.features.delivery.api.dto.WebhookEventType;
import uk.gegc.quizbot.features.delivery.domain.model.AnswerType;
import uk.gegc.quizbot.features.delivery.domain.model.InboundAnswer;
import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;
import uk.gegc.quizbot.features.record.domain.model.AnswerState;
import uk.gegc.quizbot.features.record.domain.repository.AnswerRecordRepository;
import uk.gegc.quizbot.features.routing.application.PersonRouter;
import uk.gegc.quizbot.shared.exception.GatewayException;
import uk.gegc.quizbot.shared.exception.ResourceNotFoundException;
import uk.gegc.quizbot.shared.exception.ValidationException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static uk.gegc.quizbot.QuizBotFixtures.openQuestion;
import static uk.gegc.quizbot.QuizBotFixtures.savedRecord;

@DisplayName("DeliveryService")
class DeliveryServiceTest extends BaseUnitTest {

    private static final SessionPayload OPEN = new SessionPayload("alice", "OPEN");
    private static final SessionPayload CLOSED = new SessionPayload("alice", "CLOSED");
    private static final FeedbackPayload BUTTON_ONE = new FeedbackPayload("123", AnswerType.BUTTON, 1, null);

    @Mock
    private PersonRouter router;

    @Mock
    private MessageDispatcher dispatcher;

    @Mock
    private AnswerRecordRepository recordRepository;

    @InjectMocks
    private DeliveryService deliveryService;

    private final MessageBatch batch = new MessageBatch("Don't know");

    @Nested
    @DisplayName("requestDelivery")
    class RequestDelivery {

        @BeforeEach
        void setUp() {
            when(dispatcher.newBatch()).thenReturn(batch);
        }

        @Test
        @DisplayName("prepares the next questions when nothing is outstanding")
        void preparesNext() {
            when(recordRepository.findFirstByPersonIdAndStateOrderByAskTimeDesc("alice", AnswerState.TRANSFERRED))
                    .thenReturn(Optional.empty());
            when(router.prepareNext("alice", batch)).thenReturn(List.of());
            when(dispatcher.sendMessages(batch)).thenReturn(1);

            int sent = deliveryService.requestDelivery("alice");

            assertThat(sent).isEqualTo(1);
            verify(dispatcher, never()).remind(any(), any());
        }

        @Test
        @DisplayName("reminds about an unanswered question instead of sending a new one")
        void remindsOutstanding() {
            AnswerRecord outstanding = savedRecord(openQuestion("x", "g1"), "alice", Instant.parse("2024-03-01T10:00:00Z"));
            outstanding.transfer("42");
            when(recordRepository.findFirstByPersonIdAndStateOrderByAskTimeDesc("alice", AnswerState.TRANSFERRED))
                    .thenReturn(Optional.of(outstanding));
            when(dispatcher.sendMessages(batch)).thenReturn(1);

            int sent = deliveryService.requestDelivery("alice");

            assertThat(sent).isEqualTo(1);
            verify(dispatcher).remind(outstanding, batch);
            verifyNoInteractions(router);
        }
    }

    @Nested
    @DisplayName("SESSION events")
    class SessionEvents {

        @Test
        @DisplayName("an opened session triggers delivery for that person")
        void openSession() {
            when(dispatcher.newBatch()).thenReturn(batch);
            when(recordRepository.findFirstByPersonIdAndStateOrderByAskTimeDesc("alice", AnswerState.TRANSFERRED))
                    .thenReturn(Optional.empty());
            when(router.prepareNext("alice", batch)).thenReturn(List.of());

            deliveryService.handle(new WebhookEvent(WebhookEventType.SESSION, OPEN, null));

            verify(router).prepareNext("alice", batch);
            verify(dispatcher).sendMessages(batch);
        }

        @Test
        @DisplayName("any other session state is ignored")
        void closedSession() {
            deliveryService.handle(new WebhookEvent(WebhookEventType.SESSION, CLOSED, null));

            verifyNoInteractions(router, dispatcher, recordRepository);
        }

        @Test
        @DisplayName("a delivery failure is reported to the caller")
        void deliveryFailurePropagates() {
            when(dispatcher.newBatch()).thenReturn(batch);
            when(recordRepository.findFirstByPersonIdAndStateOrderByAskTimeDesc("alice", AnswerState.TRANSFERRED))
                    .thenReturn(Optional.empty());
            when(router.prepareNext("alice", batch)).thenThrow(new ResourceNotFoundException("Person alice not found"));

            assertThatThrownBy(() -> deliveryService.handle(new WebhookEvent(WebhookEventType.SESSION, OPEN, null)))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("a session event needs a session and a user")
        void incompleteSession() {
            assertThatThrownBy(() -> deliveryService.handle(new WebhookEvent(WebhookEventType.SESSION, null, null)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> deliveryService.handle(
                    new WebhookEvent(WebhookEventType.SESSION, new SessionPayload(" ", "OPEN"), null)))
                    .isInstanceOf(ValidationException.class);
            verifyNoInteractions(router);
        }
    }

    @Nested
    @DisplayName("FEEDBACK events")
    class FeedbackEvents {

        @Test
        @DisplayName("applies the answer and delivers the next question while the session is open")
        void feedbackWithOpenSession() {
            when(dispatcher.newBatch()).thenReturn(batch);
            when(recordRepository.findFirstByPersonIdAndStateOrderByAskTimeDesc("alice", AnswerState.TRANSFERRED))
                    .thenReturn(Optional.empty());
            when(router.prepareNext("alice", batch)).thenReturn(List.of());

            deliveryService.handle(new WebhookEvent(WebhookEventType.FEEDBACK, OPEN, BUTTON_ONE));

            verify(dispatcher).handleFeedback("123", new InboundAnswer(AnswerType.BUTTON, 1, null));
            verify(dispatcher).sendMessages(batch);
        }

        @Test
        @DisplayName("without an open session only the answer is applied")
        void feedbackWithoutSession() {
            deliveryService.handle(new WebhookEvent(WebhookEventType.FEEDBACK, null, BUTTON_ONE));

            verify(dispatcher).handleFeedback("123", new InboundAnswer(AnswerType.BUTTON, 1, null));
            verify(dispatcher, never()).sendMessages(any());
            verifyNoInteractions(router);
        }

        @Test
        @DisplayName("a failing follow-up delivery does not fail the accepted answer")
        void followUpFailureIsLogged() {
            when(dispatcher.newBatch()).thenReturn(batch);
            when(recordRepository.findFirstByPersonIdAndStateOrderByAskTimeDesc("alice", AnswerState.TRANSFERRED))
                    .thenReturn(Optional.empty());
            when(router.prepareNext("alice", batch)).thenReturn(List.of());
            when(dispatcher.sendMessages(batch)).thenThrow(new GatewayException("1 of 1 messages could not be sent"));

            assertThatCode(() -> deliveryService.handle(new WebhookEvent(WebhookEventType.FEEDBACK, OPEN, BUTTON_ONE)))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("a rejected answer stops before delivering anything")
        void rejectedAnswer() {
            when(dispatcher.handleFeedback(anyString(), any(InboundAnswer.class)))
                    .thenThrow(new ValidationException("Button 9 does not exist on message 123"));

            assertThatThrownBy(() -> deliveryService.handle(new WebhookEvent(WebhookEventType.FEEDBACK, OPEN,
                    new FeedbackPayload("123", AnswerType.BUTTON, 9, null))))
                    .isInstanceOf(ValidationException.class);
            verifyNoInteractions(router);
        }

        @Test
        @DisplayName("a feedback event needs its feedback section")
        void missingFeedback() {
            assertThatThrownBy(() -> deliveryService.handle(new WebhookEvent(WebhookEventType.FEEDBACK, OPEN, null)))
                    .isInstanceOf(ValidationException.class);
            verifyNoInteractions(dispatcher);
        }
    }

    @Test
    @DisplayName("an event without a type is rejected")
    void missingType() {
        assertThatThrownBy(() -> deliveryService.handle(new WebhookEvent(null, OPEN, null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> deliveryService.handle(null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("logging context is cleared once the event is handled")
    void clearsLoggingContext() {
        deliveryService.handle(new WebhookEvent(WebhookEventType.SESSION, CLOSED, null));

        assertThat(MDC.get(DeliveryLoggingContext.EVENT_TYPE)).isNull();
        assertThat(MDC.get(DeliveryLoggingContext.PERSON_ID)).isNull();
    }
}
