package uk.gegc.quizbot.features.routing.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import uk.gegc.quizbot.BaseUnitTest;
import uk.gegc.quizbot.features.delivery.application.MessageBatch;
import uk.gegc.quizbot.features.delivery.application.MessageDispatcher;
import uk.gegc.quizbot.features.delivery.domain.model.GatewayMessage;
import uk.gegc.quizbot.features.delivery.domain.model.OpenQuestionMessage;
import uk.gegc.quizbot.features.delivery.domain.model.TestQuestionMessage;
import uk.gegc.quizbot.features.generator.application.Generator;
import uk.gegc.quizbot.features.generator.application.ScheduledItem;
import uk.gegc.quizbot.features.generator.config.GeneratorProperties;
import uk.gegc.quizbot.features.person.application.PersonDirectory;
import uk.gegc.quizbot.features.person.domain.model.GroupLevel;
import uk.gegc.quizbot.features.person.domain.model.Person;
import uk.gegc.quizbot.features.question.domain.model.OpenQuestion;
import uk.gegc.quizbot.features.question.domain.model.TestQuestion;
import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;
import uk.gegc.quizbot.features.record.domain.model.AnswerState;
import uk.gegc.quizbot.features.record.domain.model.OpenRecord;
import uk.gegc.quizbot.features.record.domain.model.TestRecord;
import uk.gegc.quizbot.features.record.domain.repository.AnswerRecordRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static uk.gegc.quizbot.QuizBotFixtures.*;

@DisplayName("PersonRouter")
class PersonRouterTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private Generator generator;

    @Mock
    private PersonDirectory personDirectory;

    @Mock
    private AnswerRecordRepository recordRepository;

    @Mock
    private MessageDispatcher dispatcher;

    private final GeneratorProperties generatorProperties = new GeneratorProperties();
    private PersonRouter router;
    private final Person alice = person("alice", new GroupLevel("g1", 1));
    private final Person bob = person("bob", new GroupLevel("g1", 1));

    @BeforeEach
    void setUp() {
        router = new PersonRouter(generator, personDirectory, recordRepository, dispatcher,
                generatorProperties, inlineTransactions(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("a fresh question becomes a saved record asked now with its message queued")
    void prepareNext_freshQuestion() {
        TestQuestion question = testQuestion("1", List.of("a", "b"), "g1");
        when(personDirectory.getPerson("alice")).thenReturn(alice);
        when(generator.nextBunch(alice, 1)).thenReturn(List.of(ScheduledItem.fresh(question)));
        MessageBatch batch = new MessageBatch("Don't know");

        List<AnswerRecord> prepared = router.prepareNext("alice", batch);

        assertThat(prepared).hasSize(1);
        AnswerRecord record = prepared.get(0);
        assertThat(record).isInstanceOf(TestRecord.class);
        assertThat(record.getPersonId()).isEqualTo("alice");
        assertThat(record.getAskTime()).isEqualTo(NOW);
        assertThat(record.getState()).isEqualTo(AnswerState.NOT_ANSWERED);
        verify(recordRepository).save(record);

        List<GatewayMessage> queued = batch.drain();
        assertThat(queued).singleElement().isInstanceOf(TestQuestionMessage.class);
        assertThat(queued.get(0).transferTarget()).contains(record);
    }

    @Test
    @DisplayName("a planned record is queued again without being re-created or saved")
    void prepareNext_plannedRecord() {
        OpenQuestion question = openQuestion("x", "g1");
        AnswerRecord overdue = savedRecord(question, "alice", NOW.minusSeconds(3600));
        when(generator.nextBunch(alice, 1)).thenReturn(List.of(ScheduledItem.planned(overdue)));
        MessageBatch batch = new MessageBatch("Don't know");

        List<AnswerRecord> prepared = router.prepareNext(alice, batch);

        assertThat(prepared).containsExactly(overdue);
        assertThat(overdue.getAskTime()).isEqualTo(NOW.minusSeconds(3600));
        verify(recordRepository, never()).save(any());
        assertThat(batch.drain()).singleElement().isInstanceOf(OpenQuestionMessage.class);
    }

    @Test
    @DisplayName("a failing save drops every message queued by that call")
    void prepareNext_failureDiscardsQueuedMessages() {
        MessageBatch batch = new MessageBatch("Don't know");
        batch.createOpen((OpenRecord) savedRecord(openQuestion("earlier", "g1"), "bob", NOW));
        when(generator.nextBunch(alice, 2)).thenReturn(List.of(
                ScheduledItem.fresh(openQuestion("a", "g1")),
                ScheduledItem.fresh(openQuestion("b", "g1"))));
        when(recordRepository.save(any(AnswerRecord.class)))
                .thenAnswer(inv -> inv.getArgument(0))
                .thenThrow(new IllegalStateException("db down"));
        generatorProperties.setBatchSize(2);

        assertThatThrownBy(() -> router.prepareNext(alice, batch))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("db down");

        assertThat(batch.size()).isEqualTo(1);
        assertThat(batch.drain().get(0).getPersonId()).isEqualTo("bob");
    }

    @Test
    @DisplayName("routeMultiple keeps going after one person fails and sends what was prepared")
    void routeMultiple_isolatesFailures() {
        MessageBatch batch = new MessageBatch("Don't know");
        when(dispatcher.newBatch()).thenReturn(batch);
        when(personDirectory.findAll()).thenReturn(List.of(alice, bob));
        when(generator.nextBunch(alice, 1)).thenThrow(new IllegalStateException("boom"));
        when(generator.nextBunch(bob, 1)).thenReturn(List.of(ScheduledItem.fresh(openQuestion("x", "g1"))));
        when(dispatcher.sendMessages(batch)).thenReturn(1);

        RoutingSummary summary = router.routeMultiple();

        assertThat(summary).isEqualTo(new RoutingSummary(2, 1, 1, 1));
        verify(dispatcher).sendMessages(batch);
    }

    @Test
    @DisplayName("routeMultiple with nobody in the directory sends nothing")
    void routeMultiple_empty() {
        MessageBatch batch = new MessageBatch("Don't know");
        when(dispatcher.newBatch()).thenReturn(batch);
        when(personDirectory.findAll()).thenReturn(List.of());

        RoutingSummary summary = router.routeMultiple();

        assertThat(summary).isEqualTo(new RoutingSummary(0, 0, 0, 0));
        verifyNoInteractions(generator);
    }
}
