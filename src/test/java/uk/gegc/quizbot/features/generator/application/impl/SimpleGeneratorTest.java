package uk.gegc.quizbot.features.generator.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import uk.gegc.quizbot.BaseUnitTest;
import uk.gegc.quizbot.features.generator.application.ScheduledItem;
import uk.gegc.quizbot.features.generator.application.WeightedSampler;
import uk.gegc.quizbot.features.person.domain.model.GroupLevel;
import uk.gegc.quizbot.features.person.domain.model.Person;
import uk.gegc.quizbot.features.question.domain.model.Question;
import uk.gegc.quizbot.features.question.domain.repository.QuestionRepository;
import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;
import uk.gegc.quizbot.features.record.domain.model.AnswerState;
import uk.gegc.quizbot.features.record.domain.repository.AnswerRecordRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static uk.gegc.quizbot.QuizBotFixtures.*;

@DisplayName("SimpleGenerator")
class SimpleGeneratorTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private AnswerRecordRepository recordRepository;

    @Mock
    private QuestionRepository questionRepository;

    private SimpleGenerator generator;
    private final Person person = person("p1", new GroupLevel("g1", 1));

    @BeforeEach
    void setUp() {
        generator = new SimpleGenerator(recordRepository, questionRepository,
                new WeightedSampler(new Random(5)), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("returns exactly count planned records and no fresh questions when enough are overdue")
    void plannedCoverCount() {
        List<AnswerRecord> planned = List.of(
                savedRecord(openQuestion("a", "g1"), "p1", NOW.minusSeconds(30)),
                savedRecord(openQuestion("b", "g1"), "p1", NOW.minusSeconds(20)),
                savedRecord(openQuestion("c", "g1"), "p1", NOW.minusSeconds(10)));
        when(recordRepository.findPlanned("p1", AnswerState.NOT_ANSWERED, NOW)).thenReturn(planned);

        List<ScheduledItem> items = generator.nextBunch(person, 2);

        assertThat(items).hasSize(2).noneMatch(ScheduledItem::isFresh);
        assertThat(items).extracting(i -> i.toRecord("p1", NOW)).containsExactly(planned.get(0), planned.get(1));
        verifyNoInteractions(questionRepository);
    }

    @Test
    @DisplayName("a person without groups only gets planned records and the question store is not queried")
    void noGroups_onlyPlanned() {
        AnswerRecord overdue = savedRecord(openQuestion("a", "g1"), "p2", NOW.minusSeconds(5));
        when(recordRepository.findPlanned("p2", AnswerState.NOT_ANSWERED, NOW)).thenReturn(List.of(overdue));

        List<ScheduledItem> items = generator.nextBunch(person("p2"), 3);

        assertThat(items).hasSize(1);
        assertThat(items.get(0).isFresh()).isFalse();
        verifyNoInteractions(questionRepository);
    }

    @Test
    @DisplayName("no planned records and no groups gives an empty batch")
    void noGroups_nothingPlanned_empty() {
        when(recordRepository.findPlanned(any(), any(), any())).thenReturn(List.of());

        assertThat(generator.nextBunch(person("p3"), 1)).isEmpty();
    }

    @Test
    @DisplayName("fills the remainder with distinct fresh questions, skipping already planned ones")
    void fillsWithFreshQuestions() {
        Question plannedQuestion = testQuestion("1", List.of("a"), "g1");
        AnswerRecord overdue = savedRecord(plannedQuestion, "p1", NOW.minusSeconds(5));
        Question q1 = openQuestion("x", "g1");
        Question q2 = openQuestion("y", "g1");
        when(recordRepository.findPlanned("p1", AnswerState.NOT_ANSWERED, NOW)).thenReturn(List.of(overdue));
        when(questionRepository.findDistinctByGroupIds(person.groupIds()))
                .thenReturn(List.of(plannedQuestion, q1, q2));

        List<ScheduledItem> items = generator.nextBunch(person, 5);

        assertThat(items).hasSize(3);
        assertThat(items.get(0).isFresh()).isFalse();
        assertThat(items.subList(1, 3)).allMatch(ScheduledItem::isFresh)
                .extracting(i -> ((ScheduledItem.Fresh) i).question())
                .containsExactlyInAnyOrder(q1, q2);
    }

    @Test
    @DisplayName("questions that share no group with the person are never offered")
    void skipsQuestionsOutsidePersonGroups() {
        Question own = openQuestion("x", "g1");
        Question foreign = openQuestion("y", "g2");
        when(recordRepository.findPlanned("p1", AnswerState.NOT_ANSWERED, NOW)).thenReturn(List.of());
        when(questionRepository.findDistinctByGroupIds(person.groupIds())).thenReturn(List.of(own, foreign));

        List<ScheduledItem> items = generator.nextBunch(person, 2);

        assertThat(items).extracting(i -> ((ScheduledItem.Fresh) i).question()).containsExactly(own);
    }

    @Test
    @DisplayName("count of zero returns nothing")
    void zeroCount() {
        assertThat(generator.nextBunch(person, 0)).isEmpty();
        verifyNoInteractions(recordRepository, questionRepository);
    }
}
