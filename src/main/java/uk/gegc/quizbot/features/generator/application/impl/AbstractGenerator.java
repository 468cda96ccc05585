package uk.gegc.quizbot.features.generator.application.impl;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.quizbot.features.generator.application.Generator;
import uk.gegc.quizbot.features.generator.application.ScheduledItem;
import uk.gegc.quizbot.features.generator.application.WeightedSampler;
import uk.gegc.quizbot.features.person.domain.model.Person;
import uk.gegc.quizbot.features.question.domain.model.Question;
import uk.gegc.quizbot.features.question.domain.repository.QuestionRepository;
import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;
import uk.gegc.quizbot.features.record.domain.model.AnswerState;
import uk.gegc.quizbot.features.record.domain.repository.AnswerRecordRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Shared planning logic: overdue records come first and strategies only choose among fresh candidates.
 * Must be called inside a transaction because candidate questions are read lazily.
 */
@Slf4j
public abstract class AbstractGenerator implements Generator {

    protected final AnswerRecordRepository recordRepository;
    protected final QuestionRepository questionRepository;
    protected final WeightedSampler sampler;
    protected final Clock clock;

    protected AbstractGenerator(AnswerRecordRepository recordRepository,
                                QuestionRepository questionRepository,
                                WeightedSampler sampler,
                                Clock clock) {
        this.recordRepository = recordRepository;
        this.questionRepository = questionRepository;
        this.sampler = sampler;
        this.clock = clock;
    }

    @Override
    public List<ScheduledItem> nextBunch(Person person, int count) {
        if (count <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        List<AnswerRecord> planned = recordRepository.findPlanned(person.id(), AnswerState.NOT_ANSWERED, now);
        if (planned.size() >= count) {
            log.debug("Person {} has {} overdue records, no fresh questions needed", person.id(), planned.size());
            return planned.subList(0, count).stream().map(ScheduledItem::planned).toList();
        }

        List<ScheduledItem> result = new ArrayList<>(count);
        planned.forEach(r -> result.add(ScheduledItem.planned(r)));

        List<Question> candidates = candidates(person, planned);
        if (candidates.isEmpty()) {
            log.debug("No candidate questions for person {}", person.id());
            return result;
        }

        List<Question> chosen = select(person, candidates, count - planned.size(), now);
        chosen.forEach(q -> result.add(ScheduledItem.fresh(q)));
        log.debug("Selected {} planned and {} fresh items for person {}", planned.size(), chosen.size(), person.id());
        return result;
    }

    /**
     * Questions sharing a group with the person, minus those already planned for them.
     */
    protected List<Question> candidates(Person person, List<AnswerRecord> planned) {
        Set<String> groupIds = person.groupIds();
        if (groupIds.isEmpty()) {
            return List.of();
        }
        Set<UUID> plannedQuestionIds = planned.stream()
                .map(r -> r.getQuestion().getId())
                .collect(Collectors.toSet());
        return questionRepository.findDistinctByGroupIds(groupIds).stream()
                .filter(q -> !plannedQuestionIds.contains(q.getId()))
                .filter(q -> q.isEligibleFor(person))
                .toList();
    }

    /**
     * Chooses up to {@code size} distinct questions from a non-empty candidate list.
     */
    protected abstract List<Question> select(Person person, List<Question> candidates, int size, Instant now);
}
