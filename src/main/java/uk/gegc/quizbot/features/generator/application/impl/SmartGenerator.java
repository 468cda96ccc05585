package uk.gegc.quizbot.features.generator.application.impl;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.quizbot.features.generator.application.WeightedSampler;
import uk.gegc.quizbot.features.generator.config.GeneratorProperties;
import uk.gegc.quizbot.features.person.domain.model.Person;
import uk.gegc.quizbot.features.question.domain.model.Question;
import uk.gegc.quizbot.features.question.domain.repository.QuestionRepository;
import uk.gegc.quizbot.features.record.domain.model.AnswerState;
import uk.gegc.quizbot.features.record.domain.repository.AnswerHistory;
import uk.gegc.quizbot.features.record.domain.repository.AnswerRecordRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Spaced-repetition style selection.
 *
 * <p>A question the person has scored on is weighted by the time since it was last asked per point earned,
 * scaled by an oscillating envelope over the periods since it was first asked and by how well its level
 * fits the person. Questions without points get a multiple of the highest weight so untried material wins.
 * Questions another person is still working on are never picked.
 */
@Slf4j
public class SmartGenerator extends AbstractGenerator {

    private static final double LN_2 = Math.log(2);

    private final GeneratorProperties properties;

    public SmartGenerator(AnswerRecordRepository recordRepository,
                          QuestionRepository questionRepository,
                          WeightedSampler sampler,
                          Clock clock,
                          GeneratorProperties properties) {
        super(recordRepository, questionRepository, sampler, clock);
        if (properties.getPeriodUnit() == null || properties.getPeriodUnit().isZero()
                || properties.getPeriodUnit().isNegative()) {
            throw new IllegalArgumentException("Generator period unit must be positive");
        }
        if (properties.getMu() <= 0 || Double.isNaN(properties.getMu())) {
            throw new IllegalArgumentException("Generator mu must be positive");
        }
        if (properties.getSigma() <= 0) {
            throw new IllegalArgumentException("Generator sigma must be positive");
        }
        this.properties = properties;
    }

    @Override
    protected List<Question> select(Person person, List<Question> candidates, int size, Instant now) {
        List<UUID> ids = candidates.stream().map(Question::getId).toList();
        Map<UUID, AnswerHistory> history = recordRepository.findAnswerHistory(person.id(), ids).stream()
                .collect(Collectors.toMap(AnswerHistory::questionId, Function.identity()));
        Set<UUID> blocked = new HashSet<>(
                recordRepository.findQuestionIdsHeldByOthers(ids, person.id(), AnswerState.ANSWERED));

        double[] weights = computeWeights(person, candidates, history, blocked, now);

        List<Question> open = new ArrayList<>(candidates.size());
        List<Double> openWeights = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            if (!blocked.contains(candidates.get(i).getId())) {
                open.add(candidates.get(i));
                openWeights.add(weights[i]);
            }
        }
        if (open.isEmpty()) {
            log.debug("All {} candidates for person {} are held by other people", candidates.size(), person.id());
            return List.of();
        }
        double[] distribution = WeightedSampler.normalize(
                openWeights.stream().mapToDouble(Double::doubleValue).toArray());
        return sampler.sample(open, distribution, size);
    }

    /**
     * Raw selection weight per candidate, in candidate order. Blocked candidates weigh 0.
     */
    double[] computeWeights(Person person,
                            List<Question> candidates,
                            Map<UUID, AnswerHistory> history,
                            Set<UUID> blocked,
                            Instant now) {
        double[] weights = new double[candidates.size()];
        boolean[] unset = new boolean[candidates.size()];
        double maxComputed = 0;

        for (int i = 0; i < candidates.size(); i++) {
            Question question = candidates.get(i);
            if (blocked.contains(question.getId())) {
                weights[i] = 0;
                continue;
            }
            AnswerHistory h = history.get(question.getId());
            if (h == null || h.pointsSum() == null || h.pointsSum() <= 0) {
                unset[i] = true;
                continue;
            }
            weights[i] = timeFactor(h, now) * levelFactor(person, question);
            maxComputed = Math.max(maxComputed, weights[i]);
        }

        double placeholder = maxComputed > 0 ? properties.getUnsetWeightMultiplier() * maxComputed : 1.0;
        for (int i = 0; i < weights.length; i++) {
            if (unset[i]) {
                weights[i] = placeholder;
            }
        }
        return weights;
    }

    double timeFactor(AnswerHistory history, Instant now) {
        double elapsedPeriods = nonNegativeMillis(history.firstAskTime(), now)
                / (double) properties.getPeriodUnit().toMillis();
        double gapSeconds = nonNegativeMillis(history.lastAskTime(), now) / 1000.0;

        double factor = gapSeconds / history.pointsSum();
        double shifted = elapsedPeriods + properties.getMu();
        double envelope = Math.pow(Math.abs(Math.cos(Math.PI * log2(shifted))), shifted * shifted / properties.getSigma());
        return factor * (envelope + properties.getCorrectingValue());
    }

    static double levelFactor(Person person, Question question) {
        if (question.getLevel() == null) {
            return 1.0;
        }
        OptionalInt target = person.maxLevelIn(question.groupIds());
        if (target.isEmpty()) {
            return 1.0;
        }
        double diff = target.getAsInt() - question.getLevel();
        return Math.exp(-0.5 * diff * diff);
    }

    private static long nonNegativeMillis(Instant from, Instant to) {
        if (from == null) {
            return 0;
        }
        return Math.max(0, Duration.between(from, to).toMillis());
    }

    private static double log2(double x) {
        return Math.log(x) / LN_2;
    }
}
