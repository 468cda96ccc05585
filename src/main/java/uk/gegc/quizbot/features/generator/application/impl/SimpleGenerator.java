package uk.gegc.quizbot.features.generator.application.impl;

import uk.gegc.quizbot.features.generator.application.WeightedSampler;
import uk.gegc.quizbot.features.person.domain.model.Person;
import uk.gegc.quizbot.features.question.domain.model.Question;
import uk.gegc.quizbot.features.question.domain.repository.QuestionRepository;
import uk.gegc.quizbot.features.record.domain.repository.AnswerRecordRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Picks fresh questions uniformly at random.
 */
public class SimpleGenerator extends AbstractGenerator {

    public SimpleGenerator(AnswerRecordRepository recordRepository,
                           QuestionRepository questionRepository,
                           WeightedSampler sampler,
                           Clock clock) {
        super(recordRepository, questionRepository, sampler, clock);
    }

    @Override
    protected List<Question> select(Person person, List<Question> candidates, int size, Instant now) {
        return sampler.sampleUniform(candidates, size);
    }
}
