package uk.gegc.quizbot.features.generator.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.quizbot.features.generator.application.Generator;
import uk.gegc.quizbot.features.generator.application.WeightedSampler;
import uk.gegc.quizbot.features.generator.application.impl.SimpleGenerator;
import uk.gegc.quizbot.features.generator.application.impl.SmartGenerator;
import uk.gegc.quizbot.features.question.domain.repository.QuestionRepository;
import uk.gegc.quizbot.features.record.domain.repository.AnswerRecordRepository;

import java.time.Clock;
import java.util.Random;

@Slf4j
@Configuration
public class GeneratorConfig {

    @Bean
    public Random questionRandom(GeneratorProperties properties) {
        if (properties.getSeed() != null) {
            log.info("Question sampling uses fixed seed {}", properties.getSeed());
            return new Random(properties.getSeed());
        }
        return new Random();
    }

    @Bean
    public WeightedSampler weightedSampler(Random questionRandom) {
        return new WeightedSampler(questionRandom);
    }

    @Bean
    public Generator generator(GeneratorProperties properties,
                               AnswerRecordRepository recordRepository,
                               QuestionRepository questionRepository,
                               WeightedSampler sampler,
                               Clock clock) {
        log.info("Using {} question generator", properties.getStrategy());
        return switch (properties.getStrategy()) {
            case SIMPLE -> new SimpleGenerator(recordRepository, questionRepository, sampler, clock);
            case SMART -> new SmartGenerator(recordRepository, questionRepository, sampler, clock, properties);
        };
    }
}
