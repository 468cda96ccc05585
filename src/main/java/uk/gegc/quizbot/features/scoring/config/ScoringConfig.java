package uk.gegc.quizbot.features.scoring.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.quizbot.features.scoring.application.PointsCalculator;
import uk.gegc.quizbot.features.scoring.application.impl.EmbeddingSimilarityCalculator;
import uk.gegc.quizbot.features.scoring.application.impl.SimpleCalculator;

@Slf4j
@Configuration
public class ScoringConfig {

    @Bean
    public PointsCalculator pointsCalculator(ScoringProperties properties,
                                             ObjectProvider<EmbeddingModel> embeddingModel) {
        if (properties.isSemanticEnabled()) {
            EmbeddingModel model = embeddingModel.getIfAvailable();
            if (model != null) {
                log.info("Open answers are scored by embedding similarity");
                return new EmbeddingSimilarityCalculator(model);
            }
            log.warn("Semantic scoring enabled but no EmbeddingModel bean is configured; using exact-match scoring");
        }
        return new SimpleCalculator(properties.getDefaultOpenScore());
    }
}
