package uk.gegc.quizbot.features.scoring.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "quizbot.scoring")
public class ScoringProperties {

    /**
     * Score open answers by embedding similarity when an embedding model is configured.
     */
    private boolean semanticEnabled = false;

    /**
     * Provisional score given to every open answer when semantic scoring is off.
     */
    private double defaultOpenScore = 0.5;
}
