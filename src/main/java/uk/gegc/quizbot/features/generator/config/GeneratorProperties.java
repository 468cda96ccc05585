package uk.gegc.quizbot.features.generator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Question selection settings.
 */
@Data
@Component
@ConfigurationProperties(prefix = "quizbot.generator")
public class GeneratorProperties {

    private Strategy strategy = Strategy.SMART;

    /**
     * How many items are prepared for one person per routing run.
     */
    private int batchSize = 1;

    /**
     * Shift of the review envelope, in periods.
     */
    private double mu = 4;

    /**
     * Width of the review envelope; larger values flatten it.
     */
    private double sigma = 20;

    /**
     * Floor added to the envelope so no answered question drops to zero weight.
     */
    private double correctingValue = 0.001;

    /**
     * Length of one period when measuring time since a question was first asked.
     */
    private Duration periodUnit = Duration.ofDays(1);

    /**
     * Questions never answered get this multiple of the highest computed weight.
     */
    private double unsetWeightMultiplier = 10;

    /**
     * Fixed seed for reproducible sampling; random when unset.
     */
    private Long seed;

    public enum Strategy {
        SIMPLE,
        SMART
    }
}
