package uk.gegc.quizbot.features.person.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Connection settings for the FusionAuth directory that lists people and their group levels.
 */
@Data
@Component
@ConfigurationProperties(prefix = "quizbot.directory")
public class DirectoryProperties {

    private String baseUrl = "http://localhost:9011";

    /**
     * API key sent verbatim in the {@code Authorization} header.
     */
    private String apiToken = "";

    /**
     * Display name used when a user has none.
     */
    private String defaultName = "Name";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(10);
}
