package uk.gegc.quizbot.features.delivery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Connection settings for the chat gateway that relays questions to people.
 */
@Data
@Component
@ConfigurationProperties(prefix = "quizbot.gateway")
public class GatewayProperties {

    /**
     * Base URL of the gateway; messages are posted to {@code {baseUrl}/message}.
     */
    private String baseUrl = "http://localhost:8081";

    /**
     * Identifier of this service as registered with the gateway.
     */
    private String serviceId = "quizbot";

    /**
     * Label of the first button of every test question, meaning the person does not know the answer.
     */
    private String dontKnowLabel = "Don't know";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(10);
}
