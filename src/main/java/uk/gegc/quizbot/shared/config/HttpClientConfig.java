package uk.gegc.quizbot.shared.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import uk.gegc.quizbot.features.delivery.config.GatewayProperties;
import uk.gegc.quizbot.features.person.config.DirectoryProperties;

/**
 * One {@link RestTemplate} per upstream so each carries its own timeouts.
 */
@Configuration
public class HttpClientConfig {

    @Bean("gatewayRestTemplate")
    public RestTemplate gatewayRestTemplate(RestTemplateBuilder builder, GatewayProperties properties) {
        return builder
                .connectTimeout(properties.getConnectTimeout())
                .readTimeout(properties.getReadTimeout())
                .build();
    }

    @Bean("directoryRestTemplate")
    public RestTemplate directoryRestTemplate(RestTemplateBuilder builder, DirectoryProperties properties) {
        return builder
                .connectTimeout(properties.getConnectTimeout())
                .readTimeout(properties.getReadTimeout())
                .build();
    }
}
