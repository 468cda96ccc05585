package uk.gegc.quizbot.features.delivery.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import uk.gegc.quizbot.features.delivery.application.ChatGateway;
import uk.gegc.quizbot.features.delivery.config.GatewayProperties;
import uk.gegc.quizbot.features.delivery.domain.model.OutboundMessage;
import uk.gegc.quizbot.features.delivery.infra.dto.OutboundBatch;
import uk.gegc.quizbot.shared.exception.GatewayException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Posts messages to the Telegram connector service, one message per request.
 *
 * <p>The connector answers with {@code {"sent_messages": [{"message_id": 123}]}}; the id is the handle.
 */
@Slf4j
@Component
public class TelegramGatewayClient implements ChatGateway {

    private static final Pattern NUMERIC_HANDLE = Pattern.compile("\\d+");

    private final RestTemplate restTemplate;
    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;

    public TelegramGatewayClient(@Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
                                 GatewayProperties properties,
                                 ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String send(OutboundMessage message) {
        String url = properties.getBaseUrl() + "/message";
        OutboundBatch request = new OutboundBatch(properties.getServiceId(), List.of(message));

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, request, String.class);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            throw new GatewayException("Gateway rejected message to " + message.userId() + " with status " + status,
                    status, e);
        } catch (RestClientException e) {
            throw new GatewayException("Gateway unreachable at " + url, e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            int status = response.getStatusCode().value();
            throw new GatewayException("Gateway answered with status " + status, status, null);
        }
        String handle = parseHandle(response.getBody());
        log.debug("Gateway accepted {} message to {} as {}", message.type(), message.userId(), handle);
        return handle;
    }

    String parseHandle(String body) {
        if (body == null || body.isBlank()) {
            throw new GatewayException("Gateway returned an empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GatewayException("Gateway returned malformed JSON", e);
        }
        JsonNode id = root.path("sent_messages").path(0).path("message_id");
        if (id.isMissingNode() || id.isNull()) {
            throw new GatewayException("Gateway response has no sent_messages[0].message_id");
        }
        String handle = id.asText();
        if (!NUMERIC_HANDLE.matcher(handle).matches()) {
            throw new GatewayException("Gateway returned non-numeric message id '" + handle + "'");
        }
        return handle;
    }
}
