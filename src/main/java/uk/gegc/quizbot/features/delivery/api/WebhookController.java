package uk.gegc.quizbot.features.delivery.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.quizbot.features.delivery.api.dto.WebhookEvent;
import uk.gegc.quizbot.features.delivery.api.dto.WebhookResponse;
import uk.gegc.quizbot.features.delivery.application.DeliveryService;

/**
 * Receives session and answer events from the chat gateway.
 */
@Slf4j
@RestController
@RequestMapping("/webhook")
@RequiredArgsConstructor
public class WebhookController {

    private final DeliveryService deliveryService;

    @PostMapping({"", "/"})
    public ResponseEntity<WebhookResponse> handle(@Valid @RequestBody WebhookEvent event) {
        log.debug("Webhook event received: {}", event.type());
        deliveryService.handle(event);
        return ResponseEntity.ok(WebhookResponse.handled());
    }
}
