package uk.gegc.quizbot.features.routing.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.quizbot.features.routing.application.PersonRouter;

/**
 * Periodically sends everyone their next question.
 * Enabled by {@code quizbot.routing.enabled}; the schedule is {@code quizbot.routing.cron}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "quizbot.routing.enabled", havingValue = "true")
public class QuestionRoutingScheduler {

    private final PersonRouter router;

    @Scheduled(cron = "${quizbot.routing.cron:0 0 10 * * *}", zone = "${app.timezone:UTC}")
    public void routeQuestions() {
        log.debug("Running scheduled question routing");
        try {
            router.routeMultiple();
        } catch (Exception e) {
            log.error("Error during scheduled question routing", e);
        }
    }
}
