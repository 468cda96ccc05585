package uk.gegc.quizbot.features.routing.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.quizbot.features.delivery.application.MessageBatch;
import uk.gegc.quizbot.features.delivery.application.MessageDispatcher;
import uk.gegc.quizbot.features.generator.application.Generator;
import uk.gegc.quizbot.features.generator.application.ScheduledItem;
import uk.gegc.quizbot.features.generator.config.GeneratorProperties;
import uk.gegc.quizbot.features.person.application.PersonDirectory;
import uk.gegc.quizbot.features.person.domain.model.Person;
import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;
import uk.gegc.quizbot.features.record.domain.repository.AnswerRecordRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the generator's picks into records and queues their messages.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PersonRouter {

    private final Generator generator;
    private final PersonDirectory personDirectory;
    private final AnswerRecordRepository recordRepository;
    private final MessageDispatcher dispatcher;
    private final GeneratorProperties generatorProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public List<AnswerRecord> prepareNext(String personId, MessageBatch batch) {
        return prepareNext(personDirectory.getPerson(personId), batch);
    }

    /**
     * Creates records for the person's fresh questions and queues a message for every picked item.
     * Everything happens in one transaction; if it fails, the messages queued by this call are dropped.
     *
     * @return the records whose messages were queued
     */
    public List<AnswerRecord> prepareNext(Person person, MessageBatch batch) {
        int mark = batch.size();
        try {
            List<AnswerRecord> prepared = transactionTemplate.execute(status -> {
                Instant now = clock.instant();
                List<ScheduledItem> items = generator.nextBunch(person, generatorProperties.getBatchSize());
                List<AnswerRecord> records = new ArrayList<>(items.size());
                for (ScheduledItem item : items) {
                    AnswerRecord record = item.toRecord(person.id(), now);
                    record.dispatch(batch);
                    if (item.isFresh()) {
                        recordRepository.save(record);
                    }
                    records.add(record);
                }
                return records;
            });
            List<AnswerRecord> result = prepared == null ? List.of() : prepared;
            log.info("Prepared {} records for person {}", result.size(), person.id());
            return result;
        } catch (RuntimeException e) {
            batch.truncate(mark);
            throw e;
        }
    }

    /**
     * Prepares questions for everyone in the directory, then sends them in one go.
     * A person whose preparation fails is logged and skipped.
     *
     * @throws uk.gegc.quizbot.shared.exception.GatewayException if some prepared messages could not be sent
     */
    public RoutingSummary routeMultiple() {
        MessageBatch batch = dispatcher.newBatch();
        List<Person> people = personDirectory.findAll();
        int failed = 0;
        int prepared = 0;
        for (Person person : people) {
            MDC.put("person_id", person.id());
            try {
                prepared += prepareNext(person, batch).size();
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to prepare questions for person {}", person.id(), e);
            } finally {
                MDC.remove("person_id");
            }
        }
        int sent = dispatcher.sendMessages(batch);
        RoutingSummary summary = new RoutingSummary(people.size(), failed, prepared, sent);
        log.info("Routing finished: {}", summary);
        return summary;
    }
}
