package uk.gegc.quizbot.features.record.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;
import uk.gegc.quizbot.features.record.domain.model.AnswerState;
import uk.gegc.quizbot.features.record.domain.repository.AnswerRecordRepository;
import uk.gegc.quizbot.shared.exception.RecordStateException;
import uk.gegc.quizbot.shared.exception.ResourceNotFoundException;
import uk.gegc.quizbot.shared.exception.ValidationException;

import java.util.List;
import java.util.UUID;

/**
 * Human review of answers that could not be scored automatically.
 *
 * <p>Open answers end in {@code PENDING}. While pending, the question stays held for everyone else, so
 * a reviewer has to {@link #confirm(UUID, double) confirm} the answer before it can be routed again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerReviewService {

    private final AnswerRecordRepository recordRepository;
    private final TransactionTemplate transactionTemplate;

    /**
     * Answers waiting for a reviewer, oldest reply first.
     */
    public List<AnswerRecord> pendingReviews() {
        return recordRepository.findByStateOrderByAnswerTimeAscIdAsc(AnswerState.PENDING);
    }

    /**
     * Replaces the points of a pending answer and keeps it pending.
     *
     * @throws ResourceNotFoundException if no such record exists
     * @throws RecordStateException      if the record is not pending
     * @throws ValidationException       if the points are outside [0, 1]
     */
    public AnswerRecord revise(UUID recordId, double points) {
        return transactionTemplate.execute(status -> {
            AnswerRecord record = lock(recordId);
            record.revise(points);
            AnswerRecord saved = recordRepository.save(record);
            log.info("Revised pending answer {} of person {} to {} points", recordId, saved.getPersonId(), points);
            return saved;
        });
    }

    /**
     * Settles a pending answer with its final points and releases the question for other people.
     *
     * @throws ResourceNotFoundException if no such record exists
     * @throws RecordStateException      if the record is not pending
     * @throws ValidationException       if the points are outside [0, 1]
     */
    public AnswerRecord confirm(UUID recordId, double points) {
        return transactionTemplate.execute(status -> {
            AnswerRecord record = lock(recordId);
            record.confirm(points);
            AnswerRecord saved = recordRepository.save(record);
            log.info("Confirmed answer {} of person {} with {} points", recordId, saved.getPersonId(), points);
            return saved;
        });
    }

    private AnswerRecord lock(UUID recordId) {
        return recordRepository.findByIdForUpdate(recordId)
                .orElseThrow(() -> new ResourceNotFoundException("Record " + recordId + " not found"));
    }
}
