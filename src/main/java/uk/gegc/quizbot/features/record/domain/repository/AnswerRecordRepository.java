package uk.gegc.quizbot.features.record.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;
import uk.gegc.quizbot.features.record.domain.model.AnswerState;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AnswerRecordRepository extends JpaRepository<AnswerRecord, UUID> {

    /**
     * Records of a person in the given state whose ask time has passed, oldest first.
     */
    @Query("SELECT r FROM AnswerRecord r WHERE r.personId = :personId AND r.state = :state " +
            "AND r.askTime <= :now ORDER BY r.askTime ASC, r.id ASC")
    List<AnswerRecord> findPlanned(@Param("personId") String personId,
                                   @Param("state") AnswerState state,
                                   @Param("now") Instant now);

    Optional<AnswerRecord> findFirstByPersonIdAndStateOrderByAskTimeDesc(String personId, AnswerState state);

    Optional<AnswerRecord> findByMessageHandle(String messageHandle);

    List<AnswerRecord> findByStateOrderByAnswerTimeAscIdAsc(AnswerState state);

    /**
     * Locks the record so concurrent acknowledgements of one message are applied one at a time.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM AnswerRecord r WHERE r.messageHandle = :handle")
    Optional<AnswerRecord> findByMessageHandleForUpdate(@Param("handle") String handle);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM AnswerRecord r WHERE r.id = :id")
    Optional<AnswerRecord> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT new uk.gegc.quizbot.features.record.domain.repository.AnswerHistory(" +
            "r.question.id, SUM(r.points), MIN(r.askTime), MAX(r.askTime)) " +
            "FROM AnswerRecord r WHERE r.personId = :personId AND r.question.id IN :questionIds " +
            "GROUP BY r.question.id")
    List<AnswerHistory> findAnswerHistory(@Param("personId") String personId,
                                          @Param("questionIds") Collection<UUID> questionIds);

    /**
     * Questions among {@code questionIds} that some other person still has an unfinished record for.
     */
    @Query("SELECT DISTINCT r.question.id FROM AnswerRecord r WHERE r.question.id IN :questionIds " +
            "AND r.personId <> :personId AND r.state <> :finalState")
    List<UUID> findQuestionIdsHeldByOthers(@Param("questionIds") Collection<UUID> questionIds,
                                           @Param("personId") String personId,
                                           @Param("finalState") AnswerState finalState);
}
