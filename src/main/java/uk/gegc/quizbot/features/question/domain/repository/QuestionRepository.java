package uk.gegc.quizbot.features.question.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.quizbot.features.question.domain.model.Question;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface QuestionRepository extends JpaRepository<Question, UUID> {

    @Query("SELECT DISTINCT q FROM Question q JOIN q.groups g WHERE g.groupId IN :groupIds ORDER BY q.id")
    List<Question> findDistinctByGroupIds(@Param("groupIds") Collection<String> groupIds);
}
