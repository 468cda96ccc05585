package uk.gegc.quizbot.features.question.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.quizbot.features.person.domain.model.Person;
import uk.gegc.quizbot.features.record.domain.model.AnswerRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A question that can be asked of people belonging to at least one of its groups.
 * The question owns its group links and every record created from it.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "questions")
@Inheritance(strategy = InheritanceType.SINGLE_TABLE)
@DiscriminatorColumn(name = "type", discriminatorType = DiscriminatorType.STRING, length = 20)
public abstract class Question {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "text", nullable = false, length = 1000)
    private String text;

    @Column(name = "subject")
    private String subject;

    @Column(name = "answer", nullable = false, length = 1000)
    private String answer;

    @Column(name = "level")
    private Integer level;

    @Column(name = "article_url", length = 2048)
    private String articleUrl;

    @OneToMany(mappedBy = "question", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<QuestionGroup> groups = new ArrayList<>();

    @OneToMany(mappedBy = "question", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<AnswerRecord> records = new ArrayList<>();

    public abstract QuestionType type();

    /**
     * Creates a record of the matching variant for the given person.
     * The record is linked to this question but not added to {@link #getRecords()};
     * it becomes part of the question once persisted.
     */
    public abstract AnswerRecord initRecord(String personId);

    /**
     * Options shown to the person; empty for free-text questions.
     */
    public List<String> answerOptions() {
        return List.of();
    }

    public void addGroup(String groupId) {
        QuestionGroup group = new QuestionGroup();
        group.setGroupId(groupId);
        group.setQuestion(this);
        groups.add(group);
    }

    public Set<String> groupIds() {
        return groups.stream()
                .map(QuestionGroup::getGroupId)
                .collect(Collectors.toSet());
    }

    public boolean isEligibleFor(Person person) {
        Set<String> own = groupIds();
        return person.groupIds().stream().anyMatch(own::contains);
    }

    protected <R extends AnswerRecord> R bind(R record, String personId) {
        record.setQuestion(this);
        record.setPersonId(personId);
        return record;
    }

    @Override
    public String toString() {
        return "Question{id=" + id + ", type=" + type() + ", level=" + level + "}";
    }
}
