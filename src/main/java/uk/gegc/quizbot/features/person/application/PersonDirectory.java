package uk.gegc.quizbot.features.person.application;

import uk.gegc.quizbot.features.person.domain.model.Person;

import java.util.List;

/**
 * Read-only view of the people that receive questions.
 */
public interface PersonDirectory {

    List<Person> findAll();

    /**
     * @throws uk.gegc.quizbot.shared.exception.ResourceNotFoundException when no such person exists
     */
    Person getPerson(String personId);
}
