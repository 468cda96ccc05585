package uk.gegc.quizbot.features.generator.application;

import uk.gegc.quizbot.features.person.domain.model.Person;

import java.util.List;

/**
 * Decides what a person should be asked next.
 */
public interface Generator {

    /**
     * Returns at most {@code count} items: overdue records of the person first, oldest first,
     * then fresh questions chosen by the strategy to fill the remainder.
     */
    List<ScheduledItem> nextBunch(Person person, int count);
}
