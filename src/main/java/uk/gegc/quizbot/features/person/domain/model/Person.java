package uk.gegc.quizbot.features.person.domain.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

public record Person(String id, String fullName, List<GroupLevel> groups) {

    public Person {
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public Set<String> groupIds() {
        return groups.stream()
                .map(GroupLevel::groupId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Highest level the person holds in any of the given groups.
     */
    public OptionalInt maxLevelIn(Collection<String> groupIds) {
        return groups.stream()
                .filter(g -> groupIds.contains(g.groupId()))
                .mapToInt(GroupLevel::level)
                .max();
    }
}
