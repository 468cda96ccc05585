package uk.gegc.quizbot.features.person.infra;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;
import uk.gegc.quizbot.features.person.application.PersonDirectory;
import uk.gegc.quizbot.features.person.config.DirectoryProperties;
import uk.gegc.quizbot.features.person.domain.model.GroupLevel;
import uk.gegc.quizbot.features.person.domain.model.Person;
import uk.gegc.quizbot.shared.exception.DirectoryException;
import uk.gegc.quizbot.shared.exception.ResourceNotFoundException;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads people from a FusionAuth user API.
 *
 * <p>Group levels are kept in each user's {@code data.groupLevels}; only entries for groups the
 * user is currently a member of (per {@code memberships}) count.
 */
@Slf4j
@Component
public class FusionAuthPersonDirectory implements PersonDirectory {

    private final RestTemplate restTemplate;
    private final DirectoryProperties properties;

    public FusionAuthPersonDirectory(@Qualifier("directoryRestTemplate") RestTemplate restTemplate,
                                     DirectoryProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public List<Person> findAll() {
        URI uri = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
                .path("/api/user/search")
                .queryParam("queryString", "*")
                .build()
                .toUri();
        JsonNode body = get(uri, null);
        List<Person> people = new ArrayList<>();
        for (JsonNode user : body.path("users")) {
            people.add(toPerson(user));
        }
        log.debug("Directory returned {} people", people.size());
        return people;
    }

    @Override
    public Person getPerson(String personId) {
        URI uri = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
                .path("/api/user/{id}")
                .buildAndExpand(personId)
                .toUri();
        JsonNode user = get(uri, personId).path("user");
        if (user.isMissingNode() || user.isNull()) {
            throw new DirectoryException("Directory response for person " + personId + " has no user");
        }
        return toPerson(user);
    }

    /**
     * @param personId set when a single person is requested, turning a 404 into {@link ResourceNotFoundException}
     */
    private JsonNode get(URI uri, String personId) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, properties.getApiToken());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class);
        } catch (HttpStatusCodeException e) {
            if (personId != null && e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                throw new ResourceNotFoundException("Person " + personId + " not found");
            }
            throw new DirectoryException("Directory request to " + uri.getPath()
                    + " failed with status " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new DirectoryException("Directory request to " + uri.getPath() + " failed", e);
        }
        JsonNode body = response.getBody();
        if (body == null) {
            throw new DirectoryException("Directory returned an empty body for " + uri.getPath());
        }
        return body;
    }

    private Person toPerson(JsonNode user) {
        String id = user.path("id").asText(null);
        if (id == null || id.isBlank()) {
            throw new DirectoryException("Directory user without id");
        }
        String fullName = user.path("fullName").asText("");
        if (fullName.isBlank()) {
            fullName = properties.getDefaultName();
        }

        Set<String> memberOf = new HashSet<>();
        for (JsonNode membership : user.path("memberships")) {
            String groupId = membership.path("groupId").asText(null);
            if (groupId != null) {
                memberOf.add(groupId);
            }
        }

        List<GroupLevel> groups = new ArrayList<>();
        for (JsonNode entry : user.path("data").path("groupLevels")) {
            String groupId = entry.path("groupId").asText(null);
            if (groupId != null && memberOf.contains(groupId)) {
                groups.add(new GroupLevel(groupId, entry.path("level").asInt(0)));
            }
        }
        return new Person(id, fullName, groups);
    }
}
