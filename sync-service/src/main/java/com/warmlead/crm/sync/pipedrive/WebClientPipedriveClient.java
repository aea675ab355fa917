package com.warmlead.crm.sync.pipedrive;

import com.fasterxml.jackson.databind.JsonNode;
import com.warmlead.crm.common.error.ErrorKind;
import com.warmlead.crm.common.remote.RemoteCallResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import reactor.core.Exceptions;

import java.net.URI;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Blocking Pipedrive v1 client on top of WebClient.
 * 
 * The token travels in the x-api-token header, never in the URL, so error messages
 * and logs that include request URIs cannot leak it.
 * 
 * ⚠️ BLOCKING: every call ends in block(). Callers run it on the sync worker threads,
 * never on a request-handling hot path.
 */
@Slf4j
public class WebClientPipedriveClient implements PipedriveClient {

    private static final String TOKEN_HEADER = "x-api-token";

    private static final ParameterizedTypeReference<PipedriveResponse<PipedriveUser>> USER_TYPE =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<PipedriveResponse<List<PipedrivePerson>>> PERSONS_TYPE =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<PipedriveResponse<List<PipedriveOrganization>>> ORGANIZATIONS_TYPE =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<PipedriveResponse<PipedriveOrganization>> ORGANIZATION_TYPE =
        new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final String apiToken;
    private final Duration requestTimeout;

    public WebClientPipedriveClient(WebClient webClient, String apiToken, Duration requestTimeout) {
        this.webClient = webClient;
        this.apiToken = apiToken;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public RemoteCallResult<PipedriveUser> testConnection() {
        return call("/users/me", builder -> builder.path("/users/me").build(), USER_TYPE)
            .map(response -> RemoteCallResult.success(response.data()), this::forward);
    }

    @Override
    public RemoteCallResult<PersonPage> getPersonsPage(LocalDateTime since, int start, int limit) {
        Outcome<PipedriveResponse<List<PipedrivePerson>>> outcome = call("/persons",
            builder -> builder.path("/persons")
                .queryParam("start", start)
                .queryParam("limit", limit)
                .queryParam("sort", "update_time ASC")
                .build(),
            PERSONS_TYPE);
        if (outcome.failure() != null) {
            return forward(outcome.failure());
        }

        PipedriveResponse<List<PipedrivePerson>> response = outcome.response();
        List<PipedrivePerson> fetched = response.data() != null ? response.data() : List.of();
        List<PipedrivePerson> persons = since == null ? fetched : fetched.stream()
            .filter(person -> isUpdatedSince(person, since))
            .toList();
        Integer nextStart = null;
        if (response.hasMoreItems()) {
            Integer reported = response.additionalData().pagination().nextStart();
            nextStart = reported != null ? reported : start + fetched.size();
        }
        return RemoteCallResult.success(new PersonPage(persons, start, fetched.size(), nextStart));
    }

    @Override
    public RemoteCallResult<List<PipedriveOrganization>> getOrganizations() {
        List<PipedriveOrganization> organizations = new ArrayList<>();
        int start = 0;
        while (true) {
            final int pageStart = start;
            Outcome<PipedriveResponse<List<PipedriveOrganization>>> outcome = call("/organizations",
                builder -> builder.path("/organizations")
                    .queryParam("start", pageStart)
                    .queryParam("limit", 500)
                    .build(),
                ORGANIZATIONS_TYPE);
            if (outcome.failure() != null) {
                return forward(outcome.failure());
            }
            PipedriveResponse<List<PipedriveOrganization>> response = outcome.response();
            if (response.data() != null) {
                organizations.addAll(response.data());
            }
            if (!response.hasMoreItems() || response.data() == null || response.data().isEmpty()) {
                return RemoteCallResult.success(organizations);
            }
            Integer nextStart = response.additionalData().pagination().nextStart();
            start = nextStart != null ? nextStart : start + response.data().size();
        }
    }

    @Override
    public RemoteCallResult<PipedriveOrganization> getOrganizationDetails(long organizationId) {
        return call("/organizations/{id}",
            builder -> builder.path("/organizations/{id}").build(organizationId),
            ORGANIZATION_TYPE)
            .map(response -> RemoteCallResult.success(response.data()), this::forward);
    }

    @Override
    public RemoteCallResult<List<PipedrivePerson>> searchPersons(String term) {
        Outcome<PipedriveResponse<JsonNode>> outcome = call("/persons/search",
            builder -> builder.path("/persons/search")
                .queryParam("term", term)
                .queryParam("fields", "name,email")
                .build(),
            new ParameterizedTypeReference<PipedriveResponse<JsonNode>>() {});
        if (outcome.failure() != null) {
            return forward(outcome.failure());
        }
        JsonNode items = outcome.response().data() != null ? outcome.response().data().path("items") : null;
        List<PipedrivePerson> persons = new ArrayList<>();
        if (items != null && items.isArray()) {
            for (JsonNode entry : items) {
                JsonNode item = entry.has("item") ? entry.get("item") : entry;
                persons.add(toPerson(item));
            }
        }
        return RemoteCallResult.success(persons);
    }

    private <T> Outcome<T> call(String endpoint, Function<UriBuilder, URI> uri,
                                ParameterizedTypeReference<T> type) {
        try {
            T response = webClient.get()
                .uri(uri)
                .header(TOKEN_HEADER, apiToken)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(type)
                .timeout(requestTimeout)
                .block();
            if (response == null) {
                return Outcome.failed(ErrorKind.EXTERNAL_API, "Pipedrive API error: empty response from " + endpoint);
            }
            if (response instanceof PipedriveResponse<?> envelope && !envelope.success()) {
                String error = envelope.error() != null ? envelope.error() : "request failed";
                return Outcome.failed(ErrorKind.EXTERNAL_API, "Pipedrive API error: " + error);
            }
            return Outcome.ok(response);
        } catch (WebClientResponseException e) {
            return Outcome.failed(classifyStatus(e.getStatusCode()), describeStatus(endpoint, e.getStatusCode()));
        } catch (WebClientRequestException e) {
            log.warn("Pipedrive request to {} failed: {}", endpoint, e.getMostSpecificCause().getMessage());
            return Outcome.failed(ErrorKind.NETWORK, "Failed to connect to Pipedrive API (" + endpoint + ")");
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                return Outcome.failed(ErrorKind.NETWORK,
                    "Pipedrive request timeout after " + requestTimeout.toMillis() + "ms (" + endpoint + ")");
            }
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                return Outcome.failed(ErrorKind.NETWORK, "Pipedrive request interrupted (" + endpoint + ")");
            }
            log.error("Unexpected error calling Pipedrive {}", endpoint, e);
            return Outcome.failed(ErrorKind.EXTERNAL_API, "Pipedrive API error: unexpected failure (" + endpoint + ")");
        }
    }

    private <T> RemoteCallResult<T> forward(RemoteCallResult<?> failure) {
        return RemoteCallResult.failure(failure.errorKind(), failure.error());
    }

    static ErrorKind classifyStatus(HttpStatusCode status) {
        int code = status.value();
        if (code == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return ErrorKind.RATE_LIMIT;
        }
        if (code == HttpStatus.UNAUTHORIZED.value() || code == HttpStatus.FORBIDDEN.value()) {
            return ErrorKind.AUTHENTICATION;
        }
        if (code == HttpStatus.BAD_REQUEST.value() || code == HttpStatus.UNPROCESSABLE_ENTITY.value()) {
            return ErrorKind.VALIDATION;
        }
        return ErrorKind.EXTERNAL_API;
    }

    private static String describeStatus(String endpoint, HttpStatusCode status) {
        return switch (classifyStatus(status)) {
            case RATE_LIMIT -> "Pipedrive rate limit exceeded (HTTP 429, " + endpoint + ")";
            case AUTHENTICATION -> "Unauthorized: Pipedrive rejected the API token (HTTP " + status.value() + ")";
            case VALIDATION -> "Pipedrive request validation failed (HTTP " + status.value() + ", " + endpoint + ")";
            default -> "Pipedrive API error: HTTP " + status.value() + " (" + endpoint + ")";
        };
    }

    private static boolean isUpdatedSince(PipedrivePerson person, LocalDateTime since) {
        LocalDateTime updated = PipedriveTimestamps.parse(person.updateTime());
        return updated == null || !updated.isBefore(since);
    }

    private static PipedrivePerson toPerson(JsonNode item) {
        JsonNode organization = item.path("organization");
        PipedriveOrgReference orgReference = null;
        if (organization.hasNonNull("id")) {
            orgReference = new PipedriveOrgReference(
                organization.get("id").asLong(),
                organization.hasNonNull("name") ? organization.get("name").asText() : null,
                organization.hasNonNull("address") ? organization.get("address").asText() : null);
        }
        return new PipedrivePerson(
            item.path("id").asLong(),
            item.path("name").asText(null),
            toFields(item.path("emails")),
            toFields(item.path("phones")),
            orgReference,
            orgReference != null ? orgReference.name() : null,
            item.path("add_time").asText(null),
            item.path("update_time").asText(null));
    }

    private static List<PipedriveContactField> toFields(JsonNode values) {
        List<PipedriveContactField> fields = new ArrayList<>();
        if (values.isArray()) {
            for (JsonNode value : values) {
                fields.add(new PipedriveContactField(value.asText(), fields.isEmpty(), null));
            }
        }
        return fields;
    }

    /**
     * Either a response or a tagged failure.
     */
    private record Outcome<T>(T response, RemoteCallResult<T> failure) {

        static <T> Outcome<T> ok(T response) {
            return new Outcome<>(response, null);
        }

        static <T> Outcome<T> failed(ErrorKind kind, String error) {
            return new Outcome<>(null, RemoteCallResult.failure(kind, error));
        }

        <R> RemoteCallResult<R> map(Function<T, RemoteCallResult<R>> onSuccess,
                                    Function<RemoteCallResult<T>, RemoteCallResult<R>> onFailure) {
            return failure != null ? onFailure.apply(failure) : onSuccess.apply(response);
        }
    }
}
