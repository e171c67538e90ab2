package tech.rbacweb.sdk.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.rbacweb.sdk.client.auth.TokenProvider;
import tech.rbacweb.sdk.config.RbacWebConfig;
import tech.rbacweb.sdk.dto.RbacSnapshot;
import tech.rbacweb.sdk.exception.AuthenticationException;
import tech.rbacweb.sdk.exception.RbacWebException;
import tech.rbacweb.sdk.exception.SnapshotParseException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Fetches the RBAC snapshot over HTTP.
 *
 * <p>Sends a single {@code GET {base-url}{path}} per call. A 404 response means the
 * authority has no RBAC data yet and is reported as an empty result; every other
 * error status fails the fetch. No retries are performed.
 */
@ApplicationScoped
public class HttpSnapshotFetcher implements SnapshotFetcher {

    private static final Logger LOG = Logger.getLogger(HttpSnapshotFetcher.class);

    private final RbacWebConfig config;
    private final TokenProvider tokenProvider;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Inject
    public HttpSnapshotFetcher(RbacWebConfig config, TokenProvider tokenProvider) {
        this.config = config;
        this.tokenProvider = tokenProvider;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(config.http().connectTimeout()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public Optional<RbacSnapshot> fetch() {
        String url = getSnapshotUrl();

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Accept", "application/json")
            .timeout(Duration.ofSeconds(config.http().timeout()))
            .GET();

        tokenProvider.getToken()
            .ifPresent(token -> requestBuilder.header("Authorization", "Bearer " + token));

        HttpResponse<String> response;
        try {
            response = httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RbacWebException("Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RbacWebException("Request interrupted", e);
        }

        return handleResponse(url, response);
    }

    private Optional<RbacSnapshot> handleResponse(String url, HttpResponse<String> response) {
        int status = response.statusCode();
        String body = response.body();

        if (status == 404) {
            LOG.infof("No RBAC snapshot at %s", url);
            return Optional.empty();
        }

        if (status == 401) {
            throw AuthenticationException.tokenRejected();
        }

        if (status >= 400) {
            Map<String, Object> data = readErrorBody(body);
            String fallback = status >= 500 ? "Server error: " + status : "Client error: " + status;
            throw new RbacWebException(
                String.valueOf(data.getOrDefault("error", fallback)),
                status, null, data
            );
        }

        if (body == null || body.isBlank()) {
            return Optional.of(RbacSnapshot.empty());
        }

        RbacSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(body, RbacSnapshot.class);
        } catch (JsonProcessingException e) {
            throw SnapshotParseException.malformedBody(e);
        }
        if (snapshot == null) {
            throw SnapshotParseException.malformedBody(null);
        }
        return Optional.of(snapshot);
    }

    private Map<String, Object> readErrorBody(String body) {
        if (body == null || body.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(body, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            LOG.debugf("Error response body is not JSON: %s", e.getOriginalMessage());
            return Map.of();
        }
    }

    public String getSnapshotUrl() {
        return config.baseUrl().replaceAll("/$", "") + config.path();
    }
}
