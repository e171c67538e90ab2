package tech.rbacweb.sdk.client.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.rbacweb.sdk.config.RbacWebConfig;
import tech.rbacweb.sdk.exception.AuthenticationException;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Manages OAuth2 client credentials tokens for the RBAC authority.
 *
 * <p>Without a configured client ID and secret no token is produced and snapshot
 * requests go out unauthenticated.
 */
@ApplicationScoped
public class OidcTokenManager implements TokenProvider {

    private static final Logger LOG = Logger.getLogger(OidcTokenManager.class);

    private final RbacWebConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    private String accessToken;
    private Instant expiresAt;

    @Inject
    public OidcTokenManager(RbacWebConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(config.http().connectTimeout()))
            .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Optional<String> getToken() {
        if (!hasCredentials()) {
            return Optional.empty();
        }
        return Optional.of(getAccessToken());
    }

    /**
     * Get a valid access token, fetching a new one if necessary.
     */
    public String getAccessToken() {
        lock.lock();
        try {
            if (isTokenValid()) {
                return accessToken;
            }
            return fetchNewToken();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Force refresh the access token.
     */
    public String refreshToken() {
        lock.lock();
        try {
            return fetchNewToken();
        } finally {
            lock.unlock();
        }
    }

    private boolean hasCredentials() {
        return config.clientId().isPresent() && config.clientSecret().isPresent();
    }

    private boolean isTokenValid() {
        return accessToken != null
            && expiresAt != null
            && Instant.now().plusSeconds(30).isBefore(expiresAt);
    }

    private String fetchNewToken() {
        String clientId = config.clientId()
            .orElseThrow(AuthenticationException::invalidCredentials);
        String clientSecret = config.clientSecret()
            .orElseThrow(AuthenticationException::invalidCredentials);

        String tokenUrl = config.tokenUrl()
            .orElseGet(() -> config.baseUrl().replaceAll("/$", "") + "/oauth/token");

        String body = String.format(
            "grant_type=client_credentials&client_id=%s&client_secret=%s",
            URLEncoder.encode(clientId, StandardCharsets.UTF_8),
            URLEncoder.encode(clientSecret, StandardCharsets.UTF_8)
        );

        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(tokenUrl))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .timeout(Duration.ofSeconds(config.http().timeout()))
                .build();

            HttpResponse<String> response = httpClient.send(
                request, HttpResponse.BodyHandlers.ofString()
            );

            if (response.statusCode() != 200) {
                throw AuthenticationException.invalidCredentials();
            }

            @SuppressWarnings("unchecked")
            Map<String, Object> json = objectMapper.readValue(
                response.body(), Map.class
            );

            Object token = json.get("access_token");
            if (!(token instanceof String)) {
                throw new AuthenticationException("Token response did not contain an access_token");
            }

            this.accessToken = (String) token;
            int expiresIn = ((Number) json.getOrDefault("expires_in", 3600)).intValue();
            this.expiresAt = Instant.now().plusSeconds(expiresIn);

            LOG.debugf("Fetched access token from %s, expires in %ds", tokenUrl, expiresIn);
            return this.accessToken;
        } catch (AuthenticationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthenticationException("Interrupted while fetching access token", e);
        } catch (Exception e) {
            throw new AuthenticationException("Failed to fetch access token", e);
        }
    }
}
