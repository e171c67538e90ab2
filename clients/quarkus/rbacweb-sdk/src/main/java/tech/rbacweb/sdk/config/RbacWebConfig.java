package tech.rbacweb.sdk.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Configuration for the RBAC web SDK.
 *
 * <p>Configure in application.properties:
 * <pre>
 * rbacweb.base-url=https://auth.example.com
 * rbacweb.path=/rbac
 * rbacweb.client-id=your_client_id
 * rbacweb.client-secret=your_client_secret
 * </pre>
 */
@ConfigMapping(prefix = "rbacweb")
public interface RbacWebConfig {

    /**
     * Base URL of the RBAC authority.
     */
    @WithName("base-url")
    @WithDefault("http://localhost:8080")
    String baseUrl();

    /**
     * Path of the snapshot endpoint, relative to the base URL.
     */
    @WithDefault("/rbac")
    String path();

    /**
     * OAuth2 client ID used to obtain bearer tokens.
     */
    @WithName("client-id")
    Optional<String> clientId();

    /**
     * OAuth2 client secret used to obtain bearer tokens.
     */
    @WithName("client-secret")
    Optional<String> clientSecret();

    /**
     * OAuth2 token endpoint. Defaults to {base-url}/oauth/token.
     */
    @WithName("token-url")
    Optional<String> tokenUrl();

    /**
     * HTTP client configuration.
     */
    HttpConfig http();

    interface HttpConfig {
        /**
         * Request timeout in seconds.
         */
        @WithDefault("30")
        int timeout();

        /**
         * Connect timeout in seconds.
         */
        @WithName("connect-timeout")
        @WithDefault("10")
        int connectTimeout();
    }
}
