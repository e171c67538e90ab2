package tech.rbacweb.sdk.client.auth;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Source of the bearer token attached to each request sent to the RBAC authority.
 *
 * <p>Invoked once per outbound request. An empty result means the request is sent
 * without an {@code Authorization} header.
 */
@FunctionalInterface
public interface TokenProvider {

    Optional<String> getToken();

    /**
     * Provider that never yields a token.
     */
    static TokenProvider none() {
        return Optional::empty;
    }

    /**
     * Adapt a plain supplier. Null or blank tokens count as absent.
     */
    static TokenProvider of(Supplier<String> supplier) {
        return () -> Optional.ofNullable(supplier.get()).filter(token -> !token.isBlank());
    }
}
