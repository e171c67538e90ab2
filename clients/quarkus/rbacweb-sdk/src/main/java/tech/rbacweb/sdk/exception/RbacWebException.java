package tech.rbacweb.sdk.exception;

import java.util.Map;

/**
 * Base exception for RBAC web SDK errors.
 */
public class RbacWebException extends RuntimeException {

    private final int statusCode;
    private final Map<String, Object> context;

    public RbacWebException(String message) {
        this(message, 0, null, Map.of());
    }

    public RbacWebException(String message, int statusCode) {
        this(message, statusCode, null, Map.of());
    }

    public RbacWebException(String message, Throwable cause) {
        this(message, 0, cause, Map.of());
    }

    public RbacWebException(String message, int statusCode, Throwable cause, Map<String, Object> context) {
        super(message, cause);
        this.statusCode = statusCode;
        this.context = context != null ? context : Map.of();
    }

    /**
     * HTTP status of the failed response, or 0 when the failure happened before a response arrived.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
