package tech.rbacweb.sdk.exception;

/**
 * Exception thrown when the authority rejects the bearer credential
 * or a token cannot be obtained.
 */
public class AuthenticationException extends RbacWebException {

    public AuthenticationException(String message) {
        super(message, 401);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, 401, cause, null);
    }

    public static AuthenticationException tokenRejected() {
        return new AuthenticationException("Access token expired or invalid");
    }

    public static AuthenticationException invalidCredentials() {
        return new AuthenticationException("Invalid client credentials");
    }
}
