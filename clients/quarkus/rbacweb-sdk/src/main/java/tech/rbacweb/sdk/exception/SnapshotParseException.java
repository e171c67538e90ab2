package tech.rbacweb.sdk.exception;

import java.util.Map;

/**
 * Exception thrown when a snapshot body or an embedded rule payload is not well-formed JSON.
 */
public class SnapshotParseException extends RbacWebException {

    public SnapshotParseException(String message, Throwable cause) {
        super(message, cause);
    }

    public SnapshotParseException(String message, Throwable cause, Map<String, Object> context) {
        super(message, 0, cause, context);
    }

    public static SnapshotParseException malformedBody(Throwable cause) {
        return new SnapshotParseException("Failed to parse RBAC snapshot", cause);
    }

    public static SnapshotParseException malformedRuleData(String ruleName, Throwable cause) {
        return new SnapshotParseException(
            "Failed to parse data of rule '" + ruleName + "'", cause, Map.of("rule", ruleName)
        );
    }
}
