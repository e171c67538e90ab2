package tech.rbacweb.sdk.model;

/**
 * Binding of a user to a role or permission.
 */
public record Assignment(
    String username,
    String itemName
) {}
