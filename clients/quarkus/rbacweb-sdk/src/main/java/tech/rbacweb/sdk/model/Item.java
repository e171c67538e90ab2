package tech.rbacweb.sdk.model;

import tech.rbacweb.sdk.enums.ItemType;

import java.util.Objects;

/**
 * A role or a permission.
 *
 * <p>The name is the identity of an item within one snapshot.
 */
public record Item(
    String name,
    ItemType type,
    String description,
    String ruleName
) {
    public Item {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static Item permission(String name, String description, String ruleName) {
        return new Item(name, ItemType.PERMISSION, description, ruleName);
    }

    public static Item role(String name, String description, String ruleName) {
        return new Item(name, ItemType.ROLE, description, ruleName);
    }

    public boolean isPermission() {
        return type == ItemType.PERMISSION;
    }

    public boolean isRole() {
        return type == ItemType.ROLE;
    }
}
