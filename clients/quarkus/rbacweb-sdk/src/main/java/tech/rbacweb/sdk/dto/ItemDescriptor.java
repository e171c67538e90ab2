package tech.rbacweb.sdk.dto;

import tech.rbacweb.sdk.enums.ItemType;

import java.util.List;

/**
 * Wire form of a role or permission inside a snapshot.
 *
 * @param type declared variant
 * @param description optional description
 * @param ruleName optional name of the rule attached to the item
 * @param children optional ordered names of child items
 */
public record ItemDescriptor(
    ItemType type,
    String description,
    String ruleName,
    List<String> children
) {
    public ItemDescriptor {
        children = children != null ? children : List.of();
    }
}
