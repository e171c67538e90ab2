package tech.rbacweb.sdk.manager;

import tech.rbacweb.sdk.enums.ItemType;
import tech.rbacweb.sdk.model.Assignment;
import tech.rbacweb.sdk.model.Item;
import tech.rbacweb.sdk.rule.Rule;

import java.util.List;
import java.util.Map;

/**
 * Query and mutation surface over an RBAC graph.
 *
 * <p>Lookups return direct relations only; hierarchy traversal and access checks
 * belong to implementations that own the full decision logic.
 */
public interface RbacManager {

    // Items

    Item getItem(String name);

    Map<String, Item> getItems(ItemType type);

    default Map<String, Item> getRoles() {
        return getItems(ItemType.ROLE);
    }

    default Map<String, Item> getPermissions() {
        return getItems(ItemType.PERMISSION);
    }

    boolean addItem(Item item);

    boolean updateItem(String name, Item item);

    boolean removeItem(Item item);

    // Rules

    Rule getRule(String name);

    Map<String, Rule> getRules();

    boolean addRule(Rule rule);

    boolean updateRule(String name, Rule rule);

    boolean removeRule(Rule rule);

    // Hierarchy

    Map<String, Item> getParents(String childName);

    Map<String, Item> getChildren(String parentName);

    boolean hasChild(Item parent, Item child);

    boolean addChild(Item parent, Item child);

    boolean removeChild(Item parent, Item child);

    boolean removeChildren(Item parent);

    // Assignments

    Assignment getAssignment(String itemName, String username);

    Map<String, Assignment> getAssignments(String username);

    List<String> getUsernamesByItem(String itemName);

    Map<String, Item> getRolesByUser(String username);

    Map<String, Item> getPermissionsByUser(String username);

    Assignment assign(Item item, String username);

    boolean revoke(Item item, String username);

    boolean revokeAll(String username);

    void removeAll();
}
