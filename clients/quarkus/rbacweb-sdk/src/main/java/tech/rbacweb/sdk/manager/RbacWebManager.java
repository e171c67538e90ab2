package tech.rbacweb.sdk.manager;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.rbacweb.sdk.client.SnapshotFetcher;
import tech.rbacweb.sdk.dto.RbacSnapshot;
import tech.rbacweb.sdk.enums.ItemType;
import tech.rbacweb.sdk.model.Assignment;
import tech.rbacweb.sdk.model.Item;
import tech.rbacweb.sdk.model.RbacState;
import tech.rbacweb.sdk.rule.Rule;
import tech.rbacweb.sdk.rule.RuleFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Read-only {@link RbacManager} backed by a snapshot fetched from the RBAC authority.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Inject
 * RbacWebManager rbac;
 *
 * rbac.load();
 * Assignment assignment = rbac.getAssignment("editor", "alice");
 * }</pre>
 *
 * <h2>Loading</h2>
 * <p>{@link #load()} fetches the snapshot and materializes it into a new
 * {@link RbacState}. The held state is replaced only after both steps succeed, so a
 * failed load leaves the previous generation in place. A missing snapshot (HTTP 404)
 * resets the state to empty.
 *
 * <h2>Thread Safety</h2>
 * <p>Readers see one complete generation at a time. Concurrent loads are not
 * coordinated; the last one to finish wins.
 */
@ApplicationScoped
public class RbacWebManager implements RbacManager {

    private static final Logger LOG = Logger.getLogger(RbacWebManager.class);

    private final SnapshotFetcher fetcher;
    private final SnapshotMaterializer materializer;

    private volatile RbacState state = RbacState.empty();

    @Inject
    public RbacWebManager(SnapshotFetcher fetcher, RuleFactory ruleFactory) {
        this(fetcher, new SnapshotMaterializer(ruleFactory, new ObjectMapper()));
    }

    public RbacWebManager(SnapshotFetcher fetcher, SnapshotMaterializer materializer) {
        this.fetcher = fetcher;
        this.materializer = materializer;
    }

    /**
     * Fetch the snapshot and replace the held RBAC state.
     *
     * @throws tech.rbacweb.sdk.exception.RbacWebException if the fetch fails for any reason
     *         other than a missing snapshot, or the snapshot cannot be parsed
     */
    public void load() {
        RbacSnapshot snapshot = fetcher.fetch().orElseGet(RbacSnapshot::empty);
        RbacState loaded = materializer.materialize(snapshot);
        this.state = loaded;

        LOG.debugf("Loaded RBAC snapshot: %d items, %d rules, %d users with assignments",
            loaded.items().size(), loaded.rules().size(), loaded.assignments().size());
    }

    /**
     * The currently held generation.
     */
    public RbacState state() {
        return state;
    }

    // ========================================================================
    // Items
    // ========================================================================

    @Override
    public Item getItem(String name) {
        return state.items().get(name);
    }

    @Override
    public Map<String, Item> getItems(ItemType type) {
        return filterItems(state.items(), item -> item.type() == type);
    }

    @Override
    public boolean addItem(Item item) {
        throw readOnly();
    }

    @Override
    public boolean updateItem(String name, Item item) {
        throw readOnly();
    }

    @Override
    public boolean removeItem(Item item) {
        throw readOnly();
    }

    // ========================================================================
    // Rules
    // ========================================================================

    @Override
    public Rule getRule(String name) {
        return state.rules().get(name);
    }

    @Override
    public Map<String, Rule> getRules() {
        return state.rules();
    }

    @Override
    public boolean addRule(Rule rule) {
        throw readOnly();
    }

    @Override
    public boolean updateRule(String name, Rule rule) {
        throw readOnly();
    }

    @Override
    public boolean removeRule(Rule rule) {
        throw readOnly();
    }

    // ========================================================================
    // Hierarchy
    // ========================================================================

    @Override
    public Map<String, Item> getParents(String childName) {
        return state.parents().getOrDefault(childName, Map.of());
    }

    @Override
    public Map<String, Item> getChildren(String parentName) {
        RbacState current = state;
        Map<String, Item> children = new LinkedHashMap<>();
        current.parents().forEach((childName, parents) -> {
            if (parents.containsKey(parentName)) {
                children.put(childName, current.items().get(childName));
            }
        });
        return Collections.unmodifiableMap(children);
    }

    @Override
    public boolean hasChild(Item parent, Item child) {
        return getParents(child.name()).containsKey(parent.name());
    }

    @Override
    public boolean addChild(Item parent, Item child) {
        throw readOnly();
    }

    @Override
    public boolean removeChild(Item parent, Item child) {
        throw readOnly();
    }

    @Override
    public boolean removeChildren(Item parent) {
        throw readOnly();
    }

    // ========================================================================
    // Assignments
    // ========================================================================

    @Override
    public Assignment getAssignment(String itemName, String username) {
        return getAssignments(username).get(itemName);
    }

    @Override
    public Map<String, Assignment> getAssignments(String username) {
        return state.assignments().getOrDefault(username, Map.of());
    }

    @Override
    public List<String> getUsernamesByItem(String itemName) {
        List<String> usernames = new ArrayList<>();
        state.assignments().forEach((username, assignments) -> {
            if (assignments.containsKey(itemName)) {
                usernames.add(username);
            }
        });
        return Collections.unmodifiableList(usernames);
    }

    @Override
    public Map<String, Item> getRolesByUser(String username) {
        return assignedItems(username, ItemType.ROLE);
    }

    @Override
    public Map<String, Item> getPermissionsByUser(String username) {
        return assignedItems(username, ItemType.PERMISSION);
    }

    @Override
    public Assignment assign(Item item, String username) {
        throw readOnly();
    }

    @Override
    public boolean revoke(Item item, String username) {
        throw readOnly();
    }

    @Override
    public boolean revokeAll(String username) {
        throw readOnly();
    }

    @Override
    public void removeAll() {
        throw readOnly();
    }

    private Map<String, Item> assignedItems(String username, ItemType type) {
        RbacState current = state;
        Map<String, Item> result = new LinkedHashMap<>();
        current.assignments().getOrDefault(username, Map.of()).keySet().forEach(itemName -> {
            Item item = current.items().get(itemName);
            if (item != null && item.type() == type) {
                result.put(itemName, item);
            }
        });
        return Collections.unmodifiableMap(result);
    }

    private static Map<String, Item> filterItems(Map<String, Item> items, Predicate<Item> filter) {
        Map<String, Item> result = new LinkedHashMap<>();
        items.forEach((name, item) -> {
            if (filter.test(item)) {
                result.put(name, item);
            }
        });
        return Collections.unmodifiableMap(result);
    }

    private static UnsupportedOperationException readOnly() {
        return new UnsupportedOperationException("RBAC web manager is read-only");
    }
}
