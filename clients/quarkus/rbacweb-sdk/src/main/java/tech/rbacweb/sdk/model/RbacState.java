package tech.rbacweb.sdk.model;

import tech.rbacweb.sdk.rule.Rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One materialized generation of the RBAC graph.
 *
 * <p>The parents index holds the same {@link Item} instances as {@code items}.
 * All maps, inner maps included, are read-only views.
 *
 * @param items items keyed by name
 * @param parents child name -> (parent name -> parent item)
 * @param rules rules keyed by name
 * @param assignments username -> (item name -> assignment)
 */
public record RbacState(
    Map<String, Item> items,
    Map<String, Map<String, Item>> parents,
    Map<String, Rule> rules,
    Map<String, Map<String, Assignment>> assignments
) {
    public RbacState {
        items = Collections.unmodifiableMap(items);
        parents = freeze(parents);
        rules = Collections.unmodifiableMap(rules);
        assignments = freeze(assignments);
    }

    public static RbacState empty() {
        return new RbacState(Map.of(), Map.of(), Map.of(), Map.of());
    }

    public boolean isEmpty() {
        return items.isEmpty() && rules.isEmpty() && assignments.isEmpty();
    }

    private static <V> Map<String, Map<String, V>> freeze(Map<String, Map<String, V>> nested) {
        Map<String, Map<String, V>> frozen = new LinkedHashMap<>();
        nested.forEach((key, inner) -> frozen.put(key, Collections.unmodifiableMap(inner)));
        return Collections.unmodifiableMap(frozen);
    }
}
