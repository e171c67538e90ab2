package tech.rbacweb.sdk.dto;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time export of the full RBAC policy state, as served by the authority.
 *
 * <p>Missing top-level sections are normalized to empty maps.
 */
public record RbacSnapshot(
    Map<String, ItemDescriptor> items,
    Map<String, RuleDescriptor> rules,
    Map<String, List<String>> assignments
) {
    public RbacSnapshot {
        items = items != null ? items : Map.of();
        rules = rules != null ? rules : Map.of();
        assignments = assignments != null ? assignments : Map.of();
    }

    /**
     * Snapshot used when the authority has no RBAC data yet.
     */
    public static RbacSnapshot empty() {
        return new RbacSnapshot(Map.of(), Map.of(), Map.of());
    }
}
