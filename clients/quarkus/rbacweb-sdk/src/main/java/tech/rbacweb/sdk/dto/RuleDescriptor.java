package tech.rbacweb.sdk.dto;

/**
 * Wire form of a rule inside a snapshot.
 *
 * <p>{@code ruleData} is JSON text embedded as a string, parsed during materialization.
 */
public record RuleDescriptor(RuleData data) {

    public record RuleData(
        String typeName,
        String ruleData
    ) {}
}
