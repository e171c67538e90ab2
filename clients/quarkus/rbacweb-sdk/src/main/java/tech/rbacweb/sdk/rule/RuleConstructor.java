package tech.rbacweb.sdk.rule;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Builds a rule of one type from its name and parsed data.
 */
@FunctionalInterface
public interface RuleConstructor {

    Rule create(String name, JsonNode data);
}
