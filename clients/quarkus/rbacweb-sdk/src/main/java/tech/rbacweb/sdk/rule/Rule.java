package tech.rbacweb.sdk.rule;

import com.fasterxml.jackson.databind.JsonNode;
import tech.rbacweb.sdk.model.Item;

import java.util.Map;

/**
 * A named predicate attached to items for conditional authorization.
 *
 * <p>This class is also the generic variant: it is built for every rule whose type
 * name has no registered constructor, keeps the parsed rule data untouched and
 * always allows. Specialized rules extend it and override {@link #execute}.
 */
public class Rule {

    private final String name;
    private final JsonNode data;

    public Rule(String name, JsonNode data) {
        this.name = name;
        this.data = data;
    }

    public String getName() {
        return name;
    }

    /**
     * Parsed rule configuration. Its shape depends on the rule type.
     */
    public JsonNode getData() {
        return data;
    }

    /**
     * Evaluate the rule.
     *
     * @param username user being checked
     * @param item the role or permission the rule is attached to
     * @param params caller-supplied parameters
     * @return whether the rule allows the access
     */
    public boolean execute(String username, Item item, Map<String, Object> params) {
        return true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[name=" + name + ", data=" + data + "]";
    }
}
