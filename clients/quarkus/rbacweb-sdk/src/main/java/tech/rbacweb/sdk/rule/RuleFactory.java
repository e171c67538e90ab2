package tech.rbacweb.sdk.rule;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of rule type names to rule constructors.
 *
 * <p>The hosting application registers its rule types before the first load.
 * Resolution never fails: type names without a registration, including null,
 * resolve to the generic {@link Rule}.
 */
@ApplicationScoped
public class RuleFactory {

    private static final Logger LOG = Logger.getLogger(RuleFactory.class);

    private static final RuleConstructor GENERIC = Rule::new;

    // Type name -> constructor
    private final Map<String, RuleConstructor> constructors = new ConcurrentHashMap<>();

    /**
     * Register a rule type. A later registration for the same type name replaces the earlier one.
     */
    public RuleFactory register(String typeName, RuleConstructor constructor) {
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("Rule type name cannot be null or empty");
        }
        if (constructor == null) {
            throw new IllegalArgumentException("Rule constructor cannot be null");
        }
        if (constructors.put(typeName, constructor) != null) {
            LOG.debugf("Replaced rule type [%s]", typeName);
        } else {
            LOG.debugf("Registered rule type [%s]", typeName);
        }
        return this;
    }

    public RuleFactory registerAll(Map<String, RuleConstructor> ruleTypes) {
        ruleTypes.forEach(this::register);
        return this;
    }

    /**
     * Resolve the constructor for a rule type name.
     */
    public RuleConstructor resolve(String typeName) {
        if (typeName == null) {
            return GENERIC;
        }
        return constructors.getOrDefault(typeName, GENERIC);
    }

    public boolean isRegistered(String typeName) {
        return typeName != null && constructors.containsKey(typeName);
    }
}
