package tech.rbacweb.sdk.manager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.NullNode;
import org.jboss.logging.Logger;
import tech.rbacweb.sdk.dto.ItemDescriptor;
import tech.rbacweb.sdk.dto.RbacSnapshot;
import tech.rbacweb.sdk.dto.RuleDescriptor;
import tech.rbacweb.sdk.enums.ItemType;
import tech.rbacweb.sdk.exception.SnapshotParseException;
import tech.rbacweb.sdk.model.Assignment;
import tech.rbacweb.sdk.model.Item;
import tech.rbacweb.sdk.model.RbacState;
import tech.rbacweb.sdk.rule.Rule;
import tech.rbacweb.sdk.rule.RuleFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a flat {@link RbacSnapshot} into a cross-referenced {@link RbacState}.
 *
 * <h2>Passes</h2>
 * <ol>
 *   <li>Items: one {@link Item} per descriptor, variant taken from the declared type</li>
 *   <li>Parents: child name -> parent items, built from the items of pass 1</li>
 *   <li>Rules: embedded rule data parsed as JSON and handed to the {@link RuleFactory}</li>
 *   <li>Assignments: username -> item name -> {@link Assignment}</li>
 * </ol>
 *
 * <p>Hierarchy edges that name an unknown item are dropped. Rule data that is not
 * exactly one JSON value fails the whole materialization with a {@link SnapshotParseException}.
 */
public class SnapshotMaterializer {

    private static final Logger LOG = Logger.getLogger(SnapshotMaterializer.class);

    private final RuleFactory ruleFactory;
    private final ObjectReader ruleDataReader;

    public SnapshotMaterializer(RuleFactory ruleFactory, ObjectMapper objectMapper) {
        this.ruleFactory = ruleFactory;
        this.ruleDataReader = objectMapper.readerFor(JsonNode.class)
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public RbacState materialize(RbacSnapshot snapshot) {
        Map<String, Item> items = buildItems(snapshot.items());
        Map<String, Map<String, Item>> parents = buildParents(snapshot.items(), items);
        Map<String, Rule> rules = buildRules(snapshot.rules());
        Map<String, Map<String, Assignment>> assignments = buildAssignments(snapshot.assignments());

        return new RbacState(items, parents, rules, assignments);
    }

    Map<String, Item> buildItems(Map<String, ItemDescriptor> descriptors) {
        Map<String, Item> items = new LinkedHashMap<>();
        descriptors.forEach((name, descriptor) -> {
            if (descriptor == null) {
                items.put(name, Item.role(name, null, null));
                return;
            }
            ItemType type = descriptor.type() == ItemType.PERMISSION ? ItemType.PERMISSION : ItemType.ROLE;
            items.put(name, new Item(name, type, descriptor.description(), descriptor.ruleName()));
        });
        return items;
    }

    Map<String, Map<String, Item>> buildParents(Map<String, ItemDescriptor> descriptors, Map<String, Item> items) {
        Map<String, Map<String, Item>> parents = new LinkedHashMap<>();
        descriptors.forEach((parentName, descriptor) -> {
            if (descriptor == null || descriptor.children().isEmpty()) {
                return;
            }

            Item parent = items.get(parentName);
            for (String childName : descriptor.children()) {
                if (!items.containsKey(childName) || parent == null) {
                    LOG.tracef("Dropping hierarchy edge [%s] -> [%s]: unknown item", parentName, childName);
                    continue;
                }
                parents.computeIfAbsent(childName, k -> new LinkedHashMap<>()).put(parentName, parent);
            }
        });
        return parents;
    }

    Map<String, Rule> buildRules(Map<String, RuleDescriptor> descriptors) {
        Map<String, Rule> rules = new LinkedHashMap<>();
        descriptors.forEach((name, descriptor) -> {
            RuleDescriptor.RuleData ruleData = descriptor != null ? descriptor.data() : null;
            if (ruleData == null) {
                rules.put(name, ruleFactory.resolve(null).create(name, NullNode.getInstance()));
                return;
            }

            JsonNode data = parseRuleData(name, ruleData.ruleData());
            rules.put(name, ruleFactory.resolve(ruleData.typeName()).create(name, data));
        });
        return rules;
    }

    Map<String, Map<String, Assignment>> buildAssignments(Map<String, List<String>> descriptors) {
        Map<String, Map<String, Assignment>> assignments = new LinkedHashMap<>();
        descriptors.forEach((username, itemNames) -> {
            if (itemNames == null) {
                return;
            }
            for (String itemName : itemNames) {
                assignments.computeIfAbsent(username, k -> new LinkedHashMap<>())
                    .put(itemName, new Assignment(username, itemName));
            }
        });
        return assignments;
    }

    private JsonNode parseRuleData(String ruleName, String raw) {
        if (raw == null) {
            return NullNode.getInstance();
        }
        JsonNode data;
        try {
            data = ruleDataReader.readTree(raw);
        } catch (JsonProcessingException e) {
            throw SnapshotParseException.malformedRuleData(ruleName, e);
        }
        // Empty or blank input carries no JSON value
        if (data == null || data.isMissingNode()) {
            throw SnapshotParseException.malformedRuleData(ruleName, null);
        }
        return data;
    }
}
