package tech.rbacweb.sdk.manager;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import tech.rbacweb.sdk.dto.ItemDescriptor;
import tech.rbacweb.sdk.dto.RbacSnapshot;
import tech.rbacweb.sdk.dto.RuleDescriptor;
import tech.rbacweb.sdk.enums.ItemType;
import tech.rbacweb.sdk.exception.SnapshotParseException;
import tech.rbacweb.sdk.model.Item;
import tech.rbacweb.sdk.model.RbacState;
import tech.rbacweb.sdk.rule.Rule;
import tech.rbacweb.sdk.rule.RuleFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SnapshotMaterializer.
 * Snapshots are built directly from the wire records, no HTTP involved.
 */
class SnapshotMaterializerTest {

    private RuleFactory ruleFactory;
    private SnapshotMaterializer materializer;

    @BeforeEach
    void setUp() {
        ruleFactory = new RuleFactory();
        materializer = new SnapshotMaterializer(ruleFactory, new ObjectMapper());
    }

    // ========================================
    // ITEMS
    // ========================================

    @Test
    @DisplayName("materialize should build one item per descriptor with the declared variant")
    void materialize_shouldBuildItemsWithDeclaredVariant() {
        Map<String, ItemDescriptor> items = new LinkedHashMap<>();
        items.put("admin", new ItemDescriptor(ItemType.ROLE, "Administrator", null, null));
        items.put("updatePost", new ItemDescriptor(ItemType.PERMISSION, null, "isAuthor", null));

        RbacState state = materializer.materialize(new RbacSnapshot(items, null, null));

        assertThat(state.items()).hasSize(2);
        assertThat(state.items().get("admin"))
            .isEqualTo(new Item("admin", ItemType.ROLE, "Administrator", null));
        assertThat(state.items().get("updatePost"))
            .isEqualTo(new Item("updatePost", ItemType.PERMISSION, null, "isAuthor"));
    }

    @Test
    @DisplayName("materialize should treat an item without a type as a role")
    void materialize_shouldTreatUntypedItemAsRole() {
        Map<String, ItemDescriptor> items = new LinkedHashMap<>();
        items.put("guest", new ItemDescriptor(null, null, null, null));

        RbacState state = materializer.materialize(new RbacSnapshot(items, null, null));

        assertThat(state.items().get("guest").isRole()).isTrue();
    }

    // ========================================
    // PARENTS
    // ========================================

    @Test
    @DisplayName("materialize should index each parent under its child using the same item instance")
    void materialize_shouldIndexParentsUnderChildren() {
        Map<String, ItemDescriptor> items = new LinkedHashMap<>();
        items.put("admin", role("editor", "viewer"));
        items.put("editor", role("viewer"));
        items.put("viewer", role());

        RbacState state = materializer.materialize(new RbacSnapshot(items, null, null));

        assertThat(state.parents()).containsOnlyKeys("editor", "viewer");
        assertThat(state.parents().get("editor")).containsOnlyKeys("admin");
        assertThat(state.parents().get("viewer")).containsOnlyKeys("admin", "editor");
        assertThat(state.parents().get("viewer").get("admin")).isSameAs(state.items().get("admin"));
        assertThat(state.parents().get("viewer").get("editor")).isSameAs(state.items().get("editor"));
    }

    @Test
    @DisplayName("materialize should drop edges that point to unknown children")
    void materialize_shouldDropEdgesToUnknownChildren() {
        Map<String, ItemDescriptor> items = new LinkedHashMap<>();
        items.put("admin", role("ghost", "editor"));
        items.put("editor", role());

        RbacState state = materializer.materialize(new RbacSnapshot(items, null, null));

        assertThat(state.parents()).containsOnlyKeys("editor");
        assertThat(state.parents()).doesNotContainKey("ghost");
    }

    @Test
    @DisplayName("materialize should not create parent entries for items without children")
    void materialize_shouldSkipItemsWithoutChildren() {
        Map<String, ItemDescriptor> items = new LinkedHashMap<>();
        items.put("admin", new ItemDescriptor(ItemType.ROLE, null, null, List.of()));
        items.put("editor", role());

        RbacState state = materializer.materialize(new RbacSnapshot(items, null, null));

        assertThat(state.parents()).isEmpty();
    }

    // ========================================
    // RULES
    // ========================================

    @Test
    @DisplayName("materialize should build the registered rule type with parsed data")
    void materialize_shouldBuildRegisteredRuleType() {
        ruleFactory.register("limitRule", LimitRule::new);
        Map<String, RuleDescriptor> rules = Map.of("limit", rule("limitRule", "{\"max\": 3}"));

        RbacState state = materializer.materialize(new RbacSnapshot(null, rules, null));

        Rule rule = state.rules().get("limit");
        assertThat(rule).isInstanceOf(LimitRule.class);
        assertThat(rule.getName()).isEqualTo("limit");
        assertThat(rule.getData().get("max").asInt()).isEqualTo(3);
    }

    @Test
    @DisplayName("materialize should build a generic rule carrying the data for an unregistered type")
    void materialize_shouldBuildGenericRuleForUnregisteredType() {
        Map<String, RuleDescriptor> rules = Map.of("r1", rule("notRegistered", "{\"a\": [1, 2], \"b\": null}"));

        RbacState state = materializer.materialize(new RbacSnapshot(null, rules, null));

        Rule rule = state.rules().get("r1");
        assertThat(rule.getClass()).isEqualTo(Rule.class);
        assertThat(rule.getData().get("a").size()).isEqualTo(2);
        assertThat(rule.getData().get("b").isNull()).isTrue();
    }

    @Test
    @DisplayName("materialize should build a generic rule with null data when the data block is missing")
    void materialize_shouldBuildGenericRuleWhenDataBlockMissing() {
        Map<String, RuleDescriptor> rules = Map.of("r1", new RuleDescriptor(null));

        RbacState state = materializer.materialize(new RbacSnapshot(null, rules, null));

        assertThat(state.rules().get("r1").getData().isNull()).isTrue();
    }

    @Test
    @DisplayName("materialize should fail with SnapshotParseException when rule data is malformed")
    void materialize_shouldFail_whenRuleDataIsMalformed() {
        Map<String, RuleDescriptor> rules = Map.of("broken", rule("any", "{not json"));

        assertThatThrownBy(() -> materializer.materialize(new RbacSnapshot(null, rules, null)))
            .isInstanceOf(SnapshotParseException.class)
            .hasMessageContaining("broken");
    }

    @ParameterizedTest(name = "[{index}] ruleData={0}")
    @ValueSource(strings = {"", "   ", "{\"max\": 3} garbage", "1 2", "{\"a\": 1}{\"b\": 2}"})
    @DisplayName("materialize should fail when rule data is not exactly one JSON value")
    void materialize_shouldFail_whenRuleDataIsNotSingleJsonValue(String ruleData) {
        Map<String, RuleDescriptor> rules = Map.of("strict", rule("any", ruleData));

        assertThatThrownBy(() -> materializer.materialize(new RbacSnapshot(null, rules, null)))
            .isInstanceOf(SnapshotParseException.class)
            .hasMessageContaining("strict");
    }

    @Test
    @DisplayName("materialize should give a null ruleData string JSON null data")
    void materialize_shouldGiveNullData_whenRuleDataStringIsNull() {
        Map<String, RuleDescriptor> rules = Map.of("r1", rule("any", null));

        RbacState state = materializer.materialize(new RbacSnapshot(null, rules, null));

        assertThat(state.rules().get("r1").getData().isNull()).isTrue();
    }

    // ========================================
    // ASSIGNMENTS
    // ========================================

    @Test
    @DisplayName("materialize should group assignments by user and collapse duplicates")
    void materialize_shouldGroupAssignmentsByUser() {
        Map<String, List<String>> assignments = new LinkedHashMap<>();
        assignments.put("alice", List.of("editor", "viewer", "editor"));
        assignments.put("bob", List.of("viewer"));

        RbacState state = materializer.materialize(new RbacSnapshot(null, null, assignments));

        assertThat(state.assignments().get("alice")).containsOnlyKeys("editor", "viewer");
        assertThat(state.assignments().get("alice").get("editor").username()).isEqualTo("alice");
        assertThat(state.assignments().get("alice").get("editor").itemName()).isEqualTo("editor");
        assertThat(state.assignments().get("bob")).hasSize(1);
    }

    @Test
    @DisplayName("materialize should not create an entry for a user with no items")
    void materialize_shouldSkipUsersWithoutItems() {
        Map<String, List<String>> assignments = Map.of("carol", List.of());

        RbacState state = materializer.materialize(new RbacSnapshot(null, null, assignments));

        assertThat(state.assignments()).isEmpty();
    }

    // ========================================
    // WHOLE SNAPSHOT
    // ========================================

    @Test
    @DisplayName("materialize should build the admin/editor example graph")
    void materialize_shouldBuildExampleGraph() {
        Map<String, ItemDescriptor> items = new LinkedHashMap<>();
        items.put("admin", role("editor"));
        items.put("editor", role());

        RbacState state = materializer.materialize(
            new RbacSnapshot(items, Map.of(), Map.of("alice", List.of("editor"))));

        assertThat(state.items()).containsOnlyKeys("admin", "editor");
        assertThat(state.parents().get("editor")).containsExactly(entry("admin", state.items().get("admin")));
        assertThat(state.assignments().get("alice").get("editor").username()).isEqualTo("alice");
    }

    @Test
    @DisplayName("materialize should produce an empty state from an empty snapshot")
    void materialize_shouldProduceEmptyState_whenSnapshotIsEmpty() {
        RbacState state = materializer.materialize(RbacSnapshot.empty());

        assertThat(state.isEmpty()).isTrue();
        assertThat(state.parents()).isEmpty();
    }

    @Test
    @DisplayName("materialized state should be read-only")
    void materialize_shouldReturnReadOnlyState() {
        Map<String, ItemDescriptor> items = new LinkedHashMap<>();
        items.put("admin", role("editor"));
        items.put("editor", role());

        RbacState state = materializer.materialize(new RbacSnapshot(items, null, null));

        assertThatThrownBy(() -> state.items().remove("admin"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> state.parents().get("editor").clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    private static ItemDescriptor role(String... children) {
        return new ItemDescriptor(ItemType.ROLE, null, null, List.of(children));
    }

    private static RuleDescriptor rule(String typeName, String ruleData) {
        return new RuleDescriptor(new RuleDescriptor.RuleData(typeName, ruleData));
    }

    static class LimitRule extends Rule {

        LimitRule(String name, JsonNode data) {
            super(name, data);
        }
    }
}
