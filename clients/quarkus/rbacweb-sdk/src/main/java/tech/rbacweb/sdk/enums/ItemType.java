package tech.rbacweb.sdk.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Variant of an RBAC item.
 */
public enum ItemType {
    /** A single grantable capability */
    PERMISSION("permission"),

    /** A named group of permissions and other roles */
    ROLE("role");

    private final String value;

    ItemType(String value) {
        this.value = value;
    }

    /**
     * Serializes enum to its lowercase wire value
     */
    @JsonValue
    public String toValue() {
        return value;
    }

    /**
     * Deserializes the wire value. Anything other than exactly "permission" is a role.
     *
     * @param value the string value
     * @return the corresponding ItemType
     */
    @JsonCreator
    public static ItemType fromValue(String value) {
        return PERMISSION.value.equals(value) ? PERMISSION : ROLE;
    }
}
