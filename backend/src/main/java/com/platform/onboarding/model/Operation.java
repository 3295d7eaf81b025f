package com.platform.onboarding.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.onboarding.schema.ConfigClass;
import com.platform.onboarding.schema.Domain;

/**
 * One planned device change.
 *
 * @param configClass class of the affected object
 * @param name object name, null for nameless classes
 * @param kind create, modify or delete
 * @param changes properties to send: everything for creates, only changed properties for named modifies,
 *                the full desired object for nameless modifies, empty for deletes
 * @param desired desired object, null for deletes
 * @param current current object, null for creates
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Operation(
    ConfigClass configClass,
    String name,
    OperationKind kind,
    ConfigObject changes,
    ConfigObject desired,
    ConfigObject current
) {
    
    public static Operation create(ConfigClass configClass, String name, ConfigObject desired) {
        return new Operation(configClass, name, OperationKind.CREATE, desired, desired, null);
    }
    
    public static Operation modify(ConfigClass configClass, String name, ConfigObject changes,
            ConfigObject desired, ConfigObject current) {
        return new Operation(configClass, name, OperationKind.MODIFY, changes, desired, current);
    }
    
    public static Operation delete(ConfigClass configClass, String name, ConfigObject current) {
        return new Operation(configClass, name, OperationKind.DELETE, ConfigObject.empty(), null, current);
    }
    
    @JsonIgnore
    public Domain domain() {
        return configClass.getDomain();
    }
    
    /**
     * Human readable target, e.g. {@code VLAN myVlan}.
     */
    @JsonIgnore
    public String target() {
        return name == null ? configClass.getDeclaredName() : configClass.getDeclaredName() + " " + name;
    }
}
