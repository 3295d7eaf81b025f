package com.platform.onboarding.schema;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Schema entry for one configuration class: where it lives on the device,
 * which properties it carries and which names are reserved by the device.
 */
public record ConfigItem(
    ConfigClass configClass,
    String path,
    List<PropertyDescriptor> properties,
    Set<String> protectedNames,
    ReadMode readMode,
    boolean pruneUndeclared,
    String discriminator,
    List<String> variants
) {
    
    public ConfigItem {
        properties = List.copyOf(properties);
        protectedNames = Set.copyOf(protectedNames);
        variants = List.copyOf(variants);
    }
    
    public boolean isNameless() {
        return configClass.isNameless();
    }
    
    public Domain domain() {
        return configClass.getDomain();
    }
    
    public Optional<PropertyDescriptor> property(String id) {
        return properties.stream().filter(p -> p.id().equals(id)).findFirst();
    }
    
    public Optional<PropertyDescriptor> propertyByDeviceName(String deviceName) {
        return properties.stream().filter(p -> p.deviceName().equals(deviceName)).findFirst();
    }
    
    /**
     * Device-owned objects are never deleted and always resolvable.
     */
    public boolean isProtected(String name) {
        return protectedNames.contains(name);
    }
    
    /**
     * Full device path of a named object in the Common partition.
     */
    public String objectPath(String name) {
        return path + "/~Common~" + name;
    }
    
    /**
     * Collection path for a variant of a discriminated class.
     */
    public String variantPath(String variant) {
        return path + "/" + variant;
    }
}
