package com.platform.onboarding.schema;

/**
 * How a declared property value is encoded for the device.
 */
public enum PropertyType {
    STRING,
    INTEGER,
    /** Passed through as a JSON boolean. */
    BOOLEAN,
    /** Declared boolean, device "enabled"/"disabled". */
    ENABLED_DISABLED,
    /** Declared boolean, device "disabled"/"enabled" (the device stores a deny flag). */
    INVERTED_ENABLED_DISABLED,
    /** Declared boolean, device "true"/"false" strings. */
    TRUE_FALSE_STRING,
    /** Declared boolean, device "yes"/"no". */
    YES_NO,
    /** Name of another object, normalized to its full path. */
    REFERENCE,
    /** List of object names, each normalized to its full path. */
    REFERENCE_LIST,
    /** Array passed through unchanged apart from nested references. */
    LIST,
    /** Structured value passed through unchanged apart from nested references. */
    OBJECT
}
