package com.platform.onboarding.schema;

/**
 * How the current state of a class is read from the device.
 */
public enum ReadMode {
    /** Collection endpoint returning {@code items}. */
    COLLECTION,
    /** Single object endpoint. */
    SINGLETON,
    /** Collection of modules folded into one object keyed by module name. */
    PROVISIONING_LEVELS,
    /** Attributes of the local device entry in the device list. */
    LOCAL_DEVICE,
    /** One collection per variant, tagged with the item's discriminator. */
    VARIANTS,
    /** Assembled from several endpoints. */
    COMPOSITE
}
