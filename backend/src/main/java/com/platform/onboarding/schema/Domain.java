package com.platform.onboarding.schema;

/**
 * Configuration domains. Each domain is applied by exactly one handler.
 */
public enum Domain {
    SYSTEM,
    NETWORK,
    FIREWALL,
    DSC,
    AUTHENTICATION,
    GSLB
}
