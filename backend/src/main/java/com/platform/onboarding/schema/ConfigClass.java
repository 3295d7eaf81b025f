package com.platform.onboarding.schema;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of configuration classes a declaration may contain.
 * 
 * Declaration order is the precedence order: a class may only reference
 * classes declared before it. Creates and modifies run in this order,
 * deletes run in reverse.
 */
public enum ConfigClass {
    
    // ==================== System ====================
    
    DEVICE_CERTIFICATE("DeviceCertificate", Domain.SYSTEM, false),
    SYSTEM("System", Domain.SYSTEM, true),
    DNS("DNS", Domain.SYSTEM, true),
    NTP("NTP", Domain.SYSTEM, true),
    PROVISION("Provision", Domain.SYSTEM, true),
    MANAGEMENT_ROUTE("ManagementRoute", Domain.SYSTEM, false),
    USER("User", Domain.SYSTEM, false),
    
    // ==================== Network / Firewall ====================
    // Traffic groups sit ahead of self IPs, which are placed into them.
    
    VLAN("VLAN", Domain.NETWORK, false),
    ROUTE_DOMAIN("RouteDomain", Domain.NETWORK, false),
    FIREWALL_ADDRESS_LIST("FirewallAddressList", Domain.FIREWALL, false),
    FIREWALL_PORT_LIST("FirewallPortList", Domain.FIREWALL, false),
    FIREWALL_POLICY("FirewallPolicy", Domain.FIREWALL, false),
    TRAFFIC_GROUP("TrafficGroup", Domain.DSC, false),
    SELF_IP("SelfIp", Domain.NETWORK, false),
    ROUTE("Route", Domain.NETWORK, false),
    DNS_RESOLVER("DNS_Resolver", Domain.NETWORK, false),
    ROUTING_AS_PATH("RoutingAsPath", Domain.NETWORK, false),
    ROUTING_PREFIX_LIST("RoutingPrefixList", Domain.NETWORK, false),
    ROUTE_MAP("RouteMap", Domain.NETWORK, false),
    ROUTING_BGP("RoutingBGP", Domain.NETWORK, false),
    
    // ==================== Device Service Clustering ====================
    
    CONFIG_SYNC("ConfigSync", Domain.DSC, true),
    FAILOVER_UNICAST("FailoverUnicast", Domain.DSC, true),
    FAILOVER_MULTICAST("FailoverMulticast", Domain.DSC, true),
    MIRROR_IP("MirrorIp", Domain.DSC, true),
    DEVICE_GROUP("DeviceGroup", Domain.DSC, false),
    
    // ==================== Authentication ====================
    
    REMOTE_AUTH_ROLE("RemoteAuthRole", Domain.AUTHENTICATION, false),
    AUTHENTICATION("Authentication", Domain.AUTHENTICATION, true),
    
    // ==================== GSLB ====================
    
    GSLB_GLOBALS("GSLBGlobals", Domain.GSLB, true),
    GSLB_DATA_CENTER("GSLBDataCenter", Domain.GSLB, false),
    GSLB_MONITOR("GSLBMonitor", Domain.GSLB, false),
    GSLB_PROBER_POOL("GSLBProberPool", Domain.GSLB, false),
    GSLB_SERVER("GSLBServer", Domain.GSLB, false);
    
    private final String declaredName;
    private final Domain domain;
    private final boolean nameless;
    
    ConfigClass(String declaredName, Domain domain, boolean nameless) {
        this.declaredName = declaredName;
        this.domain = domain;
        this.nameless = nameless;
    }
    
    /**
     * Value of the {@code class} field in a declaration.
     */
    public String getDeclaredName() {
        return declaredName;
    }
    
    public Domain getDomain() {
        return domain;
    }
    
    /**
     * Nameless classes hold a single object and are never created or deleted.
     */
    public boolean isNameless() {
        return nameless;
    }
    
    public static Optional<ConfigClass> fromDeclaredName(String name) {
        return Arrays.stream(values())
            .filter(c -> c.declaredName.equals(name))
            .findFirst();
    }
}
