package com.platform.onboarding.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.platform.onboarding.schema.PropertyDescriptor.property;
import static com.platform.onboarding.schema.PropertyType.*;

/**
 * Static table of every supported configuration class.
 * 
 * Iteration order of {@link #items()} is the precedence order.
 */
public final class SchemaMap {
    
    private static final SchemaMap STANDARD = buildStandard();
    
    private final Map<ConfigClass, ConfigItem> items;
    
    public SchemaMap(Map<ConfigClass, ConfigItem> items) {
        this.items = new EnumMap<>(items);
        for (ConfigClass configClass : ConfigClass.values()) {
            if (!this.items.containsKey(configClass)) {
                throw new IllegalArgumentException("No schema entry for " + configClass);
            }
        }
    }
    
    public static SchemaMap standard() {
        return STANDARD;
    }
    
    public ConfigItem item(ConfigClass configClass) {
        return items.get(configClass);
    }
    
    /**
     * All entries in precedence order.
     */
    public List<ConfigItem> items() {
        return new ArrayList<>(items.values());
    }
    
    public Optional<ConfigItem> find(String declaredName) {
        return ConfigClass.fromDeclaredName(declaredName).map(items::get);
    }
    
    public boolean isProtected(ConfigClass configClass, String name) {
        return items.get(configClass).isProtected(name);
    }
    
    // ==================== Standard table ====================
    
    private static SchemaMap buildStandard() {
        Map<ConfigClass, ConfigItem> map = new EnumMap<>(ConfigClass.class);
        
        // System
        put(map, named(ConfigClass.DEVICE_CERTIFICATE, "/tm/sys/file/ssl-cert",
            Set.of("default.crt", "ca-bundle.crt", "f5-ca-bundle.crt", "f5-irule.crt"), false,
            property("certificate", OBJECT).asWriteOnly(),
            property("privateKey", OBJECT).asWriteOnly()));
        put(map, singleton(ConfigClass.SYSTEM, "/tm/sys/global-settings",
            property("hostname", STRING),
            property("consoleInactivityTimeout", INTEGER).defaultsTo(0).legacy("consoleTimeout"),
            property("guiSetup", ENABLED_DISABLED).defaultsTo("disabled"),
            property("mgmtDhcpEnabled", ENABLED_DISABLED).device("mgmtDhcp").defaultsTo("enabled").legacy("mgmtDhcp")));
        put(map, singleton(ConfigClass.DNS, "/tm/sys/dns",
            property("nameServers", LIST).defaultsTo(List.of()),
            property("search", LIST).defaultsTo(List.of("localhost"))));
        put(map, singleton(ConfigClass.NTP, "/tm/sys/ntp",
            property("servers", LIST).defaultsTo(List.of()),
            property("timezone", STRING).defaultsTo("America/Los_Angeles")));
        put(map, new ConfigItem(ConfigClass.PROVISION, "/tm/sys/provision",
            provisioningModules(), Set.of(), ReadMode.PROVISIONING_LEVELS, false, null, List.of()));
        put(map, named(ConfigClass.MANAGEMENT_ROUTE, "/tm/sys/management-route", Set.of("default"), true,
            property("gw", STRING),
            property("network", STRING).defaultsTo("default"),
            property("mtu", INTEGER).defaultsTo(0),
            property("remark", STRING).device("description")));
        put(map, named(ConfigClass.USER, "/tm/auth/user", Set.of("admin", "root"), false,
            property("password", STRING).asWriteOnly(),
            property("shell", STRING).defaultsTo("tmsh"),
            property("partitionAccess", OBJECT)));
        
        // Network
        put(map, named(ConfigClass.VLAN, "/tm/net/vlan", Set.of(), true,
            property("tag", INTEGER),
            property("mtu", INTEGER).defaultsTo(1500),
            property("interfaces", LIST).defaultsTo(List.of()),
            property("cmpHash", STRING).defaultsTo("default"),
            property("failsafeEnabled", ENABLED_DISABLED).device("failsafe").defaultsTo("disabled").legacy("failsafe"),
            property("failsafeAction", STRING).defaultsTo("failover-restart-tm"),
            property("failsafeTimeout", INTEGER).defaultsTo(90)));
        put(map, named(ConfigClass.ROUTE_DOMAIN, "/tm/net/route-domain", Set.of("0"), true,
            property("id", INTEGER).asImmutable(),
            property("connectionLimit", INTEGER).defaultsTo(0),
            property("strict", ENABLED_DISABLED).defaultsTo("enabled"),
            property("vlans", REFERENCE_LIST).references(ConfigClass.VLAN).defaultsTo(List.of())));
        
        // Firewall
        put(map, named(ConfigClass.FIREWALL_ADDRESS_LIST, "/tm/security/firewall/address-list", Set.of(), true,
            property("addresses", LIST).defaultsTo(List.of()),
            property("fqdns", LIST).defaultsTo(List.of()),
            property("geo", LIST).defaultsTo(List.of()),
            property("remark", STRING).device("description")));
        put(map, named(ConfigClass.FIREWALL_PORT_LIST, "/tm/security/firewall/port-list", Set.of(), true,
            property("ports", LIST).defaultsTo(List.of()),
            property("remark", STRING).device("description")));
        put(map, named(ConfigClass.FIREWALL_POLICY, "/tm/security/firewall/policy", Set.of(), true,
            property("remark", STRING).device("description"),
            property("rules", LIST).defaultsTo(List.of())
                .nested("source.vlans", ConfigClass.VLAN)
                .nested("source.addressLists", ConfigClass.FIREWALL_ADDRESS_LIST)
                .nested("source.portLists", ConfigClass.FIREWALL_PORT_LIST)
                .nested("destination.addressLists", ConfigClass.FIREWALL_ADDRESS_LIST)
                .nested("destination.portLists", ConfigClass.FIREWALL_PORT_LIST)));
        
        // Network, continued
        put(map, named(ConfigClass.SELF_IP, "/tm/net/self", Set.of(), true,
            property("address", STRING).asImmutable(),
            property("vlan", REFERENCE).references(ConfigClass.VLAN).asImmutable(),
            property("trafficGroup", REFERENCE).references(ConfigClass.TRAFFIC_GROUP)
                .defaultsTo("/Common/traffic-group-local-only"),
            property("allowService", LIST).defaultsTo(List.of("none")),
            property("enforcedPolicy", REFERENCE).device("fwEnforcedPolicy").references(ConfigClass.FIREWALL_POLICY),
            property("stagedPolicy", REFERENCE).device("fwStagedPolicy").references(ConfigClass.FIREWALL_POLICY)));
        put(map, named(ConfigClass.ROUTE, "/tm/net/route", Set.of(), true,
            property("gw", STRING),
            property("target", REFERENCE).device("interface").references(ConfigClass.VLAN),
            property("network", STRING).defaultsTo("default"),
            property("mtu", INTEGER).defaultsTo(0)));
        put(map, named(ConfigClass.DNS_RESOLVER, "/tm/net/dns-resolver", Set.of("f5-aws-dns"), true,
            property("answerDefaultZones", YES_NO).defaultsTo("no"),
            property("cacheSize", INTEGER).defaultsTo(5767168),
            property("forwardZones", LIST).defaultsTo(List.of()),
            property("randomizeQueryNameCase", YES_NO).defaultsTo("yes"),
            property("routeDomain", REFERENCE).references(ConfigClass.ROUTE_DOMAIN).defaultsTo("/Common/0"),
            property("useIpv4", YES_NO).defaultsTo("yes"),
            property("useIpv6", YES_NO).defaultsTo("yes"),
            property("useTcp", YES_NO).defaultsTo("yes"),
            property("useUdp", YES_NO).defaultsTo("yes")));
        put(map, named(ConfigClass.ROUTING_AS_PATH, "/tm/net/routing/as-path", Set.of(), true,
            property("entries", LIST).defaultsTo(List.of())));
        put(map, named(ConfigClass.ROUTING_PREFIX_LIST, "/tm/net/routing/prefix-list", Set.of(), true,
            property("entries", LIST).defaultsTo(List.of()),
            property("routeDomain", REFERENCE).references(ConfigClass.ROUTE_DOMAIN).defaultsTo("/Common/0")));
        put(map, named(ConfigClass.ROUTE_MAP, "/tm/net/routing/route-map", Set.of(), true,
            property("entries", LIST).defaultsTo(List.of())
                .nested("match.asPath", ConfigClass.ROUTING_AS_PATH)
                .nested("match.ipv4.address.prefixList", ConfigClass.ROUTING_PREFIX_LIST)
                .nested("match.ipv4.nextHop.prefixList", ConfigClass.ROUTING_PREFIX_LIST)
                .nested("match.ipv6.address.prefixList", ConfigClass.ROUTING_PREFIX_LIST)
                .nested("match.ipv6.nextHop.prefixList", ConfigClass.ROUTING_PREFIX_LIST),
            property("routeDomain", REFERENCE).references(ConfigClass.ROUTE_DOMAIN).defaultsTo("/Common/0")));
        put(map, named(ConfigClass.ROUTING_BGP, "/tm/net/routing/bgp", Set.of(), true,
            property("localAS", INTEGER).asImmutable(),
            property("routerId", STRING),
            property("holdTime", INTEGER).defaultsTo(90),
            property("keepAlive", INTEGER).defaultsTo(30),
            property("addressFamilies", LIST).defaultsTo(List.of())
                .nested("redistributionList.routeMap", ConfigClass.ROUTE_MAP),
            property("gracefulRestart", OBJECT),
            property("neighbors", LIST).defaultsTo(List.of()),
            property("peerGroups", LIST).defaultsTo(List.of())
                .nested("addressFamilies.routeMap.in", ConfigClass.ROUTE_MAP)
                .nested("addressFamilies.routeMap.out", ConfigClass.ROUTE_MAP),
            property("routeDomain", REFERENCE).references(ConfigClass.ROUTE_DOMAIN).defaultsTo("/Common/0")));
        
        // DSC
        put(map, localDevice(ConfigClass.CONFIG_SYNC,
            property("configsyncIp", STRING).defaultsTo("none")));
        put(map, localDevice(ConfigClass.FAILOVER_UNICAST,
            property("addressPorts", LIST).device("unicastAddress").defaultsTo(List.of())));
        put(map, localDevice(ConfigClass.FAILOVER_MULTICAST,
            property("interface", STRING).device("multicastInterface").defaultsTo("none"),
            property("address", STRING).device("multicastIp").defaultsTo("any6"),
            property("port", INTEGER).device("multicastPort").defaultsTo(0)));
        put(map, localDevice(ConfigClass.MIRROR_IP,
            property("primaryIp", STRING).device("mirrorIp").defaultsTo("any6"),
            property("secondaryIp", STRING).device("mirrorSecondaryIp").defaultsTo("any6")));
        put(map, named(ConfigClass.TRAFFIC_GROUP, "/tm/cm/traffic-group",
            Set.of("traffic-group-1", "traffic-group-local-only"), true,
            property("autoFailbackEnabled", TRUE_FALSE_STRING).device("autoFailbackEnabled").defaultsTo("false"),
            property("autoFailbackTime", INTEGER).defaultsTo(60),
            property("failoverMethod", STRING).defaultsTo("ha-order"),
            property("haLoadFactor", INTEGER).defaultsTo(1),
            property("haOrder", LIST).defaultsTo(List.of())));
        put(map, named(ConfigClass.DEVICE_GROUP, "/tm/cm/device-group",
            Set.of("device_trust_group", "gtm", "datasync-global-dg", "dos-global-dg"), true,
            property("type", STRING).defaultsTo("sync-only").asImmutable(),
            property("members", LIST).defaultsTo(List.of()),
            property("autoSync", ENABLED_DISABLED).defaultsTo("disabled"),
            property("saveOnAutoSync", TRUE_FALSE_STRING).defaultsTo("false"),
            property("networkFailover", ENABLED_DISABLED).defaultsTo("disabled"),
            property("asmSync", ENABLED_DISABLED).defaultsTo("disabled"),
            property("fullLoadOnSync", TRUE_FALSE_STRING).defaultsTo("false")));
        
        // Authentication
        put(map, named(ConfigClass.REMOTE_AUTH_ROLE, "/tm/auth/remote-role/role-info", Set.of(), true,
            property("attribute", STRING),
            property("console", STRING).defaultsTo("disabled"),
            property("remoteAccess", INVERTED_ENABLED_DISABLED).device("deny").defaultsTo("enabled"),
            property("lineOrder", INTEGER),
            property("role", STRING).defaultsTo("no-access"),
            property("userPartition", STRING).defaultsTo("all")));
        put(map, new ConfigItem(ConfigClass.AUTHENTICATION, "/tm/auth/source",
            List.of(
                property("enabledSourceType", STRING).device("type").defaultsTo("local")
                    .mapValue("activeDirectory", "active-directory"),
                property("fallback", TRUE_FALSE_STRING).defaultsTo("false"),
                property("remoteUsersDefaults", OBJECT),
                property("radius", OBJECT),
                property("ldap", OBJECT),
                property("tacacs", OBJECT)),
            Set.of(), ReadMode.COMPOSITE, false, null, List.of()));
        
        // GSLB
        put(map, singleton(ConfigClass.GSLB_GLOBALS, "/tm/gtm/global-settings/general",
            property("synchronizationEnabled", YES_NO).device("synchronization").defaultsTo("no"),
            property("synchronizationGroupName", STRING).defaultsTo("default"),
            property("synchronizationTimeTolerance", INTEGER).defaultsTo(10),
            property("synchronizationTimeout", INTEGER).defaultsTo(180)));
        put(map, named(ConfigClass.GSLB_DATA_CENTER, "/tm/gtm/datacenter", Set.of(), true,
            property("enabled", ENABLED_DISABLED).defaultsTo("enabled"),
            property("contact", STRING),
            property("location", STRING),
            property("proberFallback", STRING).defaultsTo("any-available"),
            property("proberPreferred", STRING).defaultsTo("inside-datacenter")));
        put(map, new ConfigItem(ConfigClass.GSLB_MONITOR, "/tm/gtm/monitor",
            List.of(
                property("monitorType", STRING).asImmutable(),
                property("interval", INTEGER).defaultsTo(30),
                property("timeout", INTEGER).defaultsTo(120),
                property("probeTimeout", INTEGER).defaultsTo(5),
                property("ignoreDownResponseEnabled", ENABLED_DISABLED).device("ignoreDownResponse").defaultsTo("disabled"),
                property("transparent", ENABLED_DISABLED).defaultsTo("disabled"),
                property("target", STRING).device("destination").defaultsTo("*:*"),
                property("send", STRING),
                property("receive", STRING)),
            Set.of("http", "https", "http_head_f5", "https_head_f5", "gateway_icmp", "tcp", "udp", "bigip"),
            ReadMode.VARIANTS, true, "monitorType", List.of("http", "https", "gateway-icmp", "tcp", "udp")));
        put(map, named(ConfigClass.GSLB_PROBER_POOL, "/tm/gtm/prober-pool", Set.of(), true,
            property("enabled", ENABLED_DISABLED).defaultsTo("enabled"),
            property("lbMode", STRING).device("loadBalancingMode").defaultsTo("global-availability"),
            property("members", LIST).defaultsTo(List.of())));
        put(map, named(ConfigClass.GSLB_SERVER, "/tm/gtm/server", Set.of(), true,
            property("dataCenter", REFERENCE).device("datacenter").references(ConfigClass.GSLB_DATA_CENTER),
            property("serverType", STRING).device("product").defaultsTo("bigip"),
            property("devices", LIST).defaultsTo(List.of()),
            property("virtualServers", LIST).defaultsTo(List.of()),
            property("proberPool", REFERENCE).references(ConfigClass.GSLB_PROBER_POOL),
            property("monitors", REFERENCE_LIST).device("monitor").references(ConfigClass.GSLB_MONITOR)
                .defaultsTo(List.of("/Common/bigip"))));
        
        return new SchemaMap(map);
    }
    
    private static List<PropertyDescriptor> provisioningModules() {
        return Arrays.stream(new String[]{"ltm", "gtm", "asm", "apm", "avr", "afm", "ilx", "pem", "swg", "urldb"})
            .map(module -> property(module, STRING).defaultsTo("none"))
            .toList();
    }
    
    private static void put(Map<ConfigClass, ConfigItem> map, ConfigItem item) {
        map.put(item.configClass(), item);
    }
    
    private static ConfigItem named(ConfigClass configClass, String path, Set<String> protectedNames,
            boolean pruneUndeclared, PropertyDescriptor... properties) {
        return new ConfigItem(configClass, path, List.of(properties), protectedNames,
            ReadMode.COLLECTION, pruneUndeclared, null, List.of());
    }
    
    private static ConfigItem singleton(ConfigClass configClass, String path, PropertyDescriptor... properties) {
        return new ConfigItem(configClass, path, List.of(properties), Set.of(),
            ReadMode.SINGLETON, false, null, List.of());
    }
    
    private static ConfigItem localDevice(ConfigClass configClass, PropertyDescriptor... properties) {
        return new ConfigItem(configClass, "/tm/cm/device", List.of(properties), Set.of(),
            ReadMode.LOCAL_DEVICE, false, null, List.of());
    }
}
