package com.platform.onboarding.translate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.EngineFixture;
import com.platform.onboarding.error.ValidationException;
import com.platform.onboarding.model.ConfigObject;
import com.platform.onboarding.model.Declaration;
import com.platform.onboarding.model.DeviceConfig;
import com.platform.onboarding.schema.ConfigClass;
import com.platform.onboarding.schema.ConfigItem;
import com.platform.onboarding.schema.PropertyDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTranslatorTest {

    private EngineFixture engine;
    private ConfigTranslator translator;

    @BeforeEach
    void setup() {
        engine = new EngineFixture();
        translator = engine.translator;
    }

    @AfterEach
    void cleanup() {
        engine.close();
    }

    private DeviceConfig translate(String common) {
        return translator.fromDeclaration(Declaration.of(
            engine.json("{'schemaVersion':'1.30.0','class':'Device','Common':" + common + "}")));
    }

    @Test
    void GIVEN_common_hostname_WHEN_translated_THEN_becomes_system_hostname() {
        DeviceConfig config = translate("{'class':'Tenant','hostname':'bigip1.example.com'}");

        ConfigObject system = config.nameless(ConfigClass.SYSTEM).orElseThrow();
        assertEquals("bigip1.example.com", system.get("hostname").orElseThrow().asText());
        assertEquals("enabled", system.get("mgmtDhcpEnabled").orElseThrow().asText());
    }

    @Test
    void GIVEN_system_hostname_and_common_hostname_WHEN_translated_THEN_system_wins() {
        DeviceConfig config = translate("{'class':'Tenant','hostname':'common.example.com',"
            + "'sys':{'class':'System','hostname':'system.example.com'}}");

        assertEquals("system.example.com",
            config.nameless(ConfigClass.SYSTEM).orElseThrow().get("hostname").orElseThrow().asText());
    }

    @Test
    void GIVEN_booleans_WHEN_translated_THEN_device_encoding_used() {
        DeviceConfig config = translate("{'class':'Tenant',"
            + "'v1':{'class':'VLAN','tag':10,'failsafeEnabled':true},"
            + "'role1':{'class':'RemoteAuthRole','attribute':'F5-LTM-User-Info-1=1','lineOrder':1,'remoteAccess':true}}");

        assertEquals("enabled", config.named(ConfigClass.VLAN).get("v1").get("failsafeEnabled").orElseThrow().asText());
        assertEquals("disabled", config.named(ConfigClass.REMOTE_AUTH_ROLE).get("role1")
            .get("remoteAccess").orElseThrow().asText());
    }

    @Test
    void GIVEN_short_reference_names_WHEN_translated_THEN_normalized_to_common_paths() {
        DeviceConfig config = translate("{'class':'Tenant','v1':{'class':'VLAN','tag':10},"
            + "'rd':{'class':'RouteDomain','id':3,'vlans':['v1','/Common/http-tunnel']}}");

        JsonNode vlans = config.named(ConfigClass.ROUTE_DOMAIN).get("rd").get("vlans").orElseThrow();
        assertEquals("/Common/v1", vlans.get(0).asText());
        assertEquals("/Common/http-tunnel", vlans.get(1).asText());
    }

    @Test
    void GIVEN_omitted_properties_WHEN_translated_THEN_defaults_filled_and_labels_dropped() {
        DeviceConfig config = translate("{'class':'Tenant','v1':{'class':'VLAN','label':'uplink','tag':10}}");

        ConfigObject vlan = config.named(ConfigClass.VLAN).get("v1");
        assertEquals(1500, vlan.get("mtu").orElseThrow().asInt());
        assertEquals(90, vlan.get("failsafeTimeout").orElseThrow().asInt());
        assertFalse(vlan.has("label"));
        assertFalse(vlan.has("class"));
    }

    @Test
    void GIVEN_encoded_value_WHEN_encoded_again_THEN_unchanged() {
        ConfigItem item = engine.schema.item(ConfigClass.AUTHENTICATION);
        PropertyDescriptor sourceType = item.property("enabledSourceType").orElseThrow();

        JsonNode once = translator.encode(sourceType, engine.json("'activeDirectory'"));
        JsonNode twice = translator.encode(sourceType, once);

        assertEquals("active-directory", once.asText());
        assertEquals(once, twice);
    }

    @Test
    void GIVEN_device_items_WHEN_read_THEN_device_names_mapped_and_other_partitions_skipped() {
        JsonNode items = engine.json("[{'name':'v1','partition':'Common','tag':10,'failsafe':'enabled','mtu':9000},"
            + "{'name':'v2','partition':'Tenant1','tag':20}]");

        DeviceConfig config = translator.fromDevice(Map.of(ConfigClass.VLAN, items));

        assertEquals(1, config.named(ConfigClass.VLAN).size());
        ConfigObject vlan = config.named(ConfigClass.VLAN).get("v1");
        assertEquals("enabled", vlan.get("failsafeEnabled").orElseThrow().asText());
        assertEquals(9000, vlan.get("mtu").orElseThrow().asInt());
        assertFalse(vlan.has("name"));
    }

    @Test
    void GIVEN_reference_list_reported_as_string_WHEN_read_THEN_split_into_paths() {
        JsonNode items = engine.json("[{'name':'rd','partition':'Common','id':3,'vlans':'/Common/a and /Common/b'}]");

        DeviceConfig config = translator.fromDevice(Map.of(ConfigClass.ROUTE_DOMAIN, items));

        JsonNode vlans = config.named(ConfigClass.ROUTE_DOMAIN).get("rd").get("vlans").orElseThrow();
        assertEquals(2, vlans.size());
        assertEquals("/Common/b", vlans.get(1).asText());
    }

    @Test
    void GIVEN_canonical_object_WHEN_converted_to_body_THEN_device_property_names_used() {
        ConfigItem item = engine.schema.item(ConfigClass.VLAN);
        ConfigObject vlan = translate("{'class':'Tenant','v1':{'class':'VLAN','tag':10}}").named(ConfigClass.VLAN).get("v1");

        ObjectNode body = translator.toDeviceBody(item, vlan);

        assertEquals("disabled", body.get("failsafe").asText());
        assertFalse(body.has("failsafeEnabled"));
        assertEquals(10, body.get("tag").asInt());
    }

    @Test
    void GIVEN_unknown_class_WHEN_translated_THEN_rejected() {
        assertThrows(ValidationException.class, () -> translate("{'class':'Tenant','x':{'class':'Bogus'}}"));
    }

    @Test
    void GIVEN_reference_paths_WHEN_common_name_extracted_THEN_other_partitions_excluded() {
        assertEquals("v1", ConfigTranslator.commonName("/Common/v1").orElseThrow());
        assertEquals("v1", ConfigTranslator.commonName("v1").orElseThrow());
        assertTrue(ConfigTranslator.commonName("/Tenant1/v1").isEmpty());
    }
}
