package com.platform.onboarding.translate;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.EngineFixture;
import com.platform.onboarding.schema.ConfigClass;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdentifierMigratorTest {

    private EngineFixture engine;
    private IdentifierMigrator migrator;

    @BeforeEach
    void setup() {
        engine = new EngineFixture();
        migrator = engine.migrator;
    }

    @AfterEach
    void cleanup() {
        engine.close();
    }

    @Test
    void GIVEN_legacy_ids_WHEN_updated_THEN_renamed_to_current_ids() {
        ObjectNode system = (ObjectNode) engine.json("{'consoleTimeout':30,'mgmtDhcp':'disabled'}");

        boolean changed = migrator.updateIds(engine.schema.item(ConfigClass.SYSTEM), system);

        assertTrue(changed);
        assertEquals(30, system.get("consoleInactivityTimeout").asInt());
        assertEquals("disabled", system.get("mgmtDhcpEnabled").asText());
        assertFalse(system.has("consoleTimeout"));
    }

    @Test
    void GIVEN_both_legacy_and_current_id_WHEN_updated_THEN_current_value_kept() {
        ObjectNode system = (ObjectNode) engine.json("{'consoleTimeout':30,'consoleInactivityTimeout':60}");

        migrator.updateIds(engine.schema.item(ConfigClass.SYSTEM), system);

        assertEquals(60, system.get("consoleInactivityTimeout").asInt());
        assertFalse(system.has("consoleTimeout"));
    }

    @Test
    void GIVEN_migrated_tree_WHEN_migrated_again_THEN_nothing_changes() {
        ObjectNode config = (ObjectNode) engine.json("{'System':{'consoleTimeout':30},"
            + "'VLAN':{'v1':{'failsafe':'enabled'},'v2':{'tag':5}},'Unknown':{'x':1}}");

        assertTrue(migrator.migrate(config));
        ObjectNode once = config.deepCopy();
        assertFalse(migrator.migrate(config));

        assertEquals(once, config);
        assertEquals("enabled", config.at("/VLAN/v1/failsafeEnabled").asText());
        assertEquals(30, config.at("/System/consoleInactivityTimeout").asInt());
    }
}
