package com.platform.onboarding.plan;

import com.fasterxml.jackson.databind.node.IntNode;
import com.platform.onboarding.EngineFixture;
import com.platform.onboarding.error.PlanningException;
import com.platform.onboarding.model.ConfigObject;
import com.platform.onboarding.model.Declaration;
import com.platform.onboarding.model.DeviceConfig;
import com.platform.onboarding.model.Operation;
import com.platform.onboarding.model.OperationKind;
import com.platform.onboarding.schema.ConfigClass;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DiffPlannerTest {

    private EngineFixture engine;
    private DiffPlanner planner;

    @BeforeEach
    void setup() {
        engine = new EngineFixture();
        planner = engine.planner;
    }

    @AfterEach
    void cleanup() {
        engine.close();
    }

    private DeviceConfig config(String common) {
        return engine.translator.fromDeclaration(Declaration.of(
            engine.json("{'schemaVersion':'1.30.0','class':'Device','Common':" + common + "}")));
    }

    private static List<String> summary(List<Operation> plan) {
        return plan.stream().map(op -> op.kind() + " " + op.target()).toList();
    }

    @Test
    void GIVEN_empty_device_WHEN_planned_THEN_referenced_class_created_first() {
        DeviceConfig desired = config("{'class':'Tenant',"
            + "'rd':{'class':'RouteDomain','id':2,'vlans':['v1']},"
            + "'v1':{'class':'VLAN','tag':100}}");

        List<Operation> plan = planner.plan(desired, DeviceConfig.empty());

        assertThat(summary(plan), contains("CREATE VLAN v1", "CREATE RouteDomain rd"));
    }

    @Test
    void GIVEN_identical_configs_WHEN_planned_THEN_plan_empty() {
        DeviceConfig desired = config("{'class':'Tenant','hostname':'bigip.example.com',"
            + "'v1':{'class':'VLAN','tag':100},'rd':{'class':'RouteDomain','id':2,'vlans':['v1']}}");

        assertThat(planner.plan(desired, desired), empty());
    }

    @Test
    void GIVEN_same_inputs_WHEN_planned_twice_THEN_same_plan() {
        DeviceConfig desired = config("{'class':'Tenant','v1':{'class':'VLAN','tag':100},'v2':{'class':'VLAN','tag':200}}");
        DeviceConfig current = config("{'class':'Tenant','v1':{'class':'VLAN','tag':101},'v3':{'class':'VLAN','tag':300}}");

        assertEquals(planner.plan(desired, current), planner.plan(desired, current));
    }

    @Test
    void GIVEN_undeclared_objects_WHEN_planned_THEN_deleted_in_reverse_precedence_after_creates() {
        DeviceConfig current = config("{'class':'Tenant',"
            + "'v1':{'class':'VLAN','tag':100},'rd':{'class':'RouteDomain','id':2,'vlans':['v1']}}");
        DeviceConfig desired = config("{'class':'Tenant','v2':{'class':'VLAN','tag':200}}");

        List<Operation> plan = planner.plan(desired, current);

        assertThat(summary(plan), contains("CREATE VLAN v2", "DELETE RouteDomain rd", "DELETE VLAN v1"));
    }

    @Test
    void GIVEN_changed_property_WHEN_planned_THEN_modify_carries_only_changes() {
        DeviceConfig current = config("{'class':'Tenant','v1':{'class':'VLAN','tag':100,'mtu':9000}}");
        DeviceConfig desired = config("{'class':'Tenant','v1':{'class':'VLAN','tag':100,'mtu':1500}}");

        List<Operation> plan = planner.plan(desired, current);

        assertThat(summary(plan), contains("MODIFY VLAN v1"));
        assertEquals(ConfigObject.of(Map.of("mtu", IntNode.valueOf(1500))), plan.get(0).changes());
    }

    @Test
    void GIVEN_omitted_optional_property_WHEN_planned_THEN_reset_to_default() {
        DeviceConfig current = config("{'class':'Tenant','v1':{'class':'VLAN','tag':100,'mtu':9000}}");
        DeviceConfig desired = config("{'class':'Tenant','v1':{'class':'VLAN','tag':100}}");

        List<Operation> plan = planner.plan(desired, current);

        assertEquals(1500, plan.get(0).changes().get("mtu").orElseThrow().asInt());
    }

    @Test
    void GIVEN_legacy_property_id_WHEN_planned_against_current_id_THEN_no_change() {
        DeviceConfig current = config("{'class':'Tenant','v1':{'class':'VLAN','tag':100,'failsafeEnabled':true}}");
        DeviceConfig desired = config("{'class':'Tenant','v1':{'class':'VLAN','tag':100,'failsafe':'enabled'}}");

        assertThat(planner.plan(desired, current), empty());
    }

    @Test
    void GIVEN_nameless_class_changed_WHEN_planned_THEN_single_modify_with_full_object() {
        DeviceConfig current = config("{'class':'Tenant','dns':{'class':'DNS','nameServers':['1.1.1.1']}}");
        DeviceConfig desired = config("{'class':'Tenant','dns':{'class':'DNS','nameServers':['8.8.8.8']}}");

        List<Operation> plan = planner.plan(desired, current);

        assertThat(summary(plan), contains("MODIFY DNS"));
        assertEquals(desired.nameless(ConfigClass.DNS).orElseThrow(), plan.get(0).changes());
    }

    @Test
    void GIVEN_nameless_class_missing_from_desired_WHEN_planned_THEN_left_alone() {
        DeviceConfig current = config("{'class':'Tenant','dns':{'class':'DNS','nameServers':['1.1.1.1']}}");

        assertThat(planner.plan(DeviceConfig.empty(), current), empty());
    }

    @Test
    void GIVEN_protected_and_never_pruned_objects_WHEN_undeclared_THEN_not_deleted() {
        DeviceConfig current = config("{'class':'Tenant',"
            + "'0':{'class':'RouteDomain','id':0},"
            + "'operator':{'class':'User','shell':'bash'}}");

        assertThat(planner.plan(DeviceConfig.empty(), current), empty());
    }

    @Test
    void GIVEN_restore_plan_WHEN_unpruned_class_has_extra_object_THEN_deleted() {
        DeviceConfig current = config("{'class':'Tenant','operator':{'class':'User','shell':'bash'},"
            + "'admin':{'class':'User','shell':'tmsh'}}");

        List<Operation> plan = planner.planRestore(DeviceConfig.empty(), current);

        assertThat(summary(plan), contains("DELETE User operator"));
        assertEquals(OperationKind.DELETE, plan.get(0).kind());
    }

    @Test
    void GIVEN_unresolvable_reference_WHEN_planned_THEN_planning_fails() {
        DeviceConfig desired = config("{'class':'Tenant','rd':{'class':'RouteDomain','id':2,'vlans':['ghost']}}");

        PlanningException e = assertThrows(PlanningException.class,
            () -> planner.plan(desired, DeviceConfig.empty()));
        assertThat(e.getUnresolved(), hasItem(containsString("ghost")));
    }

    @Test
    void GIVEN_reference_outside_common_WHEN_planned_THEN_not_checked() {
        DeviceConfig desired = config("{'class':'Tenant','rd':{'class':'RouteDomain','id':2,'vlans':['/Other/v9']}}");

        assertThat(summary(planner.plan(desired, DeviceConfig.empty())), contains("CREATE RouteDomain rd"));
    }

    @Test
    void GIVEN_password_never_applied_WHEN_planned_THEN_sent_even_though_unreadable() {
        DeviceConfig current = config("{'class':'Tenant','u1':{'class':'User','shell':'bash'}}");
        DeviceConfig desired = config("{'class':'Tenant','u1':{'class':'User','shell':'bash','password':'p1'}}");

        List<Operation> plan = planner.plan(desired, current);

        assertThat(summary(plan), contains("MODIFY User u1"));
        assertEquals(Set.of("password"), plan.get(0).changes().propertyNames());
        assertThat(planner.plan(desired, current, planner.secretDigests(desired)), empty());
    }

    @Test
    void GIVEN_password_changed_since_applied_WHEN_planned_THEN_only_password_modified() {
        DeviceConfig current = config("{'class':'Tenant','u1':{'class':'User','shell':'bash'}}");
        DeviceConfig applied = config("{'class':'Tenant','u1':{'class':'User','shell':'bash','password':'old'}}");
        DeviceConfig desired = config("{'class':'Tenant','u1':{'class':'User','shell':'bash','password':'new'}}");

        List<Operation> plan = planner.plan(desired, current, planner.secretDigests(applied));

        assertThat(summary(plan), contains("MODIFY User u1"));
        assertEquals("new", plan.get(0).changes().get("password").orElseThrow().asText());
    }

    @Test
    void GIVEN_nested_secret_changed_in_nameless_class_WHEN_planned_THEN_full_modify() {
        String radius = "{'class':'Tenant','auth':{'class':'Authentication','enabledSourceType':'radius',"
            + "'radius':{'servers':{'primary':{'server':'10.0.0.1','secret':'%s'}}}}}";
        DeviceConfig applied = config(String.format(radius, "one"));
        DeviceConfig desired = config(String.format(radius, "two"));

        assertThat(planner.plan(applied, applied, planner.secretDigests(applied)), empty());

        List<Operation> plan = planner.plan(desired, applied, planner.secretDigests(applied));

        assertThat(summary(plan), contains("MODIFY Authentication"));
        assertEquals(desired.nameless(ConfigClass.AUTHENTICATION).orElseThrow(), plan.get(0).changes());
    }
}
