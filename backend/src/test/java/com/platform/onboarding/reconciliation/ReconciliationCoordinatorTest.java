package com.platform.onboarding.reconciliation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.EngineFixture;
import com.platform.onboarding.device.DevicePaths;
import com.platform.onboarding.device.FakeDeviceClient;
import com.platform.onboarding.schema.ConfigClass;
import com.platform.onboarding.state.Task;
import com.platform.onboarding.state.TaskResult;
import com.platform.onboarding.state.TaskState;
import com.platform.onboarding.translate.AuthenticationMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconciliationCoordinatorTest {

    private static final String VLAN_PATH = "/tm/net/vlan";
    private static final String ROUTE_DOMAIN_PATH = "/tm/net/route-domain";
    private static final String USER_PATH = "/tm/auth/user";

    private static final String NETWORK_DECLARATION = "{'schemaVersion':'1.30.0','class':'Device',"
        + "'Common':{'class':'Tenant',"
        + "'myVlan':{'class':'VLAN','tag':4093},"
        + "'myRouteDomain':{'class':'RouteDomain','id':100,'vlans':['myVlan']}}}";

    private static final String EMPTY_DECLARATION =
        "{'schemaVersion':'1.30.0','class':'Device','Common':{'class':'Tenant'}}";

    private EngineFixture engine;
    private FakeDeviceClient device;

    @BeforeEach
    void setup() {
        engine = new EngineFixture();
        device = new FakeDeviceClient();
    }

    @AfterEach
    void cleanup() {
        engine.close();
    }

    private Task declare(String declaration) {
        String taskId = engine.stateStore.addTask();
        engine.coordinator.reconcile(taskId, engine.json(declaration), device);
        return engine.stateStore.getTask(taskId);
    }

    @Test
    void GIVEN_vlan_and_route_domain_WHEN_declared_THEN_both_created_in_dependency_order() {
        Task task = declare(NETWORK_DECLARATION);

        assertEquals(TaskState.SUCCEEDED, task.getState());
        assertEquals(200, task.getResult().getCode());
        assertEquals(TaskResult.STATUS_OK, task.getResult().getStatus());
        assertEquals(ReconciliationCoordinator.MESSAGE_SUCCESS, task.getResult().getMessage());
        assertThat(device.getMutations(), contains("POST " + VLAN_PATH, "POST " + ROUTE_DOMAIN_PATH));

        ObjectNode routeDomain = device.object(ROUTE_DOMAIN_PATH + "/~Common~myRouteDomain");
        assertNotNull(routeDomain);
        assertEquals(100, routeDomain.get("id").asInt());
        assertEquals("/Common/myVlan", routeDomain.get("vlans").get(0).asText());
        assertEquals(4093, device.object(VLAN_PATH + "/~Common~myVlan").get("tag").asInt());

        assertNotNull(task.getCurrentConfig());
        assertTrue(task.getCurrentConfig().contains(ConfigClass.VLAN, "myVlan"));
    }

    @Test
    void GIVEN_applied_declaration_WHEN_declared_again_THEN_no_device_changes() {
        declare(NETWORK_DECLARATION);
        device.clearCalls();

        Task second = declare(NETWORK_DECLARATION);

        assertEquals(TaskState.SUCCEEDED, second.getState());
        assertThat(device.getMutations(), empty());
    }

    @Test
    void GIVEN_applied_declaration_WHEN_common_emptied_THEN_objects_deleted_referencing_first() {
        declare(NETWORK_DECLARATION);
        device.clearCalls();

        Task task = declare(EMPTY_DECLARATION);

        assertEquals(TaskState.SUCCEEDED, task.getState());
        assertThat(device.getMutations(), contains(
            "DELETE " + ROUTE_DOMAIN_PATH + "/~Common~myRouteDomain",
            "DELETE " + VLAN_PATH + "/~Common~myVlan"));
        assertFalse(device.exists(VLAN_PATH + "/~Common~myVlan"));
    }

    @Test
    void GIVEN_unsupported_schema_version_WHEN_declared_THEN_failed_with_400_and_device_untouched() {
        Task task = declare("{'schemaVersion':'9.9.9','class':'Device','Common':{'class':'Tenant'}}");

        assertEquals(TaskState.FAILED, task.getState());
        assertEquals(400, task.getResult().getCode());
        assertEquals(ReconciliationCoordinator.MESSAGE_BAD_DECLARATION, task.getResult().getMessage());
        assertThat(task.getResult().getErrors(), hasItem(containsString("9.9.9")));
        assertThat(device.getCalls(), empty());
    }

    @Test
    void GIVEN_reference_to_undeclared_vlan_WHEN_declared_THEN_failed_with_400_naming_reference() {
        Task task = declare("{'schemaVersion':'1.30.0','class':'Device','Common':{'class':'Tenant',"
            + "'rd':{'class':'RouteDomain','id':5,'vlans':['missing']}}}");

        assertEquals(TaskState.FAILED, task.getState());
        assertEquals(400, task.getResult().getCode());
        assertThat(task.getResult().getErrors(), hasItem(containsString("VLAN missing referenced by RouteDomain rd")));
        assertThat(device.getMutations(), empty());
    }

    @Test
    void GIVEN_dry_run_control_WHEN_declared_THEN_succeeded_without_mutations() {
        Task task = declare("{'schemaVersion':'1.30.0','class':'Device','controls':{'dryRun':true,'trace':true},"
            + "'Common':{'class':'Tenant','myVlan':{'class':'VLAN','tag':10}}}");

        assertEquals(TaskState.SUCCEEDED, task.getState());
        assertEquals(ReconciliationCoordinator.MESSAGE_DRY_RUN, task.getResult().getMessage());
        assertThat(device.getMutations(), empty());
        assertTrue(task.hasTrace());
        assertEquals(1, task.getTraceDiff().size());
        assertEquals("CREATE", task.getTraceDiff().get(0).get("kind").asText());
    }

    @Test
    void GIVEN_no_trace_control_WHEN_declared_THEN_no_trace_recorded() {
        Task task = declare(NETWORK_DECLARATION);

        assertFalse(task.hasTrace());
        assertNull(task.getTraceDiff());
    }

    @Test
    void GIVEN_second_create_fails_WHEN_declared_THEN_first_create_rolled_back() {
        device.failOn("POST", ROUTE_DOMAIN_PATH, 500);

        Task task = declare(NETWORK_DECLARATION);

        assertEquals(TaskState.ROLLED_BACK, task.getState());
        assertEquals(422, task.getResult().getCode());
        assertEquals(ReconciliationCoordinator.MESSAGE_ROLLED_BACK, task.getResult().getMessage());
        assertThat(task.getResult().getErrors(), hasSize(1));
        assertThat(task.getResult().getErrors().get(0), containsString("RouteDomain myRouteDomain"));
        assertFalse(device.exists(VLAN_PATH + "/~Common~myVlan"));
        assertThat(device.getMutations(), hasItem("DELETE " + VLAN_PATH + "/~Common~myVlan"));
    }

    @Test
    void GIVEN_rollback_also_fails_WHEN_declared_THEN_failed_with_500() {
        device.failOn("POST", ROUTE_DOMAIN_PATH, 500)
            .failOn("DELETE", VLAN_PATH + "/~Common~myVlan", 500);

        Task task = declare(NETWORK_DECLARATION);

        assertEquals(TaskState.FAILED, task.getState());
        assertEquals(500, task.getResult().getCode());
        assertEquals(ReconciliationCoordinator.MESSAGE_ROLLBACK_FAILED, task.getResult().getMessage());
        assertThat(task.getResult().getErrors(), hasSize(2));
        assertTrue(device.exists(VLAN_PATH + "/~Common~myVlan"));
    }

    @Test
    void GIVEN_first_request_fails_WHEN_declared_THEN_failed_with_422_without_rollback() {
        device.failOn("POST", VLAN_PATH, 400);

        Task task = declare("{'schemaVersion':'1.30.0','class':'Device','Common':{'class':'Tenant',"
            + "'myVlan':{'class':'VLAN','tag':4093}}}");

        assertEquals(TaskState.FAILED, task.getState());
        assertEquals(422, task.getResult().getCode());
        assertEquals(ReconciliationCoordinator.MESSAGE_INVALID, task.getResult().getMessage());
        assertThat(device.getMutations(), contains("POST " + VLAN_PATH));
    }

    @Test
    void GIVEN_device_read_fails_WHEN_declared_THEN_failed_with_500() {
        device.failOn("GET", VLAN_PATH, 503);

        Task task = declare(NETWORK_DECLARATION);

        assertEquals(TaskState.FAILED, task.getState());
        assertEquals(500, task.getResult().getCode());
        assertThat(device.getMutations(), empty());
    }

    @Test
    void GIVEN_first_task_for_device_WHEN_declared_THEN_original_config_recorded_once() {
        Task first = declare(NETWORK_DECLARATION);
        declare(EMPTY_DECLARATION);

        assertEquals(FakeDeviceClient.MACHINE_ID, first.getMachineId());
        assertEquals(List.of(FakeDeviceClient.MACHINE_ID), engine.stateStore.getOriginalConfigIds());
        assertFalse(engine.stateStore.getOriginalConfigByConfigId(FakeDeviceClient.MACHINE_ID).orElseThrow()
            .contains(ConfigClass.VLAN, "myVlan"));
    }

    @Test
    void GIVEN_declaration_with_secret_WHEN_declared_THEN_stored_declaration_masked() {
        Task task = declare("{'schemaVersion':'1.30.0','class':'Device','Common':{'class':'Tenant',"
            + "'myUser':{'class':'User','password':'hunter2','shell':'bash'}}}");

        assertEquals(TaskState.SUCCEEDED, task.getState());
        JsonNode stored = task.getDeclaration().path("Common").path("myUser");
        assertEquals("********", stored.path("password").asText());
        assertEquals("hunter2", device.object(USER_PATH + "/~Common~myUser").path("password").asText());
    }

    @Test
    void GIVEN_malformed_certificate_content_WHEN_declared_THEN_rejected_before_any_device_change() {
        Task task = declare("{'schemaVersion':'1.30.0','class':'Device','Common':{'class':'Tenant',"
            + "'myVlan':{'class':'VLAN','tag':4093},"
            + "'myCert':{'class':'DeviceCertificate','certificate':{'base64':'abcde'}}}}");

        assertEquals(TaskState.FAILED, task.getState());
        assertEquals(400, task.getResult().getCode());
        assertThat(task.getResult().getErrors(), hasItem("Common.myCert.certificate.base64: invalid base64"));
        assertThat(device.getMutations(), empty());
    }

    @Test
    void GIVEN_unexpected_failure_after_first_change_WHEN_declared_THEN_rolled_back() {
        device.throwOn("POST", ROUTE_DOMAIN_PATH, new IllegalStateException("response stream closed"));

        Task task = declare(NETWORK_DECLARATION);

        assertEquals(TaskState.ROLLED_BACK, task.getState());
        assertEquals(422, task.getResult().getCode());
        assertThat(task.getResult().getErrors().get(0), containsString("response stream closed"));
        assertFalse(device.exists(VLAN_PATH + "/~Common~myVlan"));
    }

    @Test
    void GIVEN_apply_cancelled_WHEN_declared_THEN_left_applying_without_rollback() {
        device.throwOn("POST", ROUTE_DOMAIN_PATH, new CancellationException("interrupted"));
        String taskId = engine.stateStore.addTask();

        assertThrows(CancellationException.class,
            () -> engine.coordinator.reconcile(taskId, engine.json(NETWORK_DECLARATION), device));

        assertEquals(TaskState.APPLYING, engine.stateStore.getState(taskId));
        assertThat(device.getMutations(), contains("POST " + VLAN_PATH, "POST " + ROUTE_DOMAIN_PATH));
        assertTrue(device.exists(VLAN_PATH + "/~Common~myVlan"));
    }

    @Test
    void GIVEN_user_password_changed_WHEN_declared_THEN_new_password_sent_once() {
        String user = "{'schemaVersion':'1.30.0','class':'Device','Common':{'class':'Tenant',"
            + "'myUser':{'class':'User','password':'%s','shell':'bash'}}}";
        declare(String.format(user, "first-pass"));
        device.clearCalls();

        Task rotated = declare(String.format(user, "second-pass"));

        assertEquals(TaskState.SUCCEEDED, rotated.getState());
        assertThat(device.getMutations(), contains("PATCH " + USER_PATH + "/~Common~myUser"));
        assertEquals("second-pass", device.object(USER_PATH + "/~Common~myUser").path("password").asText());

        device.clearCalls();
        declare(String.format(user, "second-pass"));
        assertThat(device.getMutations(), empty());
    }

    @Test
    void GIVEN_radius_secret_changed_WHEN_declared_THEN_server_secret_rewritten() {
        String radius = "{'schemaVersion':'1.30.0','class':'Device','Common':{'class':'Tenant',"
            + "'auth':{'class':'Authentication','enabledSourceType':'radius',"
            + "'radius':{'servers':{'primary':{'server':'10.0.0.1','secret':'%s'}}}}}}";
        declare(String.format(radius, "one"));
        device.clearCalls();

        Task rotated = declare(String.format(radius, "two"));

        assertEquals(TaskState.SUCCEEDED, rotated.getState());
        assertThat(device.getMutations(), not(empty()));
        String primary = DevicePaths.commonObject(DevicePaths.AUTH_RADIUS_SERVER, AuthenticationMapper.RADIUS_PRIMARY);
        assertEquals("two", device.object(primary).path("secret").asText());
    }
}
