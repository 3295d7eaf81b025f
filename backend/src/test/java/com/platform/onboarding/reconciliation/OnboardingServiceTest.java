package com.platform.onboarding.reconciliation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.EngineFixture;
import com.platform.onboarding.api.TaskView;
import com.platform.onboarding.config.OnboardingProperties;
import com.platform.onboarding.device.FakeDeviceClient;
import com.platform.onboarding.error.TaskNotFoundException;
import com.platform.onboarding.state.Task;
import com.platform.onboarding.state.TaskState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OnboardingServiceTest {

    private static final String BASE_PATH = "/mgmt/onboarding/task";
    private static final String VLAN_PATH = "/tm/net/vlan";
    private static final String ROUTE_DOMAIN_PATH = "/tm/net/route-domain";

    private EngineFixture engine;
    private FakeDeviceClient device;
    private List<Runnable> queued;
    private OnboardingService service;

    @BeforeEach
    void setup() {
        engine = new EngineFixture();
        device = new FakeDeviceClient();
        queued = new ArrayList<>();
        service = newService(queued::add);
    }

    @AfterEach
    void cleanup() {
        engine.close();
    }

    private OnboardingService newService(TaskExecutor executor) {
        return new OnboardingService(engine.coordinator, engine.stateStore, engine.reader, device, executor,
            new OnboardingProperties());
    }

    private static String declaration(String controls) {
        return "{'schemaVersion':'1.30.0','class':'Device'," + controls
            + "'Common':{'class':'Tenant','myVlan':{'class':'VLAN','tag':4093}}}";
    }

    @Test
    void GIVEN_synchronous_declaration_WHEN_submitted_THEN_terminal_task_returned() {
        Task task = service.submit(engine.json(declaration("")));

        assertEquals(TaskState.SUCCEEDED, task.getState());
        assertTrue(queued.isEmpty());
        assertTrue(device.exists(VLAN_PATH + "/~Common~myVlan"));
    }

    @Test
    void GIVEN_async_declaration_WHEN_submitted_THEN_task_returned_before_reconciling() {
        Task task = service.submit(engine.json(declaration("'async':true,")));

        assertEquals(TaskState.CREATED, task.getState());
        assertEquals(202, task.getResult().getCode());
        assertEquals(1, queued.size());

        queued.get(0).run();

        assertEquals(TaskState.SUCCEEDED, service.getTask(task.getId()).getState());
    }

    @Test
    void GIVEN_tasks_WHEN_listed_THEN_every_task_returned() {
        OnboardingService synchronous = newService(new SyncTaskExecutor());
        String first = synchronous.submit(engine.json(declaration(""))).getId();
        String second = synchronous.submit(engine.json(declaration("'async':true,"))).getId();

        assertThat(synchronous.listTaskIds(), containsInAnyOrder(first, second));
        assertEquals(2, synchronous.listTasks().size());
        assertThrows(TaskNotFoundException.class, () -> synchronous.getTask("missing"));
    }

    @Test
    void GIVEN_trace_response_requested_WHEN_viewed_THEN_trace_included() {
        Task task = service.submit(engine.json(declaration("'controls':{'trace':true,'traceResponse':true},")));

        TaskView view = TaskView.of(task, BASE_PATH);

        assertEquals(BASE_PATH + "/" + task.getId(), view.getSelfLink());
        assertNotNull(view.getTraceDiff());
        assertNotNull(view.getTraceCurrent());
    }

    @Test
    void GIVEN_trace_without_trace_response_WHEN_viewed_THEN_trace_hidden() {
        Task task = service.submit(engine.json(declaration("'controls':{'trace':true},")));

        TaskView view = TaskView.of(task, BASE_PATH);

        assertTrue(task.hasTrace());
        assertNull(view.getTraceDiff());
        assertNull(view.getTraceDesired());
    }

    @Test
    void GIVEN_device_objects_WHEN_inspected_THEN_rendered_as_declaration_with_unique_keys() {
        device.put(VLAN_PATH, (ObjectNode) engine.json(
            "{'name':'shared','partition':'Common','tag':100}"));
        device.put(ROUTE_DOMAIN_PATH, (ObjectNode) engine.json(
            "{'name':'shared','partition':'Common','id':5}"));

        ObjectNode declaration = service.inspect();

        assertEquals("Device", declaration.get("class").asText());
        assertEquals("1.30.0", declaration.get("schemaVersion").asText());
        assertEquals("VLAN", declaration.at("/Common/shared/class").asText());
        assertEquals(100, declaration.at("/Common/shared/tag").asInt());
        assertEquals("RouteDomain", declaration.at("/Common/RouteDomain_shared/class").asText());
    }
}
