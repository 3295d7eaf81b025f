package com.platform.onboarding.handler;

import com.platform.onboarding.device.DeviceClient;
import com.platform.onboarding.device.DevicePaths;
import com.platform.onboarding.error.ApplyException;
import com.platform.onboarding.error.DeviceClientException;
import com.platform.onboarding.schema.ConfigClass;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

class ApplyStepTest {

    private static final String UPLOAD_PATH = DevicePaths.UPLOADS + "/cert.key";

    private final DeviceClient client = mock(DeviceClient.class);

    private static ApplyStep failingStep(RuntimeException failure) {
        return new ApplyStep(ConfigClass.DEVICE_CERTIFICATE, "cert", UPLOAD_PATH, c -> {
            throw failure;
        });
    }

    @Test
    void GIVEN_device_error_WHEN_step_run_THEN_apply_failure_names_request_path() {
        ApplyStep step = failingStep(new DeviceClientException("POST", DevicePaths.SSL_KEY, 400, "bad key"));

        ApplyException e = assertThrows(ApplyException.class, () -> step.run(client));

        assertEquals(DevicePaths.SSL_KEY, e.getPath());
        assertEquals("cert", e.getObjectName());
    }

    @Test
    void GIVEN_content_that_cannot_be_decoded_WHEN_step_run_THEN_reported_as_apply_failure() {
        ApplyStep step = new CertificateInstaller().installStep(ConfigClass.DEVICE_CERTIFICATE, "cert",
            "cert", "cert.key", "abcde", DevicePaths.SSL_KEY);

        ApplyException e = assertThrows(ApplyException.class, () -> step.run(client));

        assertEquals(UPLOAD_PATH, e.getPath());
        assertEquals("DeviceCertificate", e.getConfigClass());
        assertThat(e.getCause(), instanceOf(IllegalArgumentException.class));
    }

    @Test
    void GIVEN_unexpected_runtime_failure_WHEN_step_run_THEN_wrapped_with_step_path() {
        ApplyException e = assertThrows(ApplyException.class,
            () -> failingStep(new IllegalStateException("boom")).run(client));

        assertThat(e.getMessage(), containsString(UPLOAD_PATH));
        assertThat(e.getMessage(), containsString("boom"));
    }

    @Test
    void GIVEN_cancellation_WHEN_step_run_THEN_passed_through_unwrapped() {
        CancellationException cancelled = new CancellationException("interrupted");

        CancellationException e = assertThrows(CancellationException.class,
            () -> failingStep(cancelled).run(client));

        assertSame(cancelled, e);
    }
}
