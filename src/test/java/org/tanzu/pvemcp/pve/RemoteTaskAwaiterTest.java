package org.tanzu.pvemcp.pve;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RemoteTaskAwaiterTest {

    private static final String UPID = "UPID:pve1:00001234:start:101:root@pam:";

    private PveClient client;
    private RemoteTaskAwaiter awaiter;

    @BeforeEach
    void setUp() {
        client = mock(PveClient.class);
        when(client.getProfileName()).thenReturn("lab");
        awaiter = new RemoteTaskAwaiter(Duration.ofMillis(10), Duration.ofMillis(500));
    }

    @Test
    void emptyUpidMeansSynchronousSuccess() throws Exception {
        assertEquals(RemoteTaskAwaiter.SYNCHRONOUS_OK, awaiter.await(client, "pve1", ""));
        assertEquals(RemoteTaskAwaiter.SYNCHRONOUS_OK, awaiter.await(client, "pve1", null));
        verify(client, never()).getTaskStatus(anyString(), anyString());
    }

    @Test
    void pollsUntilTaskStops() throws Exception {
        when(client.getTaskStatus("pve1", UPID)).thenReturn(
                new RemoteTaskStatus(UPID, "running", null),
                new RemoteTaskStatus(UPID, "running", null),
                new RemoteTaskStatus(UPID, "stopped", "OK"));

        assertEquals("OK", awaiter.await(client, "pve1", UPID));
        verify(client, times(3)).getTaskStatus("pve1", UPID);
    }

    @Test
    void transientReadFailuresAreTolerated() throws Exception {
        when(client.getTaskStatus("pve1", UPID))
            .thenThrow(new PveApiException("lab", "connection reset"))
            .thenReturn(new RemoteTaskStatus(UPID, "stopped", "OK"));

        assertEquals("OK", awaiter.await(client, "pve1", UPID));
    }

    @Test
    void nonOkExitStatusFails() {
        when(client.getTaskStatus("pve1", UPID))
            .thenReturn(new RemoteTaskStatus(UPID, "stopped", "command 'qm start 101' failed: exit code 255"));

        PveApiException failure = assertThrows(PveApiException.class, () -> awaiter.await(client, "pve1", UPID));

        assertTrue(failure.getMessage().contains("exit code 255"));
        assertEquals("lab", failure.getProfileName());
    }

    @Test
    void giveUpAfterMaxWait() {
        when(client.getTaskStatus("pve1", UPID)).thenReturn(new RemoteTaskStatus(UPID, "running", null));

        PveApiException failure = assertThrows(PveApiException.class, () -> awaiter.await(client, "pve1", UPID));

        assertTrue(failure.getMessage().contains("did not finish"));
    }

    @Test
    void interruptionStopsWaiting() {
        when(client.getTaskStatus("pve1", UPID)).thenReturn(new RemoteTaskStatus(UPID, "running", null));

        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedException.class, () -> awaiter.await(client, "pve1", UPID));
        } finally {
            Thread.interrupted();
        }
    }
}
