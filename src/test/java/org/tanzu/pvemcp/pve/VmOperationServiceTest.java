package org.tanzu.pvemcp.pve;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.tanzu.pvemcp.aggregator.ClusterAggregator;
import org.tanzu.pvemcp.task.BatchSubmissionSummary;
import org.tanzu.pvemcp.task.EnqueueResult;
import org.tanzu.pvemcp.task.PendingOperationTracker;
import org.tanzu.pvemcp.task.StabilizationMonitor;
import org.tanzu.pvemcp.task.TargetIdentity;
import org.tanzu.pvemcp.task.Task;
import org.tanzu.pvemcp.task.TaskExecutionException;
import org.tanzu.pvemcp.task.TaskQueue;
import org.tanzu.pvemcp.task.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class VmOperationServiceTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final String UPID = "UPID:pve1:0001:qmstart:101:root@pam:";

    private PendingOperationTracker tracker;
    private TaskQueue taskQueue;
    private StabilizationMonitor monitor;
    private ClusterAggregator aggregator;
    private PveClient client;
    private VmOperationService service;

    @BeforeEach
    void setUp() {
        tracker = new PendingOperationTracker();
        taskQueue = new TaskQueue(tracker, 20);
        monitor = new StabilizationMonitor(tracker);
        aggregator = mock(ClusterAggregator.class);
        client = mock(PveClient.class);
        when(client.getProfileName()).thenReturn("lab");
        when(aggregator.getClient("lab")).thenReturn(Optional.of(client));
        when(client.getTaskStatus(anyString(), anyString())).thenReturn(new RemoteTaskStatus(UPID, "stopped", "OK"));

        RemoteTaskAwaiter awaiter = new RemoteTaskAwaiter(Duration.ofMillis(10), Duration.ofSeconds(2));
        service = new VmOperationService(taskQueue, aggregator, monitor, awaiter,
                Duration.ofMillis(20), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        taskQueue.close();
        monitor.close();
    }

    private static VmInfo vm(int vmid, String node, String type, String status, long uptime) {
        return new VmInfo(vmid, "vm" + vmid, node, type, status, uptime, 0.0, 2, 0, 0, false, "lab", false);
    }

    private static Task taskOf(EnqueueResult result) {
        assertTrue(result.isAccepted(), result.getMessage());
        return result.getTask();
    }

    @Test
    void startRunsAndReleasesMarkerOnceGuestIsRunning() throws Exception {
        VmInfo stopped = vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_STOPPED, 0);
        when(client.startVm(stopped)).thenReturn(UPID);
        when(aggregator.fetchVm("lab", "pve1", VmInfo.TYPE_QEMU, 101))
            .thenReturn(vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_RUNNING, 2));

        Task task = taskOf(service.submitVmOperation(VmOperationType.START, stopped));
        task.getCompletion().get(5, TimeUnit.SECONDS);

        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertEquals("OK", task.getResultLabel());
        assertEquals("Start", task.getType());
        verify(client).startVm(stopped);
        await().atMost(WAIT).until(() -> !tracker.hasAny());
    }

    @Test
    void markerIsHeldUntilExpectedStateIsObserved() throws Exception {
        VmInfo running = vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_RUNNING, 500);
        AtomicReference<String> reported = new AtomicReference<>(VmInfo.STATUS_RUNNING);
        when(client.shutdownVm(running)).thenReturn(UPID);
        when(aggregator.fetchVm("lab", "pve1", VmInfo.TYPE_QEMU, 101))
            .thenAnswer(invocation -> vm(101, "pve1", VmInfo.TYPE_QEMU, reported.get(), 500));

        Task task = taskOf(service.submitVmOperation(VmOperationType.SHUTDOWN, running));
        task.getCompletion().get(5, TimeUnit.SECONDS);

        TargetIdentity target = running.toTarget();
        assertEquals(Optional.of("Shutdown"), tracker.isPending(target));
        assertTrue(service.submitVmOperation(VmOperationType.START, running).isConflict());

        reported.set(VmInfo.STATUS_STOPPED);
        await().atMost(WAIT).until(() -> tracker.isPending(target).isEmpty());
    }

    @Test
    void failedOperationReleasesMarkerImmediately() throws Exception {
        VmInfo stopped = vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_STOPPED, 0);
        when(client.startVm(stopped)).thenThrow(new PveApiException("lab", "VM is locked (backup)"));

        Task task = taskOf(service.submitVmOperation(VmOperationType.START, stopped));
        task.getCompletion().get(5, TimeUnit.SECONDS);

        assertEquals(TaskStatus.FAILED, task.getStatus());
        assertTrue(task.getError() instanceof TaskExecutionException);
        assertTrue(task.getError().getMessage().contains("locked"));
        assertFalse(tracker.hasAny());
        verify(aggregator, never()).fetchVm(anyString(), anyString(), anyString(), anyInt());
    }

    @Test
    void failedRemoteTaskFailsTheOperation() throws Exception {
        VmInfo stopped = vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_STOPPED, 0);
        when(client.startVm(stopped)).thenReturn(UPID);
        when(client.getTaskStatus("pve1", UPID)).thenReturn(new RemoteTaskStatus(UPID, "stopped", "start failed"));

        Task task = taskOf(service.submitVmOperation(VmOperationType.START, stopped));
        task.getCompletion().get(5, TimeUnit.SECONDS);

        assertEquals(TaskStatus.FAILED, task.getStatus());
        assertFalse(tracker.hasAny());
    }

    @Test
    void disconnectedProfileFailsTheTask() throws Exception {
        when(aggregator.getClient("lab")).thenReturn(Optional.empty());

        Task task = taskOf(service.submitVmOperation(VmOperationType.STOP,
                vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_RUNNING, 10)));
        task.getCompletion().get(5, TimeUnit.SECONDS);

        assertEquals(TaskStatus.FAILED, task.getStatus());
        assertTrue(task.getError().getCause() instanceof PveApiException);
        assertFalse(tracker.hasAny());
    }

    @Test
    void secondOperationOnSameGuestConflicts() throws Exception {
        VmInfo stopped = vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_STOPPED, 0);
        CountDownLatch release = new CountDownLatch(1);
        when(client.startVm(stopped)).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return "";
        });
        when(aggregator.fetchVm(anyString(), anyString(), anyString(), anyInt()))
            .thenReturn(vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_RUNNING, 1));

        Task first = taskOf(service.submitVmOperation(VmOperationType.START, stopped));
        EnqueueResult second = service.submitVmOperation(VmOperationType.DELETE, stopped);

        assertFalse(second.isAccepted());
        assertEquals(EnqueueResult.REASON_CONFLICT, second.getReason());
        assertSame(first, second.getTask());

        release.countDown();
        first.getCompletion().get(5, TimeUnit.SECONDS);
        verify(client, never()).deleteVm(any());
    }

    @Test
    void migrationRequiresAnotherNode() {
        VmInfo running = vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_RUNNING, 10);

        assertThrows(IllegalArgumentException.class,
                () -> service.submitVmOperation(VmOperationType.MIGRATE, running));
        assertThrows(IllegalArgumentException.class,
                () -> service.submitVmOperation(VmOperationType.MIGRATE, running, new MigrationOptions("pve1", null)));
        assertFalse(tracker.hasAny());
    }

    @Test
    void migrationSettlesWhenGuestRunsOnTargetNode() throws Exception {
        VmInfo running = vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_RUNNING, 10);
        MigrationOptions options = new MigrationOptions("pve2", true);
        when(client.migrateVm(running, options)).thenReturn(UPID);
        when(aggregator.fetchVm("lab", "pve2", VmInfo.TYPE_QEMU, 101))
            .thenReturn(vm(101, "pve2", VmInfo.TYPE_QEMU, VmInfo.STATUS_RUNNING, 15));

        Task task = taskOf(service.submitVmOperation(VmOperationType.MIGRATE, running, options));
        task.getCompletion().get(5, TimeUnit.SECONDS);

        assertTrue(task.getDescription().contains("to pve2"));
        await().atMost(WAIT).until(() -> !tracker.hasAny());
        verify(aggregator, atLeastOnce()).fetchVm("lab", "pve2", VmInfo.TYPE_QEMU, 101);
    }

    @Test
    void rebootSettlesWhenUptimeRestarts() throws Exception {
        VmInfo running = vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_RUNNING, 86400);
        when(client.rebootVm(running)).thenReturn(UPID);
        when(aggregator.fetchVm("lab", "pve1", VmInfo.TYPE_QEMU, 101))
            .thenReturn(vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_RUNNING, 3));

        taskOf(service.submitVmOperation(VmOperationType.REBOOT, running)).getCompletion().get(5, TimeUnit.SECONDS);

        await().atMost(WAIT).until(() -> !tracker.hasAny());
    }

    @Test
    void deleteSettlesWhenGuestIsNoLongerListed() throws Exception {
        VmInfo stopped = vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_STOPPED, 0);
        when(client.deleteVm(stopped)).thenReturn(UPID);
        when(client.getClusterResources()).thenReturn(new ClusterSnapshot(List.of(),
                List.of(vm(102, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_RUNNING, 1)), Instant.now()));

        taskOf(service.submitVmOperation(VmOperationType.DELETE, stopped)).getCompletion().get(5, TimeUnit.SECONDS);

        await().atMost(WAIT).until(() -> !tracker.hasAny());
    }

    @Test
    void nodeRebootHoldsMarkerUntilNodeIsBack() throws Exception {
        AtomicReference<Long> uptime = new AtomicReference<>(1_000_000L);
        when(client.rebootNode("pve1")).thenReturn("");
        when(client.getClusterResources()).thenAnswer(invocation -> new ClusterSnapshot(
                List.of(new NodeInfo("pve1", true, 0.1, 8, 0, 0, uptime.get(), null, false)),
                List.of(), Instant.now()));

        Task task = taskOf(service.submitNodeOperation(NodeOperationType.REBOOT, "lab", "pve1"));
        task.getCompletion().get(5, TimeUnit.SECONDS);

        TargetIdentity node = TargetIdentity.node("lab", "pve1");
        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertEquals(Optional.of("Reboot node"), tracker.isPending(node));

        uptime.set(0L);
        await().atMost(WAIT).until(() -> tracker.isPending(node).isEmpty());
    }

    @Test
    void batchSkipsIneligibleGuests() throws Exception {
        VmInfo stopped = vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_STOPPED, 0);
        VmInfo running = vm(102, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_RUNNING, 10);
        when(client.startVm(stopped)).thenReturn("");
        when(aggregator.fetchVm("lab", "pve1", VmInfo.TYPE_QEMU, 101))
            .thenReturn(vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_RUNNING, 1));

        BatchSubmissionSummary summary = service.submitBatch(VmOperationType.START, List.of(stopped, running), false);

        assertEquals(1, summary.getSubmitted());
        assertEquals(1, summary.getSkipped());
        assertEquals(0, summary.getFailed());
        assertTrue(summary.getReasons().containsKey(running.toTarget()));
        verify(client, never()).startVm(running);
    }

    @Test
    void resetBatchSkipsContainers() {
        VmInfo container = vm(200, "pve1", VmInfo.TYPE_LXC, VmInfo.STATUS_RUNNING, 10);

        BatchSubmissionSummary summary = service.submitBatch(VmOperationType.RESET, List.of(container), false);

        assertEquals(0, summary.getSubmitted());
        assertEquals(1, summary.getSkipped());
    }

    @Test
    void exclusiveBatchIsRefusedWhileOperationsArePending() {
        tracker.setPending(TargetIdentity.vm("lab", "pve1", 300), "Migrate");

        assertThrows(IllegalStateException.class, () -> service.submitBatch(VmOperationType.START,
                List.of(vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_STOPPED, 0)), true));
        verify(client, never()).startVm(any());
    }

    @Test
    void nonExclusiveBatchProceedsWhileOtherOperationsArePending() {
        tracker.setPending(TargetIdentity.vm("lab", "pve1", 300), "Migrate");
        VmInfo stopped = vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_STOPPED, 0);
        when(client.startVm(stopped)).thenReturn("");
        when(aggregator.fetchVm(eq("lab"), eq("pve1"), eq(VmInfo.TYPE_QEMU), eq(101)))
            .thenReturn(vm(101, "pve1", VmInfo.TYPE_QEMU, VmInfo.STATUS_RUNNING, 1));

        BatchSubmissionSummary summary = service.submitBatch(VmOperationType.START, List.of(stopped), false);

        assertEquals(1, summary.getSubmitted());
    }
}
