package org.tanzu.pvemcp.aggregator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.tanzu.pvemcp.config.Profile;
import org.tanzu.pvemcp.pve.ClusterSnapshot;
import org.tanzu.pvemcp.pve.ClusterTask;
import org.tanzu.pvemcp.pve.NodeInfo;
import org.tanzu.pvemcp.pve.PveApiException;
import org.tanzu.pvemcp.pve.PveClient;
import org.tanzu.pvemcp.pve.PveClientFactory;
import org.tanzu.pvemcp.pve.VmInfo;
import org.tanzu.pvemcp.task.TargetIdentity;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Presents several Proxmox VE clusters, one per profile, as a single resource
 * universe.
 *
 * Profiles are connected concurrently and independently: a profile that cannot
 * be reached is recorded as failed while the others keep working. Only when
 * every profile fails does {@link #initialize} throw a
 * {@link TotalFailureException}. The same applies to resource refreshes, where
 * a profile that stops answering is marked degraded and its last known
 * resources stay visible, flagged stale.
 *
 * The connections map is guarded by a read/write lock that is never held
 * during network calls. The merged view is an immutable object replaced as a
 * whole on each refresh.
 */
public class ClusterAggregator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ClusterAggregator.class);

    private static final Comparator<NodeInfo> NODE_ORDER = Comparator
        .comparing(NodeInfo::getSourceProfile)
        .thenComparing(NodeInfo::getName);

    private static final Comparator<ClusterTask> TASK_ORDER = Comparator
        .comparingLong(ClusterTask::getStartTime).reversed()
        .thenComparing(ClusterTask::getSourceProfile);

    private static final Comparator<VmInfo> VM_ORDER = Comparator
        .comparing(VmInfo::getSourceProfile)
        .thenComparing(VmInfo::getNode)
        .thenComparingInt(VmInfo::getId);

    private final PveClientFactory clientFactory;
    private final Duration connectTimeout;
    private final Duration refreshTimeout;
    private final ExecutorService executor;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private Map<String, ProfileConnection> connections = new LinkedHashMap<>();
    private String groupName;
    private boolean closed;

    private volatile AggregatedView currentView = AggregatedView.empty();

    public ClusterAggregator(PveClientFactory clientFactory, Duration connectTimeout, Duration refreshTimeout) {
        this(clientFactory, connectTimeout, refreshTimeout,
                Executors.newCachedThreadPool(new CustomizableThreadFactory("pve-connect-")));
    }

    public ClusterAggregator(PveClientFactory clientFactory, Duration connectTimeout, Duration refreshTimeout,
                             ExecutorService executor) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.refreshTimeout = Objects.requireNonNull(refreshTimeout, "refreshTimeout");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public void initialize(List<Profile> profiles) {
        initialize(null, profiles, connectTimeout);
    }

    public void initialize(List<Profile> profiles, Duration timeout) {
        initialize(null, profiles, timeout);
    }

    /**
     * Connects every profile concurrently and waits for all attempts to settle.
     *
     * Each attempt is bounded by the connect timeout and by {@code timeout}.
     * Attempts still running at the deadline, or when the calling thread is
     * interrupted, are recorded as failed; a client they produce later is
     * closed. Previous connections are replaced and closed.
     *
     * @param group Name of the aggregate group being connected, for display
     * @param profiles The profiles to connect
     * @param timeout Overall deadline for all attempts
     * @throws IllegalArgumentException if no profiles are given
     * @throws TotalFailureException if no profile could be connected
     * @throws IllegalStateException if the aggregator was closed
     */
    public void initialize(String group, List<Profile> profiles, Duration timeout) {
        if (profiles == null || profiles.isEmpty()) {
            throw new IllegalArgumentException("At least one profile is required");
        }
        ensureOpen();
        logger.info("=== AGGREGATOR: initialize(group={}, profiles={}) ===", group, profiles.size());

        Map<String, ProfileConnection> fresh = new LinkedHashMap<>();
        Map<String, CompletableFuture<PveClient>> attempts = new LinkedHashMap<>();
        for (Profile profile : profiles) {
            if (fresh.containsKey(profile.getName())) {
                throw new IllegalArgumentException("Duplicate profile name: " + profile.getName());
            }
            fresh.put(profile.getName(), new ProfileConnection(profile));
        }
        for (Profile profile : profiles) {
            attempts.put(profile.getName(), connectAsync(profile));
        }

        Duration bound = timeout.compareTo(connectTimeout) < 0 ? timeout : connectTimeout;
        awaitConnects(fresh, attempts, System.nanoTime() + bound.toNanos());

        Map<String, ProfileConnection> previous;
        lock.writeLock().lock();
        try {
            if (closed) {
                previous = fresh;
            } else {
                previous = connections;
                connections = fresh;
                groupName = group;
                currentView = AggregatedView.empty();
            }
        } finally {
            lock.writeLock().unlock();
        }
        disconnectAll(previous);
        ensureOpen();

        ConnectionSummary summary = getConnectionSummary();
        logger.info("Aggregator initialized: {}/{} profiles connected", summary.getConnectedCount(),
                summary.getTotalProfiles());
        if (summary.getConnectedCount() == 0) {
            throw new TotalFailureException("All " + profiles.size() + " profiles failed to connect",
                    summary.getProfileErrors());
        }
        if (summary.getErrorCount() > 0) {
            logger.warn("{} profile(s) failed to connect: {}", summary.getErrorCount(), summary.getProfileErrors());
        }
    }

    private CompletableFuture<PveClient> connectAsync(Profile profile) {
        return CompletableFuture.supplyAsync(() -> clientFactory.connect(profile), executor);
    }

    /**
     * Waits for the attempts and applies their outcome. Restores the interrupt
     * flag if the wait was interrupted.
     */
    private void awaitConnects(Map<String, ProfileConnection> targets,
                               Map<String, CompletableFuture<PveClient>> attempts, long deadline) {
        boolean interrupted = false;
        for (Map.Entry<String, CompletableFuture<PveClient>> attempt : attempts.entrySet()) {
            String name = attempt.getKey();
            ProfileConnection connection = targets.get(name);
            CompletableFuture<PveClient> future = attempt.getValue();

            if (interrupted) {
                abandon(connection, future, "connect interrupted");
                continue;
            }
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                PveClient client = future.get(remaining, TimeUnit.NANOSECONDS);
                if (!connection.markConnected(client)) {
                    client.close();
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                ClusterConnectException failure = new ClusterConnectException(name, cause);
                logger.warn(failure.getMessage());
                connection.markFailed(cause.getMessage());
            } catch (TimeoutException e) {
                abandon(connection, future, "connect timed out");
            } catch (InterruptedException e) {
                interrupted = true;
                abandon(connection, future, "connect interrupted");
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void abandon(ProfileConnection connection, CompletableFuture<PveClient> future, String reason) {
        logger.warn("Profile '{}': {}", connection.getProfileName(), reason);
        connection.markFailed(reason);
        future.whenComplete((client, error) -> {
            if (client != null) {
                logger.debug("Closing late client of profile '{}'", connection.getProfileName());
                client.close();
            }
        });
    }

    /**
     * @return a consistent snapshot of all profile connections
     */
    public ConnectionSummary getConnectionSummary() {
        lock.readLock().lock();
        try {
            int connected = 0;
            int degraded = 0;
            int failed = 0;
            Map<String, String> errors = new LinkedHashMap<>();
            Map<String, String> refreshErrors = new LinkedHashMap<>();
            Map<String, ProfileConnectionStatus> status = new LinkedHashMap<>();
            for (ProfileConnection connection : connections.values()) {
                ProfileConnectionStatus state = connection.getStatus();
                status.put(connection.getProfileName(), state);
                switch (state) {
                    case DEGRADED:
                        degraded++;
                        connected++;
                        break;
                    case CONNECTED:
                        connected++;
                        break;
                    case FAILED:
                        failed++;
                        errors.put(connection.getProfileName(), connection.getConnectError());
                        break;
                    default:
                        break;
                }
                if (connection.getLastRefreshError() != null) {
                    refreshErrors.put(connection.getProfileName(), connection.getLastRefreshError());
                }
            }
            return new ConnectionSummary(groupName, connections.size(), connected, degraded, failed,
                    errors, refreshErrors, status);
        } finally {
            lock.readLock().unlock();
        }
    }

    public AggregatedView getGroupClusterResources() {
        return getGroupClusterResources(refreshTimeout);
    }

    /**
     * Lists resources from every connected profile concurrently and merges them.
     *
     * @param timeout Deadline for the whole fan-out
     * @return The new view, also available through {@link #getCurrentView()}
     * @throws TotalFailureException if no profile returned resources
     * @throws IllegalStateException if the profiles were re-initialized or closed while the refresh ran
     */
    public AggregatedView getGroupClusterResources(Duration timeout) {
        Map<String, ProfileConnection> generation = currentConnections();
        List<ProfileConnection> targets = connectedTargets(generation);
        if (targets.isEmpty()) {
            throw new TotalFailureException("No connected profiles to refresh", getConnectionSummary().getProfileErrors());
        }
        logger.debug("Refreshing resources from {} profile(s)", targets.size());

        Map<String, String> failures = new LinkedHashMap<>();
        Map<ProfileConnection, ClusterSnapshot> fresh = fanOut(targets, PveClient::getClusterResources, timeout,
                "refresh", failures);
        for (ProfileConnection connection : targets) {
            ClusterSnapshot snapshot = fresh.get(connection);
            if (snapshot != null) {
                connection.recordRefresh(snapshot);
            } else {
                connection.recordRefreshFailure(failures.get(connection.getProfileName()));
            }
        }
        if (fresh.isEmpty()) {
            throw new TotalFailureException("No profile returned resources", failures);
        }

        AggregatedView view = merge(targets, fresh, failures);
        lock.writeLock().lock();
        try {
            if (closed || connections != generation) {
                throw new IllegalStateException("Profile set changed during refresh; result discarded");
            }
            currentView = view;
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Resources refreshed: {} nodes, {} VMs from {}/{} profiles",
                view.getNodes().size(), view.getVms().size(), fresh.size(), targets.size());
        return view;
    }

    public List<ClusterTask> getAggregatedTasks() {
        return getAggregatedTasks(refreshTimeout);
    }

    /**
     * Lists the recent task log of every connected profile concurrently.
     * Profiles that fail to answer are left out.
     *
     * @param timeout Deadline for the whole fan-out
     * @return Tasks stamped with their source profile, newest first
     * @throws TotalFailureException if no profile returned its tasks
     */
    public List<ClusterTask> getAggregatedTasks(Duration timeout) {
        List<ProfileConnection> targets = connectedTargets(currentConnections());
        if (targets.isEmpty()) {
            throw new TotalFailureException("No connected profiles to list tasks from",
                    getConnectionSummary().getProfileErrors());
        }

        Map<String, String> failures = new LinkedHashMap<>();
        Map<ProfileConnection, List<ClusterTask>> listed = fanOut(targets, PveClient::getClusterTasks, timeout,
                "task listing", failures);
        if (listed.isEmpty()) {
            throw new TotalFailureException("No profile returned tasks", failures);
        }

        List<ClusterTask> tasks = new ArrayList<>();
        for (Map.Entry<ProfileConnection, List<ClusterTask>> entry : listed.entrySet()) {
            String profileName = entry.getKey().getProfileName();
            for (ClusterTask task : entry.getValue()) {
                tasks.add(task.withSourceProfile(profileName));
            }
        }
        tasks.sort(TASK_ORDER);
        logger.debug("Listed {} tasks from {}/{} profiles", tasks.size(), listed.size(), targets.size());
        return tasks;
    }

    private Map<String, ProfileConnection> currentConnections() {
        lock.readLock().lock();
        try {
            return connections;
        } finally {
            lock.readLock().unlock();
        }
    }

    private static List<ProfileConnection> connectedTargets(Map<String, ProfileConnection> generation) {
        List<ProfileConnection> targets = new ArrayList<>();
        for (ProfileConnection connection : generation.values()) {
            if (connection.getStatus().hasClient() && connection.getClient() != null) {
                targets.add(connection);
            }
        }
        return targets;
    }

    /**
     * Runs one call against every target concurrently and collects the answers
     * that arrive before the deadline. Failures are added to {@code failures}
     * keyed by profile name.
     */
    private <T> Map<ProfileConnection, T> fanOut(List<ProfileConnection> targets, Function<PveClient, T> call,
                                                 Duration timeout, String what, Map<String, String> failures) {
        Map<ProfileConnection, CompletableFuture<T>> requests = new LinkedHashMap<>();
        for (ProfileConnection connection : targets) {
            PveClient client = connection.getClient();
            requests.put(connection, CompletableFuture.supplyAsync(() -> call.apply(client), executor));
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        boolean interrupted = false;
        Map<ProfileConnection, T> results = new LinkedHashMap<>();
        for (Map.Entry<ProfileConnection, CompletableFuture<T>> request : requests.entrySet()) {
            String profileName = request.getKey().getProfileName();
            if (interrupted) {
                failures.put(profileName, what + " interrupted");
                continue;
            }
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                results.put(request.getKey(), request.getValue().get(remaining, TimeUnit.NANOSECONDS));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.warn("{} of profile '{}' failed: {}", what, profileName, cause.getMessage());
                failures.put(profileName, String.valueOf(cause.getMessage()));
            } catch (TimeoutException e) {
                String message = what + " timed out after " + timeout.toMillis() + "ms";
                logger.warn("{} of profile '{}' failed: {}", what, profileName, message);
                failures.put(profileName, message);
            } catch (InterruptedException e) {
                interrupted = true;
                failures.put(profileName, what + " interrupted");
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return results;
    }

    private AggregatedView merge(List<ProfileConnection> targets, Map<ProfileConnection, ClusterSnapshot> fresh,
                                 Map<String, String> failures) {
        List<NodeInfo> nodes = new ArrayList<>();
        List<VmInfo> vms = new ArrayList<>();
        for (ProfileConnection connection : targets) {
            ClusterSnapshot snapshot = fresh.get(connection);
            boolean stale = false;
            if (snapshot == null) {
                snapshot = connection.getSnapshot();
                stale = true;
            }
            if (snapshot == null) {
                continue;
            }
            String profileName = connection.getProfileName();
            for (NodeInfo node : snapshot.getNodes()) {
                nodes.add(node.withSourceProfile(profileName).withStale(stale));
            }
            for (VmInfo vm : snapshot.getVms()) {
                vms.add(vm.withSourceProfile(profileName).withStale(stale));
            }
        }
        nodes.sort(NODE_ORDER);
        vms.sort(VM_ORDER);
        return new AggregatedView(nodes, vms, Instant.now(), failures);
    }

    /**
     * @return the view of the last successful refresh
     */
    public AggregatedView getCurrentView() {
        return currentView;
    }

    /**
     * Retries connecting one profile. A profile that already holds a client is
     * left alone.
     *
     * @param profileName The profile to reconnect
     * @throws IllegalArgumentException if the profile is not part of the current group
     * @throws ClusterConnectException if the attempt fails
     */
    public void reconnect(String profileName) {
        ProfileConnection connection = findConnection(profileName)
            .orElseThrow(() -> new IllegalArgumentException("Unknown profile: " + profileName));
        if (connection.getStatus().hasClient()) {
            logger.debug("Profile '{}' is already connected", profileName);
            return;
        }
        logger.info("=== AGGREGATOR: reconnect({}) ===", profileName);
        Map<String, ProfileConnection> targets = Map.of(profileName, connection);
        awaitConnects(targets, Map.of(profileName, connectAsync(connection.getProfile())),
                System.nanoTime() + connectTimeout.toNanos());
        if (!connection.getStatus().hasClient()) {
            throw new ClusterConnectException(profileName, String.valueOf(connection.getConnectError()));
        }
    }

    /**
     * Retries every profile whose connect attempt failed, concurrently.
     *
     * @return the summary after the attempts settled
     */
    public ConnectionSummary reconnectFailed() {
        Map<String, ProfileConnection> failed = new LinkedHashMap<>();
        lock.readLock().lock();
        try {
            for (ProfileConnection connection : connections.values()) {
                if (connection.getStatus() == ProfileConnectionStatus.FAILED) {
                    failed.put(connection.getProfileName(), connection);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        if (failed.isEmpty()) {
            logger.info("No failed profiles to reconnect");
            return getConnectionSummary();
        }

        logger.info("=== AGGREGATOR: reconnectFailed({}) ===", failed.keySet());
        Map<String, CompletableFuture<PveClient>> attempts = new LinkedHashMap<>();
        for (ProfileConnection connection : failed.values()) {
            attempts.put(connection.getProfileName(), connectAsync(connection.getProfile()));
        }
        awaitConnects(failed, attempts, System.nanoTime() + connectTimeout.toNanos());
        return getConnectionSummary();
    }

    /**
     * @return the client of a profile that is connected or degraded
     */
    public Optional<PveClient> getClient(String profileName) {
        return findConnection(profileName)
            .filter(connection -> connection.getStatus().hasClient())
            .map(ProfileConnection::getClient);
    }

    /**
     * Looks a guest up in the current view.
     */
    public Optional<VmInfo> findVm(TargetIdentity target) {
        return currentView.findVm(target);
    }

    /**
     * Reads one guest's live status from its cluster.
     *
     * @throws PveApiException if the profile is not connected or the read fails
     */
    public VmInfo fetchVm(String profileName, String node, String type, int vmid) {
        PveClient client = getClient(profileName)
            .orElseThrow(() -> new PveApiException(profileName, "Profile is not connected"));
        return client.getVmStatus(node, type, vmid).withSourceProfile(profileName);
    }

    private Optional<ProfileConnection> findConnection(String profileName) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(connections.get(profileName));
        } finally {
            lock.readLock().unlock();
        }
    }

    private void ensureOpen() {
        lock.readLock().lock();
        try {
            if (closed) {
                throw new IllegalStateException("Aggregator is closed");
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    private void disconnectAll(Map<String, ProfileConnection> released) {
        for (ProfileConnection connection : released.values()) {
            PveClient client = connection.disconnect();
            if (client != null) {
                try {
                    client.close();
                } catch (RuntimeException e) {
                    logger.warn("Error closing client of profile '{}': {}", connection.getProfileName(), e.getMessage());
                }
            }
        }
    }

    /**
     * Closes every client and stops the connect pool. Safe to call more than once.
     */
    @Override
    public void close() {
        Map<String, ProfileConnection> released;
        lock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            released = connections;
            connections = new LinkedHashMap<>();
            currentView = AggregatedView.empty();
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Closing aggregator ({} profile connection(s))", released.size());
        disconnectAll(released);
        executor.shutdownNow();
    }
}
