package org.tanzu.pvemcp.pve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Waits for a Proxmox task (UPID) started by a lifecycle call to finish.
 *
 * Runs on the calling thread, which for queued operations is the task's own
 * worker. Transient status read failures are tolerated until the maximum wait
 * elapses.
 */
public class RemoteTaskAwaiter {

    private static final Logger logger = LoggerFactory.getLogger(RemoteTaskAwaiter.class);

    /** Result label for calls that completed synchronously without a UPID */
    public static final String SYNCHRONOUS_OK = "OK";

    private final Duration pollInterval;
    private final Duration maxWait;

    public RemoteTaskAwaiter(Duration pollInterval, Duration maxWait) {
        this.pollInterval = pollInterval;
        this.maxWait = maxWait;
    }

    /**
     * Blocks until the task stops.
     *
     * @param client Client of the profile that started the task
     * @param node Node the task runs on
     * @param upid Task id returned by the lifecycle call; empty for synchronous calls
     * @return The task's exit status ("OK")
     * @throws PveApiException if the task stopped with another exit status or did not stop in time
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public String await(PveClient client, String node, String upid) throws InterruptedException {
        if (upid == null || upid.isEmpty()) {
            return SYNCHRONOUS_OK;
        }
        long deadline = System.nanoTime() + maxWait.toNanos();
        logger.debug("Waiting for task {} on {}/{}", upid, client.getProfileName(), node);

        while (true) {
            Thread.sleep(pollInterval.toMillis());
            RemoteTaskStatus status = null;
            try {
                status = client.getTaskStatus(node, upid);
            } catch (PveApiException e) {
                logger.debug("Status read for task {} failed, will retry: {}", upid, e.getMessage());
            }
            if (status != null && status.isStopped()) {
                if (status.isSuccessful()) {
                    return status.getExitStatus();
                }
                throw new PveApiException(client.getProfileName(),
                        "Task " + upid + " ended with: " + status.getExitStatus());
            }
            if (System.nanoTime() - deadline >= 0) {
                throw new PveApiException(client.getProfileName(),
                        "Task " + upid + " did not finish within " + maxWait.getSeconds() + "s");
            }
        }
    }
}
