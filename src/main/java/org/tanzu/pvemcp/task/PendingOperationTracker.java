package org.tanzu.pvemcp.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory set of targets that have an outstanding operation, each with a
 * short label such as "Starting" or "Migrating".
 *
 * The tracker is shared by task workers, submitters and periodic refresh, so
 * every method is thread-safe. Entries are created when a task is accepted and
 * are removed explicitly by whoever owns the follow-up (usually after a
 * stabilization check), never automatically when the task finishes.
 */
public class PendingOperationTracker {

    private static final Logger logger = LoggerFactory.getLogger(PendingOperationTracker.class);

    private final ConcurrentHashMap<TargetIdentity, String> pending = new ConcurrentHashMap<>();

    /**
     * Marks a target as pending, replacing any existing label.
     */
    public void setPending(TargetIdentity target, String label) {
        Objects.requireNonNull(target, "target");
        pending.put(target, label != null ? label : "");
        logger.debug("Pending set for {}: {}", target, label);
    }

    /**
     * Marks a target as pending only if it is not already.
     *
     * @return true if the marker was created, false if one already existed
     */
    public boolean markIfAbsent(TargetIdentity target, String label) {
        Objects.requireNonNull(target, "target");
        boolean created = pending.putIfAbsent(target, label != null ? label : "") == null;
        if (created) {
            logger.debug("Pending marked for {}: {}", target, label);
        }
        return created;
    }

    /**
     * Removes the pending marker for a target. No-op if absent.
     */
    public void clearPending(TargetIdentity target) {
        if (target != null && pending.remove(target) != null) {
            logger.debug("Pending cleared for {}", target);
        }
    }

    /**
     * @return the pending label if the target has an outstanding operation
     */
    public Optional<String> isPending(TargetIdentity target) {
        if (target == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(pending.get(target));
    }

    public boolean hasAny() {
        return !pending.isEmpty();
    }

    public int size() {
        return pending.size();
    }

    /**
     * @return an unmodifiable copy of all pending entries
     */
    public Map<TargetIdentity, String> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(pending));
    }
}
