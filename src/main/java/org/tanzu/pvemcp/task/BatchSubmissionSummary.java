package org.tanzu.pvemcp.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One summary for a batch of independent submissions.
 *
 * Conflicts and ineligible targets count as skipped, submissions that could not
 * be handed to the queue at all count as failed. The per-target reasons keep each
 * outcome attributed to its target.
 */
public class BatchSubmissionSummary {

    private int submitted;
    private int skipped;
    private int failed;
    private final Map<TargetIdentity, String> reasons = new LinkedHashMap<>();

    public void recordSubmitted(TargetIdentity target) {
        submitted++;
        reasons.put(target, EnqueueResult.REASON_ACCEPTED);
    }

    public void recordSkipped(TargetIdentity target, String reason) {
        skipped++;
        if (target != null) {
            reasons.put(target, reason);
        }
    }

    public void recordFailed(TargetIdentity target, String reason) {
        failed++;
        if (target != null) {
            reasons.put(target, reason);
        }
    }

    /**
     * Folds one enqueue outcome into the summary.
     */
    public void record(TargetIdentity target, EnqueueResult result) {
        if (result.isAccepted()) {
            recordSubmitted(target);
        } else if (result.isConflict()) {
            recordSkipped(target, result.getReason());
        } else {
            recordFailed(target, result.getReason());
        }
    }

    public int getSubmitted() { return submitted; }
    public int getSkipped() { return skipped; }
    public int getFailed() { return failed; }
    public Map<TargetIdentity, String> getReasons() { return Collections.unmodifiableMap(reasons); }

    @Override
    public String toString() {
        return submitted + " submitted, " + skipped + " skipped, " + failed + " failed";
    }
}
