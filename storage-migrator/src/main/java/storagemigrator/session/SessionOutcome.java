package storagemigrator.session;

import storagemigrator.metrics.MigrationMetrics;
import storagemigrator.plan.MigrationPlan;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Result of a session that reached {@link SessionState#DONE}.
 *
 * @param finalState the terminal state
 * @param plan the plan the session computed
 * @param pivoted devices moved onto their copy in this run
 * @param stillPending pending devices this run left alone (a resumed run only finishes
 *                     the jobs it found), empty after a full run
 * @param backupFile the backup written by this run, or null if none was written
 * @param resumed whether this run resumed jobs left by an earlier one
 * @param metrics timing and counts
 */
public record SessionOutcome(
        SessionState finalState,
        MigrationPlan plan,
        List<String> pivoted,
        Set<String> stillPending,
        Path backupFile,
        boolean resumed,
        MigrationMetrics metrics
) {

    /** Returns true when the run found nothing to migrate. */
    public boolean wasNoop() {
        return plan.isNoop();
    }
}
