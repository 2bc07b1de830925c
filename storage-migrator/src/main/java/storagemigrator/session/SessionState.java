package storagemigrator.session;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a {@link MigrationSession}.
 *
 * <pre>
 * INSPECT -&gt; PLAN
 * PLAN -&gt; DONE                  (nothing pending)
 * PLAN -&gt; RESUME_MONITOR        (pending devices with jobs left by an earlier run)
 * PLAN -&gt; CONFIRM_DESTRUCTIVE   (pending devices, no jobs running)
 * RESUME_MONITOR -&gt; PIVOT -&gt; REDEFINE -&gt; DONE
 * CONFIRM_DESTRUCTIVE -&gt; ABORTED (operator declines)
 * CONFIRM_DESTRUCTIVE -&gt; BACKUP -&gt; UNDEFINE -&gt; LAUNCH_ALL -&gt; MONITOR_ALL -&gt; PIVOT_ALL -&gt; REDEFINE -&gt; DONE
 * </pre>
 * Any non-terminal state may also end in ABORTED when a step fails.
 */
public enum SessionState {
    INSPECT,
    PLAN,
    RESUME_MONITOR,
    PIVOT,
    CONFIRM_DESTRUCTIVE,
    BACKUP,
    UNDEFINE,
    LAUNCH_ALL,
    MONITOR_ALL,
    PIVOT_ALL,
    REDEFINE,
    DONE,
    ABORTED;

    /** Returns true for DONE and ABORTED. */
    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }

    /**
     * Checks whether the session may move from this state to {@code next}.
     *
     * @param next the candidate state
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(SessionState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == ABORTED) {
            return true;
        }
        return successors().contains(next);
    }

    private Set<SessionState> successors() {
        return switch (this) {
            case INSPECT -> EnumSet.of(PLAN);
            case PLAN -> EnumSet.of(DONE, RESUME_MONITOR, CONFIRM_DESTRUCTIVE);
            case RESUME_MONITOR -> EnumSet.of(PIVOT);
            case PIVOT -> EnumSet.of(REDEFINE);
            case CONFIRM_DESTRUCTIVE -> EnumSet.of(BACKUP);
            case BACKUP -> EnumSet.of(UNDEFINE);
            case UNDEFINE -> EnumSet.of(LAUNCH_ALL);
            case LAUNCH_ALL -> EnumSet.of(MONITOR_ALL);
            case MONITOR_ALL -> EnumSet.of(PIVOT_ALL);
            case PIVOT_ALL -> EnumSet.of(REDEFINE);
            case REDEFINE -> EnumSet.of(DONE);
            case DONE, ABORTED -> EnumSet.noneOf(SessionState.class);
        };
    }
}
