package storagemigrator.hypervisor;

import java.util.Optional;

/**
 * Progress of one block-copy job as reported by the hypervisor.
 *
 * <p>A device without a running job is represented by an empty {@link Optional}
 * from {@link Hypervisor#blockJobStatus(String, String)}, and counts as complete.
 *
 * @param cur units copied so far
 * @param end total units to copy
 */
public record BlockJobStatus(long cur, long end) {

    /** Returns true once the copy has caught up ({@code cur >= end}). */
    public boolean isComplete() {
        return cur >= end;
    }

    /** Floor of {@code 100 * cur / end}, or 100 when complete. */
    public int percent() {
        if (isComplete()) {
            return 100;
        }
        return (int) Math.max(0L, (100L * cur) / end);
    }

    /**
     * Returns true if a device with the given status needs no more waiting.
     *
     * @param status the reported status, empty when no job runs
     * @return true if the job is absent or complete
     */
    public static boolean isComplete(Optional<BlockJobStatus> status) {
        return status.map(BlockJobStatus::isComplete).orElse(true);
    }

    /**
     * Progress percentage of a device with the given status.
     *
     * @param status the reported status, empty when no job runs
     * @return 100 when absent or complete, otherwise the floored percentage
     */
    public static int percentOf(Optional<BlockJobStatus> status) {
        return status.map(BlockJobStatus::percent).orElse(100);
    }
}
