package storagemigrator.job;

import java.time.Duration;
import java.util.Objects;

/**
 * How block jobs are polled: a fixed interval between ticks and the sleeper that waits it out.
 *
 * <p>The termination predicate is fixed by {@link JobCoordinator#monitorAll}: polling
 * stops once every device has been seen complete.
 *
 * @param interval time between two ticks
 * @param sleeper what waits between ticks
 */
public record PollSchedule(Duration interval, Sleeper sleeper) {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(1);

    public PollSchedule {
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(sleeper, "sleeper");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
    }

    /** One-second ticks on the real clock. */
    public static PollSchedule defaults() {
        return new PollSchedule(DEFAULT_INTERVAL, Sleeper.SYSTEM);
    }

    public static PollSchedule every(Duration interval) {
        return new PollSchedule(interval, Sleeper.SYSTEM);
    }

    void pause() throws InterruptedException {
        sleeper.sleep(interval);
    }
}
