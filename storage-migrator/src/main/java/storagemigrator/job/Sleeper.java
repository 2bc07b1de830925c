package storagemigrator.job;

import java.time.Duration;

/**
 * Blocks the calling thread between two polls. Tests substitute a recording fake.
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeps on the calling thread with {@link Thread#sleep(long)}. */
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
