package storagemigrator.metrics;

import storagemigrator.session.SessionState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Collects timing and device counts while a session runs.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationMetricsCollector collector = new MigrationMetricsCollector(clock);
 * collector.start(sessionId);
 *
 * collector.timed(SessionState.MONITOR_ALL, () -&gt; coordinator.monitorAll(domain, devices));
 * collector.devicesPivoted(2);
 *
 * MigrationMetrics metrics = collector.finish();
 * </pre>
 *
 * @see MigrationMetrics
 */
public final class MigrationMetricsCollector {

    private final Clock clock;
    private final Map<SessionState, Long> stateDurations = new EnumMap<>(SessionState.class);
    private MigrationMetrics.Builder builder = MigrationMetrics.builder();
    private Instant startTime;

    public MigrationMetricsCollector() {
        this(Clock.systemUTC());
    }

    public MigrationMetricsCollector(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts metrics collection for a new session.
     *
     * @param sessionId the unique session identifier
     * @return this collector for method chaining
     */
    public MigrationMetricsCollector start(long sessionId) {
        this.startTime = clock.instant();
        this.stateDurations.clear();
        this.builder = MigrationMetrics.builder().sessionId(sessionId).startTime(startTime);
        return this;
    }

    @FunctionalInterface
    public interface ThrowingRunnable<E extends Exception> {
        void run() throws E;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    /**
     * Time a state and run the action (can throw checked exceptions).
     */
    public <E extends Exception> void timed(SessionState state, ThrowingRunnable<E> action) throws E {
        long start = System.nanoTime();
        try {
            action.run();
        } finally {
            record(state, start);
        }
    }

    /**
     * Time a state and return the result (can throw checked exceptions).
     */
    public <T, E extends Exception> T timed(SessionState state, ThrowingSupplier<T, E> action) throws E {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            record(state, start);
        }
    }

    private void record(SessionState state, long startNanos) {
        long elapsed = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        stateDurations.merge(state, elapsed, Long::sum);
    }

    public MigrationMetricsCollector devicesPending(int count) {
        builder.devicesPending(count);
        return this;
    }

    public MigrationMetricsCollector devicesAlreadyMigrated(int count) {
        builder.devicesAlreadyMigrated(count);
        return this;
    }

    public MigrationMetricsCollector devicesPivoted(int count) {
        builder.devicesPivoted(count);
        return this;
    }

    public MigrationMetricsCollector pollTicks(int count) {
        builder.pollTicks(count);
        return this;
    }

    public MigrationMetricsCollector resumed(boolean resumed) {
        builder.resumed(resumed);
        return this;
    }

    /**
     * Finishes metrics collection and returns the final metrics.
     *
     * @return the collected session metrics
     */
    public MigrationMetrics finish() {
        if (startTime == null) {
            throw new IllegalStateException("start() was not called");
        }
        Instant endTime = clock.instant();
        return builder
                .endTime(endTime)
                .stateDurations(stateDurations)
                .totalDurationMs(Duration.between(startTime, endTime).toMillis())
                .build();
    }
}
