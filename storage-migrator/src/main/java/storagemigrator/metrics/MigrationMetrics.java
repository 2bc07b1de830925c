package storagemigrator.metrics;

import storagemigrator.session.SessionState;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable metrics collected during one migration session.
 *
 * <p>Use {@link #summary()} for a human-readable summary, or {@link #toMap()} for
 * structured output.
 *
 * @see MigrationMetricsCollector
 */
public record MigrationMetrics(
        long sessionId,
        Instant startTime,
        Instant endTime,
        Map<SessionState, Long> stateDurations,
        long totalDurationMs,
        int devicesPending,
        int devicesAlreadyMigrated,
        int devicesPivoted,
        int pollTicks,
        boolean resumed
) {

    public Duration totalDuration() {
        return Duration.ofMillis(totalDurationMs);
    }

    /**
     * Returns the time spent in one state.
     *
     * @param state the state to query
     * @return duration in milliseconds, or 0 if the state was not visited
     */
    public long stateDuration(SessionState state) {
        return stateDurations.getOrDefault(state, 0L);
    }

    public String summary() {
        return String.format(Locale.ROOT,
                "Session #%d in %dms%s | Devices: %d pending, %d already migrated, %d pivoted | Polls: %d",
                sessionId, totalDurationMs, resumed ? " (resumed)" : "",
                devicesPending, devicesAlreadyMigrated, devicesPivoted, pollTicks);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sessionId", sessionId);
        map.put("startTime", String.valueOf(startTime));
        map.put("endTime", String.valueOf(endTime));
        map.put("totalDurationMs", totalDurationMs);
        map.put("devicesPending", devicesPending);
        map.put("devicesAlreadyMigrated", devicesAlreadyMigrated);
        map.put("devicesPivoted", devicesPivoted);
        map.put("pollTicks", pollTicks);
        map.put("resumed", resumed);
        stateDurations.forEach((state, duration) ->
                map.put(state.name().toLowerCase(Locale.ROOT) + "DurationMs", duration));
        return map;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing {@link MigrationMetrics} instances.
     */
    public static class Builder {
        private long sessionId;
        private Instant startTime;
        private Instant endTime;
        private final Map<SessionState, Long> stateDurations = new EnumMap<>(SessionState.class);
        private long totalDurationMs;
        private int devicesPending, devicesAlreadyMigrated, devicesPivoted, pollTicks;
        private boolean resumed;

        public Builder sessionId(long id) { this.sessionId = id; return this; }
        public Builder startTime(Instant t) { this.startTime = t; return this; }
        public Builder endTime(Instant t) { this.endTime = t; return this; }

        public Builder stateDurations(Map<SessionState, Long> durations) {
            this.stateDurations.putAll(durations);
            return this;
        }

        public Builder totalDurationMs(long v) { this.totalDurationMs = v; return this; }
        public Builder devicesPending(int v) { this.devicesPending = v; return this; }
        public Builder devicesAlreadyMigrated(int v) { this.devicesAlreadyMigrated = v; return this; }
        public Builder devicesPivoted(int v) { this.devicesPivoted = v; return this; }
        public Builder pollTicks(int v) { this.pollTicks = v; return this; }
        public Builder resumed(boolean v) { this.resumed = v; return this; }

        public MigrationMetrics build() {
            return new MigrationMetrics(
                    sessionId, startTime, endTime,
                    new EnumMap<>(stateDurations),
                    totalDurationMs, devicesPending, devicesAlreadyMigrated, devicesPivoted,
                    pollTicks, resumed
            );
        }
    }
}
