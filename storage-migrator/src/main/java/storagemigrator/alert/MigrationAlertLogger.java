package storagemigrator.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import storagemigrator.config.AlertLevel;
import storagemigrator.metrics.MigrationMetrics;
import storagemigrator.session.SessionState;

/**
 * Structured logging for storage migration events.
 *
 * <p>Entries use markers like SESSION_STARTED, BLOCK_COPY_LAUNCHED, SESSION_FAILED with
 * key=value pairs so log aggregators can parse and alert on them.
 *
 * <h2>Log Levels:</h2>
 * <ul>
 *   <li>INFO: session started, state transitions, launches, pivots, successful completion</li>
 *   <li>WARN: operator abort, steps skipped on resume</li>
 *   <li>ERROR: session failed (always logged)</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * INFO migration - SESSION_STARTED id=1 domain=web01 destination="directory /data/pool-b"
 * INFO migration - STATE_ENTERED id=1 state=LAUNCH_ALL
 * INFO migration - BLOCK_COPY_LAUNCHED domain=web01 device=vda
 * INFO migration - SESSION_COMPLETED id=1 resumed=false duration_ms=8123 pending=2 already_migrated=0 pivoted=2
 * </pre>
 */
public final class MigrationAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private MigrationAlertLogger() {}

    /**
     * Set the alert level for logging.
     *
     * @param level the alert level (DEBUG, WARNING, or ERROR)
     */
    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public static void sessionStarted(long sessionId, String domain, String destination) {
        if (shouldLogInfo()) {
            log.info("SESSION_STARTED id={} domain={} destination=\"{}\"", sessionId, domain, destination);
        }
    }

    public static void stateEntered(long sessionId, SessionState state) {
        if (shouldLogInfo()) {
            log.info("STATE_ENTERED id={} state={}", sessionId, state.name());
        }
    }

    public static void blockCopyLaunched(String domain, String device) {
        if (shouldLogInfo()) {
            log.info("BLOCK_COPY_LAUNCHED domain={} device={}", domain, device);
        }
    }

    public static void blockCopyPivoted(String domain, String device) {
        if (shouldLogInfo()) {
            log.info("BLOCK_COPY_PIVOTED domain={} device={}", domain, device);
        }
    }

    /**
     * Log a step that was not needed and therefore skipped.
     *
     * @param sessionId the session identifier
     * @param state the skipped state
     * @param reason why it was skipped
     */
    public static void stepSkipped(long sessionId, SessionState state, String reason) {
        if (shouldLogWarn()) {
            log.warn("STEP_SKIPPED id={} state={} reason=\"{}\"", sessionId, state.name(), reason);
        }
    }

    public static void sessionCompleted(long sessionId, MigrationMetrics metrics) {
        if (shouldLogInfo()) {
            log.info("SESSION_COMPLETED id={} resumed={} duration_ms={} pending={} already_migrated={} pivoted={}",
                    sessionId,
                    metrics.resumed(),
                    metrics.totalDurationMs(),
                    metrics.devicesPending(),
                    metrics.devicesAlreadyMigrated(),
                    metrics.devicesPivoted());
        }
    }

    public static void sessionAborted(long sessionId, String reason) {
        if (shouldLogWarn()) {
            log.warn("SESSION_ABORTED id={} reason=\"{}\"", sessionId, reason);
        }
    }

    /**
     * Log a failed session. Always logged regardless of alert level.
     *
     * @param sessionId the session identifier
     * @param error the error that ended the session
     * @param state the state during which it failed (may be null)
     */
    public static void sessionFailed(long sessionId, Throwable error, SessionState state) {
        String errorMsg = error != null ? error.getMessage() : "Unknown error";
        String stateName = state != null ? state.name() : "UNKNOWN";
        log.error("SESSION_FAILED id={} state={} error=\"{}\"", sessionId, stateName, errorMsg);
    }
}
