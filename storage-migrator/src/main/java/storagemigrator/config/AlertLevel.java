package storagemigrator.config;

/**
 * Alert level for migration event logging.
 *
 * <p>Controls the minimum severity of events that get logged by
 * {@link storagemigrator.alert.MigrationAlertLogger}. Configured via the
 * {@code migration.alert.level} property.
 *
 * <ul>
 *   <li>{@link #DEBUG} - All events: session started, state transitions, launches, pivots, completion</li>
 *   <li>{@link #WARNING} - Warnings (operator abort, skipped steps) and errors only</li>
 *   <li>{@link #ERROR} - Errors only (session failed)</li>
 * </ul>
 *
 * @see MigrationConfig#alertLevel()
 */
public enum AlertLevel {
    /** Log all events. Use for troubleshooting a migration. */
    DEBUG,

    /** Log warnings and errors only. This is the default. */
    WARNING,

    /** Log errors only. */
    ERROR
}
