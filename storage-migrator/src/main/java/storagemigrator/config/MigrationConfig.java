package storagemigrator.config;

import storagemigrator.hypervisor.ConnectionSettings;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Central configuration for a storage migration session.
 *
 * <p>This class encapsulates the settings that do not depend on which domain is
 * migrated or where to:
 * <ul>
 *   <li>How to reach the hypervisor ({@link ConnectionSettings})</li>
 *   <li>Block job poll interval</li>
 *   <li>Directory receiving the pre-migration description backup</li>
 *   <li>Whether the destructive confirmation is answered automatically</li>
 *   <li>Alert level for event logging</li>
 * </ul>
 *
 * <p>Configuration can be loaded from {@code storage-migrator.properties} or
 * {@code storage-migrator.yml} using {@link MigrationConfigLoader}.
 *
 * @see MigrationConfigLoader
 * @see storagemigrator.session.MigrationSession
 */
public final class MigrationConfig {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final Path DEFAULT_BACKUP_DIRECTORY = Path.of("/tmp");

    public static final MigrationConfig DEFAULTS = builder().build();

    private final ConnectionSettings connection;
    private final Duration pollInterval;
    private final Path backupDirectory;
    private final boolean assumeYes;
    private final AlertLevel alertLevel;

    private MigrationConfig(Builder b) {
        this.connection = b.connection;
        this.pollInterval = b.pollInterval;
        this.backupDirectory = b.backupDirectory;
        this.assumeYes = b.assumeYes;
        this.alertLevel = b.alertLevel;
    }

    /**
     * Creates a new configuration builder.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder pre-filled with this configuration's values.
     *
     * @return a new builder instance
     */
    public Builder toBuilder() {
        return new Builder()
                .connection(connection)
                .pollInterval(pollInterval)
                .backupDirectory(backupDirectory)
                .assumeYes(assumeYes)
                .alertLevel(alertLevel);
    }

    /** Returns the hypervisor connection settings. */
    public ConnectionSettings connection() { return connection; }

    /** Returns the interval between two block job status polls. */
    public Duration pollInterval() { return pollInterval; }

    /** Returns the directory receiving the description backup. */
    public Path backupDirectory() { return backupDirectory; }

    /** Returns true if the destructive confirmation is answered "yes" without asking. */
    public boolean assumeYes() { return assumeYes; }

    /** Returns the alert level for logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    @Override
    public String toString() {
        return "MigrationConfig{" +
                "connection=" + connection.toUri() +
                ", pollInterval=" + pollInterval.toMillis() + "ms" +
                ", backupDirectory=" + backupDirectory +
                ", assumeYes=" + assumeYes +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for constructing {@link MigrationConfig} instances.
     */
    public static final class Builder {
        private ConnectionSettings connection = ConnectionSettings.LOCAL;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Path backupDirectory = DEFAULT_BACKUP_DIRECTORY;
        private boolean assumeYes = false;
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder connection(ConnectionSettings connection) {
            this.connection = Objects.requireNonNull(connection, "connection");
            return this;
        }

        public Builder pollInterval(Duration interval) {
            Objects.requireNonNull(interval, "interval");
            if (interval.isNegative() || interval.isZero()) {
                throw new IllegalArgumentException("pollInterval must be positive");
            }
            this.pollInterval = interval;
            return this;
        }

        public Builder pollIntervalMillis(long millis) {
            return pollInterval(Duration.ofMillis(millis));
        }

        public Builder backupDirectory(Path directory) {
            this.backupDirectory = Objects.requireNonNull(directory, "directory");
            return this;
        }

        public Builder assumeYes(boolean assumeYes) {
            this.assumeYes = assumeYes;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level != null ? level : AlertLevel.WARNING;
            return this;
        }

        public MigrationConfig build() {
            return new MigrationConfig(this);
        }
    }
}
