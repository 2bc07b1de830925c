package storagemigrator.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import storagemigrator.config.MigrationConfig;
import storagemigrator.exceptions.InvalidDestinationException;
import storagemigrator.hypervisor.ConnectionSettings;
import storagemigrator.plan.Destination;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line options. Options left unset keep the value of the loaded configuration.
 */
public class CliOptions {

    @Parameter(description = "<domain>")
    private List<String> positional = new ArrayList<>();

    @Parameter(names = {"--pool", "-p"},
            description = "Destination storage pool. Mutually exclusive with --filepath")
    String pool;

    @Parameter(names = {"--filepath", "-f"},
            description = "Destination directory. Mutually exclusive with --pool")
    String filepath;

    @Parameter(names = "--host", description = "Hypervisor host; empty means the local one")
    String host;

    @Parameter(names = {"--user", "-u"}, description = "Remote user name")
    String user;

    @Parameter(names = "--ssh", description = "Tunnel the hypervisor connection over SSH")
    boolean ssh;

    @Parameter(names = "--session", description = "Hypervisor session: system or session")
    String session;

    @Parameter(names = {"--yes", "-y"}, description = "Do not ask for confirmation")
    boolean assumeYes;

    @Parameter(names = "--config", description = "Configuration file (.properties or .yml)")
    String configFile;

    @Parameter(names = "--poll-interval-ms", description = "Block job polling interval in milliseconds")
    Long pollIntervalMs;

    @Parameter(names = "--backup-dir", description = "Directory for the domain description backup")
    String backupDirectory;

    @Parameter(names = {"--help", "-h"}, help = true, description = "Show usage")
    boolean help;

    /**
     * The one domain to migrate.
     *
     * @throws ParameterException if none or more than one was given
     */
    public String domain() {
        if (positional.size() != 1 || positional.get(0).isBlank()) {
            throw new ParameterException("Exactly one domain name is required, got " + positional);
        }
        return positional.get(0);
    }

    public Destination destination() throws InvalidDestinationException {
        return Destination.of(pool, filepath);
    }

    public boolean help() {
        return help;
    }

    /** The explicit configuration file, or null to use the classpath configuration. */
    public Path configFile() {
        return configFile == null ? null : toPath("--config", configFile);
    }

    /**
     * Merges the options given on the command line over a loaded configuration.
     *
     * @param base the configuration loaded from files and system properties
     * @return the effective configuration
     * @throws ParameterException if an option value is unusable
     */
    public MigrationConfig applyTo(MigrationConfig base) {
        ConnectionSettings connection = base.connection();
        if (host != null) {
            connection = connection.withHost(host);
        }
        if (user != null) {
            connection = connection.withUser(user);
        }
        if (ssh) {
            connection = connection.withSsh(true);
        }
        if (session != null) {
            connection = connection.withSession(session);
        }

        MigrationConfig.Builder builder = base.toBuilder().connection(connection);
        if (pollIntervalMs != null) {
            if (pollIntervalMs <= 0) {
                throw new ParameterException("--poll-interval-ms must be positive, got " + pollIntervalMs);
            }
            builder.pollIntervalMillis(pollIntervalMs);
        }
        if (backupDirectory != null) {
            builder.backupDirectory(toPath("--backup-dir", backupDirectory));
        }
        if (assumeYes) {
            builder.assumeYes(true);
        }
        return builder.build();
    }

    private static Path toPath(String option, String value) {
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            throw new ParameterException(option + " is not a valid path: " + e.getReason());
        }
    }
}
