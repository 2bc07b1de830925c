package storagemigrator.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import storagemigrator.config.MigrationConfig;
import storagemigrator.config.MigrationConfigException;
import storagemigrator.config.MigrationConfigLoader;
import storagemigrator.exceptions.ConnectionException;
import storagemigrator.exceptions.MigrateException;
import storagemigrator.hypervisor.ConnectionSettings;
import storagemigrator.hypervisor.Hypervisor;
import storagemigrator.hypervisor.LibvirtHypervisor;
import storagemigrator.plan.Destination;
import storagemigrator.session.MigrationSession;
import storagemigrator.session.OperatorConsole;
import storagemigrator.session.SessionOutcome;
import storagemigrator.session.TerminalConsole;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Entry point: {@code storage-migrator <domain> (--pool P | --filepath DIR) [options]}.
 *
 * <p>Exits with 0 when the session reached its done state and 1 otherwise.
 */
public final class StorageMigratorMain {

    private static final Logger log = LoggerFactory.getLogger(StorageMigratorMain.class);

    static final String PROGRAM = "storage-migrator";
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    /** Opens the hypervisor connection for the effective settings. */
    @FunctionalInterface
    interface Connector {
        Hypervisor open(ConnectionSettings settings) throws ConnectionException;
    }

    private final Connector connector;
    private final OperatorConsole console;
    private final PrintStream err;

    StorageMigratorMain(Connector connector, OperatorConsole console, PrintStream err) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.console = Objects.requireNonNull(console, "console");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        int status = new StorageMigratorMain(LibvirtHypervisor::open, TerminalConsole.system(), System.err)
                .run(args);
        System.exit(status);
    }

    int run(String... args) {
        CliOptions options = new CliOptions();
        JCommander parser = JCommander.newBuilder()
                .programName(PROGRAM)
                .addObject(options)
                .build();

        String domain;
        MigrationConfig config;
        try {
            parser.parse(args);
            if (options.help()) {
                console.println(usage(parser));
                return EXIT_OK;
            }
            domain = options.domain();
            config = options.applyTo(loadConfig(options.configFile()));
        } catch (ParameterException e) {
            err.println(e.getMessage());
            err.println(usage(parser));
            return EXIT_FAILURE;
        } catch (MigrationConfigException e) {
            log.debug("Configuration rejected", e);
            err.println("Configuration error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        try {
            Destination destination = options.destination();
            try (Hypervisor hypervisor = connector.open(config.connection())) {
                SessionOutcome outcome = new MigrationSession(domain, destination, config, hypervisor, console).run();
                log.debug("Session finished in state {}", outcome.finalState());
                return EXIT_OK;
            }
        } catch (MigrateException e) {
            log.debug("Migration of {} failed", domain, e);
            err.println(e.kind() + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Migration of {} stopped by an unexpected error", domain, e);
            err.println("UnexpectedError: " + e.getClass().getSimpleName() + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static MigrationConfig loadConfig(Path configFile) {
        if (configFile == null) {
            return MigrationConfigLoader.load();
        }
        try {
            return MigrationConfigLoader.loadFromFile(configFile);
        } catch (IOException e) {
            throw new MigrationConfigException("Cannot read configuration file " + configFile, e);
        }
    }

    private static String usage(JCommander parser) {
        StringBuilder out = new StringBuilder();
        parser.getUsageFormatter().usage(out);
        return out.toString();
    }
}
