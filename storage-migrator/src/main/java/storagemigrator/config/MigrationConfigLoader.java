package storagemigrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import storagemigrator.hypervisor.ConnectionSettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads migration configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code storage-migrator.properties} on the classpath</li>
 *   <li>{@code storage-migrator.yml} on the classpath</li>
 * </ol>
 * When neither exists, {@link MigrationConfig#DEFAULTS} apply.
 *
 * <p>System properties override file-based configuration
 * (e.g. {@code -Dmigration.poll.interval.ms=500}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code migration.connection.host} - hypervisor host, empty for local</li>
 *   <li>{@code migration.connection.user} - remote user</li>
 *   <li>{@code migration.connection.ssh} - true to tunnel over SSH</li>
 *   <li>{@code migration.connection.session} - libvirt session (default system)</li>
 *   <li>{@code migration.poll.interval.ms} - block job poll interval in milliseconds</li>
 *   <li>{@code migration.backup.directory} - directory for the description backup</li>
 *   <li>{@code migration.assume.yes} - skip the destructive confirmation</li>
 *   <li>{@code migration.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * @see MigrationConfig
 */
public final class MigrationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigrationConfigLoader.class);

    static final String PROPERTIES_RESOURCE = "storage-migrator.properties";
    static final String YAML_RESOURCE = "storage-migrator.yml";

    private MigrationConfigLoader() {}

    /**
     * Load from classpath (storage-migrator.properties or storage-migrator.yml),
     * falling back to defaults with system property overrides.
     *
     * @return the loaded configuration
     * @throws MigrationConfigException if a config file exists but cannot be parsed
     */
    public static MigrationConfig load() {
        try (InputStream is = getResource(PROPERTIES_RESOURCE)) {
            if (is != null) {
                return loadProperties(is, PROPERTIES_RESOURCE);
            }
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to read " + PROPERTIES_RESOURCE, e);
        }

        try (InputStream is = getResource(YAML_RESOURCE)) {
            if (is != null) {
                return loadYaml(is, YAML_RESOURCE);
            }
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to read " + YAML_RESOURCE, e);
        }

        log.debug("No configuration file on classpath, using defaults");
        return parse(new Properties());
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws MigrationConfigException if the configuration is invalid
     */
    public static MigrationConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return MigrationConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static MigrationConfig loadProperties(InputStream is, String source) {
        try {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
    }

    private static MigrationConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(is);
        } catch (YAMLException | ClassCastException e) {
            throw new MigrationConfigException("Failed to parse " + source, e);
        }
        Properties props = new Properties();
        if (root != null) {
            flatten("", root, props);
        }
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    private static MigrationConfig parse(Properties props) {
        MigrationConfig.Builder b = MigrationConfig.builder();

        ConnectionSettings connection = ConnectionSettings.LOCAL;
        connection = connection.withHost(getString(props, "migration.connection.host").orElse(""));
        connection = connection.withUser(getString(props, "migration.connection.user").orElse(null));
        connection = connection.withSsh(getBoolean(props, "migration.connection.ssh").orElse(false));
        connection = connection.withSession(getString(props, "migration.connection.session").orElse(null));
        b.connection(connection);

        getLong(props, "migration.poll.interval.ms").ifPresent(v -> {
            if (v > 0) {
                b.pollIntervalMillis(v);
            } else {
                log.warn("Invalid poll.interval.ms: {}", v);
            }
        });

        getString(props, "migration.backup.directory").ifPresent(v -> {
            if (!v.isEmpty()) b.backupDirectory(Path.of(v));
        });

        getBoolean(props, "migration.assume.yes").ifPresent(b::assumeYes);

        getString(props, "migration.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        return b.build();
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Boolean> getBoolean(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            if (v.equalsIgnoreCase("true") || v.equalsIgnoreCase("false")) {
                return Optional.of(Boolean.parseBoolean(v));
            }
            log.warn("Invalid boolean for {}: {}", key, v);
            return Optional.empty();
        });
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}
