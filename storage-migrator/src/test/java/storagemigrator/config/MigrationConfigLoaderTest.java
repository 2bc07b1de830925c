package storagemigrator.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import storagemigrator.hypervisor.ConnectionSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MigrationConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearOverrides() {
        System.clearProperty("migration.poll.interval.ms");
        System.clearProperty("migration.connection.host");
    }

    @Test
    void loadFromPropertiesFile() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                migration.connection.host=kvm1.example.org
                migration.connection.user=ops
                migration.connection.ssh=true
                migration.connection.session=session
                migration.poll.interval.ms=500
                migration.backup.directory=/var/backups/vm
                migration.assume.yes=true
                migration.alert.level=ERROR
                """);

        MigrationConfig c = MigrationConfigLoader.loadFromFile(f);

        assertEquals("qemu+ssh://ops@kvm1.example.org/session", c.connection().toUri());
        assertEquals(Duration.ofMillis(500), c.pollInterval());
        assertEquals(Path.of("/var/backups/vm"), c.backupDirectory());
        assertTrue(c.assumeYes());
        assertEquals(AlertLevel.ERROR, c.alertLevel());
    }

    @Test
    void loadFromYamlFile() throws IOException {
        Path f = tempDir.resolve("test.yml");
        Files.writeString(f, """
                migration:
                  connection:
                    host: kvm2
                    ssh: true
                  poll:
                    interval:
                      ms: 2000
                  backup:
                    directory: /srv/backup
                  alert:
                    level: DEBUG
                """);

        MigrationConfig c = MigrationConfigLoader.loadFromFile(f);

        assertEquals("qemu+ssh://kvm2/system", c.connection().toUri());
        assertEquals(Duration.ofSeconds(2), c.pollInterval());
        assertEquals(Path.of("/srv/backup"), c.backupDirectory());
        assertFalse(c.assumeYes());
        assertEquals(AlertLevel.DEBUG, c.alertLevel());
    }

    @Test
    void caseInsensitiveEnums() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, "migration.alert.level=debug\n");

        MigrationConfig c = MigrationConfigLoader.loadFromFile(f);

        assertEquals(AlertLevel.DEBUG, c.alertLevel());
    }

    @Test
    void invalidValuesUseDefaults() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                migration.alert.level=INVALID
                migration.poll.interval.ms=not-a-number
                migration.assume.yes=maybe
                """);

        MigrationConfig c = MigrationConfigLoader.loadFromFile(f);

        assertEquals(AlertLevel.WARNING, c.alertLevel());
        assertEquals(MigrationConfig.DEFAULT_POLL_INTERVAL, c.pollInterval());
        assertFalse(c.assumeYes());
    }

    @Test
    void nonPositivePollIntervalIsIgnored() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, "migration.poll.interval.ms=0\n");

        assertEquals(MigrationConfig.DEFAULT_POLL_INTERVAL, MigrationConfigLoader.loadFromFile(f).pollInterval());
    }

    @Test
    void systemPropertiesOverrideFile() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                migration.poll.interval.ms=500
                migration.connection.host=from-file
                """);
        System.setProperty("migration.poll.interval.ms", "50");
        System.setProperty("migration.connection.host", "from-property");

        MigrationConfig c = MigrationConfigLoader.loadFromFile(f);

        assertEquals(Duration.ofMillis(50), c.pollInterval());
        assertEquals("from-property", c.connection().host());
    }

    @Test
    void classpathDefaultsMatchBuiltInDefaults() {
        MigrationConfig c = MigrationConfigLoader.load();

        assertEquals(ConnectionSettings.LOCAL, c.connection());
        assertEquals(MigrationConfig.DEFAULT_POLL_INTERVAL, c.pollInterval());
        assertEquals(MigrationConfig.DEFAULT_BACKUP_DIRECTORY, c.backupDirectory());
        assertFalse(c.assumeYes());
        assertEquals(AlertLevel.WARNING, c.alertLevel());
    }

    @Test
    void malformedYamlThrows() throws IOException {
        Path f = tempDir.resolve("broken.yml");
        Files.writeString(f, "migration: [unclosed\n");

        assertThrows(MigrationConfigException.class, () -> MigrationConfigLoader.loadFromFile(f));
    }

    @Test
    void nonexistentFileThrows() {
        Path f = tempDir.resolve("nonexistent.properties");
        assertThrows(IOException.class, () -> MigrationConfigLoader.loadFromFile(f));
    }
}
