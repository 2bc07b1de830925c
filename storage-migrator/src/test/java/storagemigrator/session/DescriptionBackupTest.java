package storagemigrator.session;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DescriptionBackupTest {

    @TempDir
    Path tempDir;

    @Test
    void writesBackupNamedAfterDomain() throws IOException {
        DescriptionBackup backup = new DescriptionBackup(tempDir);

        Path written = backup.write("web01", "<domain/>");

        assertThat(written).isEqualTo(tempDir.resolve("web01_backup.xml"));
        assertThat(Files.readString(written)).isEqualTo("<domain/>");
    }

    @Test
    void keepsEarlierBackupAsPrev() throws IOException {
        DescriptionBackup backup = new DescriptionBackup(tempDir);
        backup.write("web01", "<domain>first</domain>");

        backup.write("web01", "<domain>second</domain>");

        assertThat(Files.readString(tempDir.resolve("web01_backup.xml"))).isEqualTo("<domain>second</domain>");
        assertThat(Files.readString(tempDir.resolve("web01_backup.xml.prev"))).isEqualTo("<domain>first</domain>");
    }

    @Test
    void createsMissingDirectory() throws IOException {
        Path nested = tempDir.resolve("a/b");

        Path written = new DescriptionBackup(nested).write("db", "<domain/>");

        assertThat(written).exists();
    }

    @Test
    void failsWhenDirectoryIsAFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("occupied"), "x");

        DescriptionBackup backup = new DescriptionBackup(file);

        assertThatThrownBy(() -> backup.write("web01", "<domain/>")).isInstanceOf(IOException.class);
    }
}
