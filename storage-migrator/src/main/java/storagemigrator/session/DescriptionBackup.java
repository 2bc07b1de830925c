package storagemigrator.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Writes the pre-migration domain description to {@code <directory>/<domain>_backup.xml}.
 *
 * <p>This file is the only recovery artifact if a later step fails badly. A backup
 * already present is moved to {@code <domain>_backup.xml.prev} first, so re-running
 * after an interrupted session does not overwrite the description of the first run.
 */
public final class DescriptionBackup {

    private static final Logger log = LoggerFactory.getLogger(DescriptionBackup.class);

    private final Path directory;

    public DescriptionBackup(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    /**
     * Returns where the backup of a domain is written.
     *
     * @param domain the domain name
     * @return the backup file path
     */
    public Path pathFor(String domain) {
        return directory.resolve(domain + "_backup.xml");
    }

    /**
     * Writes a backup.
     *
     * @param domain the domain name
     * @param domainXml the description to save
     * @return the backup file
     * @throws IOException if the file cannot be written
     */
    public Path write(String domain, String domainXml) throws IOException {
        Path target = pathFor(domain);
        if (Files.exists(target)) {
            Path previous = target.resolveSibling(target.getFileName() + ".prev");
            Files.move(target, previous, StandardCopyOption.REPLACE_EXISTING);
            log.info("Kept earlier backup as {}", previous);
        }
        Files.createDirectories(directory);
        Files.writeString(target, domainXml, StandardCharsets.UTF_8);
        return target;
    }
}
