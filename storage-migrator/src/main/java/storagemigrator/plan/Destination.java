package storagemigrator.plan;

import storagemigrator.exceptions.InvalidDestinationException;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where the disks of a domain should end up: a storage pool or a directory, never both.
 */
public sealed interface Destination permits Destination.Pool, Destination.Directory {

    /**
     * Builds a destination from the two mutually exclusive operator inputs.
     * Blank strings count as absent.
     *
     * @param pool the destination pool name, or null
     * @param path the destination directory, or null
     * @return the destination
     * @throws InvalidDestinationException if both or neither are given, or the path is unusable or relative
     */
    static Destination of(String pool, String path) throws InvalidDestinationException {
        boolean hasPool = pool != null && !pool.isBlank();
        boolean hasPath = path != null && !path.isBlank();
        if (hasPool == hasPath) {
            throw new InvalidDestinationException(
                    "Either a destination pool or a destination path must be specified (but not both)");
        }
        if (hasPool) {
            return new Pool(pool.trim());
        }
        Path directory;
        try {
            directory = Path.of(path.trim());
        } catch (InvalidPathException e) {
            throw new InvalidDestinationException("Invalid destination path '" + path + "': " + e.getReason());
        }
        if (!directory.isAbsolute()) {
            throw new InvalidDestinationException("Destination path must be absolute, got '" + path.trim() + "'");
        }
        return new Directory(directory);
    }

    /** Human-readable destination for plan summaries. */
    String describe();

    /**
     * A storage pool.
     *
     * @param name the pool name
     */
    record Pool(String name) implements Destination {

        public Pool {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String describe() {
            return "pool " + name;
        }
    }

    /**
     * A filesystem directory on the hypervisor host. The path must be absolute and is stored
     * normalized, so {@code /data/b/}, {@code /data/./b} and {@code /data/a/../b} are the
     * same directory.
     *
     * @param path the directory
     */
    record Directory(Path path) implements Destination {

        public Directory {
            Objects.requireNonNull(path, "path");
            if (!path.isAbsolute()) {
                throw new IllegalArgumentException("Destination directory must be absolute: " + path);
            }
            path = normalize(path);
        }

        static Path normalize(Path p) {
            return p.normalize();
        }

        /** Full path a volume of the given name gets in this directory. */
        public Path fileFor(String volumeName) {
            return path.resolve(volumeName);
        }

        /** Returns true if {@code directory} names this same directory. */
        public boolean sameDirectory(Path directory) {
            return path.equals(normalize(directory));
        }

        @Override
        public String describe() {
            return "directory " + path;
        }
    }
}
