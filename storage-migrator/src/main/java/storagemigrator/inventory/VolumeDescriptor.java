package storagemigrator.inventory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One disk device attached to a domain, together with where its data lives.
 *
 * <p>A disk is either {@link FileBacked} (a file in a directory) or {@link PoolBacked}
 * (a named volume in a storage pool). The two payloads are separate records so a
 * pool name can never be read off a file-backed disk or the other way round.
 *
 * @see VolumeInventory
 */
public sealed interface VolumeDescriptor permits VolumeDescriptor.FileBacked, VolumeDescriptor.PoolBacked {

    /** Device id as known to the hypervisor (e.g. {@code vda}); unique within a domain. */
    String targetDevice();

    /** Leaf name reused for the copy: the file name or the pool volume name. */
    String volumeName();

    /** Effective location: the directory of a file-backed disk or the pool of a pool-backed one. */
    String location();

    /**
     * Disk backed by a plain file.
     *
     * @param targetDevice the device id
     * @param path the directory holding the file
     * @param fileName the file's leaf name
     */
    record FileBacked(String targetDevice, Path path, String fileName) implements VolumeDescriptor {

        public FileBacked {
            Objects.requireNonNull(targetDevice, "targetDevice");
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(fileName, "fileName");
        }

        /**
         * Creates a descriptor from a full file path.
         *
         * @param targetDevice the device id
         * @param file the full path of the backing file
         * @return the descriptor
         * @throws IllegalArgumentException if the path has no parent directory or no leaf name
         */
        public static FileBacked ofFile(String targetDevice, Path file) {
            Path parent = file.getParent();
            Path name = file.getFileName();
            if (parent == null || name == null) {
                throw new IllegalArgumentException("Not a file inside a directory: " + file);
            }
            return new FileBacked(targetDevice, parent, name.toString());
        }

        /** Full path of the backing file. */
        public Path file() {
            return path.resolve(fileName);
        }

        @Override
        public String volumeName() {
            return fileName;
        }

        @Override
        public String location() {
            return path.toString();
        }
    }

    /**
     * Disk backed by a volume in a storage pool.
     *
     * @param targetDevice the device id
     * @param poolName the storage pool
     * @param volumeName the volume within the pool
     */
    record PoolBacked(String targetDevice, String poolName, String volumeName) implements VolumeDescriptor {

        public PoolBacked {
            Objects.requireNonNull(targetDevice, "targetDevice");
            Objects.requireNonNull(poolName, "poolName");
            Objects.requireNonNull(volumeName, "volumeName");
        }

        @Override
        public String location() {
            return poolName;
        }
    }
}
