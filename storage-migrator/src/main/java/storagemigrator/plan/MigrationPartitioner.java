package storagemigrator.plan;

import storagemigrator.inventory.VolumeDescriptor;
import storagemigrator.inventory.VolumeDescriptor.FileBacked;
import storagemigrator.inventory.VolumeDescriptor.PoolBacked;
import storagemigrator.inventory.VolumeMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a domain's disks into pending and already-migrated against a destination.
 *
 * <p>A disk is already migrated when its location matches the destination:
 * <ul>
 *   <li>file-backed disk, directory destination: same directory (path equality)</li>
 *   <li>pool-backed disk, pool destination: same pool name</li>
 *   <li>any other combination: pending</li>
 * </ul>
 * Only the location is compared, never the volume name.
 */
public final class MigrationPartitioner {

    private MigrationPartitioner() {}

    /**
     * Partitions a volume map.
     *
     * @param volumes the domain's disks
     * @param destination where the disks should end up
     * @return the plan; every disk lands in exactly one bucket
     */
    public static MigrationPlan partition(VolumeMap volumes, Destination destination) {
        Objects.requireNonNull(volumes, "volumes");
        Objects.requireNonNull(destination, "destination");

        List<VolumeDescriptor> pending = new ArrayList<>();
        List<VolumeDescriptor> migrated = new ArrayList<>();

        for (VolumeDescriptor volume : volumes.descriptors()) {
            if (isAtDestination(volume, destination)) {
                migrated.add(volume);
            } else {
                pending.add(volume);
            }
        }

        return new MigrationPlan(destination, VolumeMap.of(pending), VolumeMap.of(migrated));
    }

    /**
     * Checks whether a single disk already lives at the destination.
     *
     * @param volume the disk
     * @param destination the destination
     * @return true if the disk needs no migration
     */
    public static boolean isAtDestination(VolumeDescriptor volume, Destination destination) {
        if (volume instanceof FileBacked file && destination instanceof Destination.Directory dir) {
            return dir.sameDirectory(file.path());
        }
        if (volume instanceof PoolBacked pool && destination instanceof Destination.Pool dest) {
            return pool.poolName().equals(dest.name());
        }
        return false;
    }
}
