package storagemigrator.plan;

import storagemigrator.inventory.VolumeDescriptor;
import storagemigrator.inventory.VolumeMap;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable split of a domain's disks into those still to move and those already at
 * the destination.
 *
 * <p>The two buckets are disjoint, keep domain order, and together hold every disk of
 * the {@link VolumeMap} they were computed from.
 *
 * @see MigrationPartitioner
 */
public final class MigrationPlan {

    private final Destination destination;
    private final VolumeMap pending;
    private final VolumeMap alreadyMigrated;

    MigrationPlan(Destination destination, VolumeMap pending, VolumeMap alreadyMigrated) {
        this.destination = Objects.requireNonNull(destination, "destination");
        this.pending = Objects.requireNonNull(pending, "pending");
        this.alreadyMigrated = Objects.requireNonNull(alreadyMigrated, "alreadyMigrated");
    }

    // ===== public API =====

    public Destination destination() {
        return destination;
    }

    /** Disks whose location differs from the destination. */
    public VolumeMap pending() {
        return pending;
    }

    /** Disks already at the destination. */
    public VolumeMap alreadyMigrated() {
        return alreadyMigrated;
    }

    /** Returns true when every disk is already at the destination. */
    public boolean isNoop() {
        return pending.isEmpty();
    }

    /** Target devices still to move, in domain order. */
    public Set<String> pendingDevices() {
        return pending.devices();
    }

    /**
     * Checks whether a device is pending.
     *
     * @param targetDevice the device id
     * @return true if the device still has to move
     */
    public boolean isPending(String targetDevice) {
        return pending.contains(targetDevice);
    }

    /** Pending descriptors in domain order. */
    public List<VolumeDescriptor> pendingVolumes() {
        return pending.descriptors();
    }

    /** One-line summary for logs. */
    public String summary() {
        return "pending=" + devicesOf(pending) + " alreadyMigrated=" + devicesOf(alreadyMigrated)
                + " destination=" + destination.describe();
    }

    private static String devicesOf(VolumeMap map) {
        return map.devices().stream().collect(Collectors.joining(",", "[", "]"));
    }

    @Override
    public String toString() {
        return "MigrationPlan{" + summary() + '}';
    }
}
