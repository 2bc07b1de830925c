package storagemigrator.session;

import storagemigrator.hypervisor.DestinationDiskXml;
import storagemigrator.inventory.VolumeDescriptor;
import storagemigrator.plan.Destination;
import storagemigrator.plan.MigrationPlan;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a plan as the operator reads it before confirming.
 *
 * <p>Lists the domain, then each disk with its current location and, for pending
 * disks, the destination and the exact disk XML handed to the hypervisor.
 */
final class PlanReport {

    static final String SEPARATOR = "----------";

    private PlanReport() {}

    static List<String> render(String domain, MigrationPlan plan) {
        List<String> lines = new ArrayList<>();
        lines.add("");
        lines.add("What will happen:");
        lines.add(SEPARATOR);
        lines.add("Domain name: " + domain);
        lines.add("Destination: " + plan.destination().describe());
        lines.add("Pending: " + plan.pending().devices() + "  Already migrated: " + plan.alreadyMigrated().devices());
        lines.add(SEPARATOR);

        for (VolumeDescriptor volume : plan.alreadyMigrated().descriptors()) {
            lines.add("Target dev: " + volume.targetDevice());
            lines.add(currentLocation(volume));
            lines.add("Already at destination, nothing to do");
            lines.add(SEPARATOR);
        }

        for (VolumeDescriptor volume : plan.pendingVolumes()) {
            lines.add("Target dev: " + volume.targetDevice());
            lines.add(currentLocation(volume));
            lines.add(destinationOf(volume, plan.destination()));
            lines.add("Destination XML: " + DestinationDiskXml.render(volume, plan.destination()));
            lines.add(SEPARATOR);
        }
        return lines;
    }

    private static String currentLocation(VolumeDescriptor volume) {
        if (volume instanceof VolumeDescriptor.FileBacked file) {
            return "File path: " + file.file();
        }
        VolumeDescriptor.PoolBacked pool = (VolumeDescriptor.PoolBacked) volume;
        return "Volume Pool: " + pool.poolName() + " -- Volume Name: " + pool.volumeName();
    }

    private static String destinationOf(VolumeDescriptor volume, Destination destination) {
        if (destination instanceof Destination.Directory dir) {
            return "Destination file path: " + dir.fileFor(volume.volumeName());
        }
        return "Destination pool: " + ((Destination.Pool) destination).name();
    }
}
