package storagemigrator.session;

import org.junit.jupiter.api.Test;
import storagemigrator.inventory.VolumeInventory;
import storagemigrator.plan.Destination;
import storagemigrator.plan.MigrationPartitioner;
import storagemigrator.plan.MigrationPlan;
import storagemigrator.testing.DomainXml;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PlanReportTest {

    @Test
    void describesEachPendingVolume() throws Exception {
        MigrationPlan plan = MigrationPartitioner.partition(
                VolumeInventory.parse(DomainXml.web01()), new Destination.Directory(Path.of("/mnt/slow")));

        List<String> lines = PlanReport.render("web01", plan);

        assertThat(lines).contains(
                "Domain name: web01",
                "Destination: directory /mnt/slow",
                "Target dev: vda",
                "File path: /var/lib/libvirt/images/web01.qcow2",
                "Destination file path: /mnt/slow/web01.qcow2",
                "Target dev: vdb",
                "Volume Pool: fast -- Volume Name: web01-data",
                "Destination file path: /mnt/slow/web01-data");
        assertThat(lines).anyMatch(l -> l.startsWith("Destination XML: <disk type='file'"));
    }

    @Test
    void marksVolumesAlreadyAtDestination() throws Exception {
        MigrationPlan plan = MigrationPartitioner.partition(
                VolumeInventory.parse(DomainXml.web01()), new Destination.Pool("fast"));

        List<String> lines = PlanReport.render("web01", plan);

        int vdb = lines.indexOf("Target dev: vdb");
        assertThat(lines.get(vdb + 2)).isEqualTo("Already at destination, nothing to do");
        assertThat(lines).contains("Destination pool: fast");
    }
}
