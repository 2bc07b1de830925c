package storagemigrator.job;

import org.junit.jupiter.api.Test;
import storagemigrator.exceptions.HypervisorOperationException;
import storagemigrator.hypervisor.BlockJobStatus;
import storagemigrator.testing.DomainXml;
import storagemigrator.testing.FakeHypervisor;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResumeDetectorTest {

    @Test
    void findsDevicesWithAnyJobInCandidateOrder() throws Exception {
        FakeHypervisor hv = new FakeHypervisor("web01", DomainXml.web01())
                .script("vdc", new BlockJobStatus(3, 10))
                .leftRunning("vda");

        Set<String> ongoing = new ResumeDetector(hv).findOngoing("web01", List.of("vdc", "vdb", "vda"));

        assertThat(ongoing).containsExactly("vdc", "vda");
    }

    @Test
    void reportsNothingWithoutJobs() throws Exception {
        FakeHypervisor hv = new FakeHypervisor("web01", DomainXml.web01());

        assertThat(new ResumeDetector(hv).findOngoing("web01", List.of("vda", "vdb"))).isEmpty();
        assertThat(hv.mutations()).isEmpty();
    }

    @Test
    void propagatesQueryFailures() {
        FakeHypervisor hv = new FakeHypervisor("web01", DomainXml.web01()).failOn("blockJobInfo", "vdb");

        assertThatThrownBy(() -> new ResumeDetector(hv).findOngoing("web01", List.of("vda", "vdb")))
                .isInstanceOf(HypervisorOperationException.class);
    }
}
