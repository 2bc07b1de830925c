package storagemigrator.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import storagemigrator.exceptions.HypervisorOperationException;
import storagemigrator.hypervisor.Hypervisor;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Finds block-copy jobs left running by an earlier, interrupted run.
 *
 * <p>A device is ongoing when the hypervisor reports any block job on it, whatever its
 * progress. This is a read-only probe.
 */
public final class ResumeDetector {

    private static final Logger log = LoggerFactory.getLogger(ResumeDetector.class);

    private final Hypervisor hypervisor;

    public ResumeDetector(Hypervisor hypervisor) {
        this.hypervisor = Objects.requireNonNull(hypervisor, "hypervisor");
    }

    /**
     * Returns the candidate devices that have a block job running.
     *
     * @param domain the domain name
     * @param candidates devices to probe, usually the pending ones
     * @return ongoing devices, in candidate order
     * @throws HypervisorOperationException if a status query fails
     */
    public Set<String> findOngoing(String domain, Collection<String> candidates) throws HypervisorOperationException {
        Set<String> ongoing = new LinkedHashSet<>();
        for (String device : candidates) {
            if (hypervisor.blockJobStatus(domain, device).isPresent()) {
                ongoing.add(device);
            }
        }
        if (!ongoing.isEmpty()) {
            log.info("Found block jobs left running on {} for {}", domain, ongoing);
        }
        return Collections.unmodifiableSet(ongoing);
    }
}
