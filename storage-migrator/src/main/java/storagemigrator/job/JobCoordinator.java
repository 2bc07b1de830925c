package storagemigrator.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import storagemigrator.alert.MigrationAlertLogger;
import storagemigrator.exceptions.HypervisorOperationException;
import storagemigrator.hypervisor.BlockJobStatus;
import storagemigrator.hypervisor.DestinationDiskXml;
import storagemigrator.hypervisor.Hypervisor;
import storagemigrator.inventory.VolumeDescriptor;
import storagemigrator.plan.Destination;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Drives per-device block-copy jobs from launch through completion to pivot.
 *
 * <p>Single-threaded. The hypervisor copies in the background; this class only issues
 * control requests and polls on a {@link PollSchedule}. Devices are independent, but a
 * pivot is only accepted for devices the last {@link #monitorAll} saw complete, and a
 * monitored batch is pivoted only after every device in it completed.
 *
 * <p>Any hypervisor error propagates at once and no further device is touched: a
 * half-migrated domain must reach the operator, not be papered over.
 */
public class JobCoordinator {

    private static final Logger log = LoggerFactory.getLogger(JobCoordinator.class);

    private final Hypervisor hypervisor;
    private final PollSchedule schedule;
    private final ProgressListener listener;

    private final Set<String> observedComplete = new HashSet<>();

    public JobCoordinator(Hypervisor hypervisor, PollSchedule schedule, ProgressListener listener) {
        this.hypervisor = Objects.requireNonNull(hypervisor, "hypervisor");
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.listener = listener == null ? ProgressListener.NONE : listener;
    }

    /**
     * Starts mirroring one disk to its destination. Returns without waiting for the copy.
     *
     * @param domain the domain name
     * @param volume the disk to move
     * @param destination where it goes
     * @throws HypervisorOperationException if the hypervisor refuses the job
     */
    public void launch(String domain, VolumeDescriptor volume, Destination destination)
            throws HypervisorOperationException {
        String xml = DestinationDiskXml.render(volume, destination);
        log.debug("Starting block copy of {} on {} to {}", volume.targetDevice(), domain, xml);
        hypervisor.startBlockCopy(domain, volume.targetDevice(), xml);
        observedComplete.remove(volume.targetDevice());
        MigrationAlertLogger.blockCopyLaunched(domain, volume.targetDevice());
    }

    /**
     * Launches every disk in order, stopping at the first failure.
     *
     * @param domain the domain name
     * @param volumes the disks to move
     * @param destination where they go
     * @throws HypervisorOperationException if any launch fails; later disks are not launched
     */
    public void launchAll(String domain, Collection<VolumeDescriptor> volumes, Destination destination)
            throws HypervisorOperationException {
        for (VolumeDescriptor volume : volumes) {
            launch(domain, volume, destination);
        }
    }

    /**
     * Polls every device once per tick until all are complete.
     *
     * <p>A device is complete when no job runs on it or its job reports
     * {@code cur >= end}; once seen complete it is not polled again. The percentage
     * reported for a device never decreases and is 100 exactly when it is complete.
     *
     * @param domain the domain name
     * @param devices the devices to wait for
     * @return the number of ticks it took
     * @throws HypervisorOperationException if a status query fails or the wait is interrupted
     */
    public int monitorAll(String domain, Collection<String> devices) throws HypervisorOperationException {
        Map<String, Integer> percent = new LinkedHashMap<>();
        for (String device : devices) {
            percent.put(device, 0);
        }
        Set<String> complete = new HashSet<>();

        int ticks = 0;
        while (complete.size() < percent.size()) {
            ticks++;
            for (Map.Entry<String, Integer> entry : percent.entrySet()) {
                String device = entry.getKey();
                if (complete.contains(device)) {
                    continue;
                }
                Optional<BlockJobStatus> status = hypervisor.blockJobStatus(domain, device);
                if (BlockJobStatus.isComplete(status)) {
                    complete.add(device);
                    entry.setValue(100);
                } else {
                    entry.setValue(Math.max(entry.getValue(), BlockJobStatus.percentOf(status)));
                }
            }
            listener.onTick(snapshot(percent, complete));

            if (complete.size() < percent.size()) {
                try {
                    schedule.pause();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new HypervisorOperationException("monitor", domain, null,
                            "Interrupted while waiting for block jobs; they keep running and a re-run resumes them");
                }
            }
        }

        observedComplete.addAll(complete);
        log.debug("Block jobs on {} complete after {} tick(s): {}", domain, ticks, complete);
        return ticks;
    }

    /**
     * Pivots every device onto its copy, stopping at the first failure. Irreversible.
     *
     * @param domain the domain name
     * @param devices the devices to finalize
     * @return the devices pivoted, in order
     * @throws HypervisorOperationException if a pivot fails; later devices are not pivoted
     * @throws IllegalStateException if a device was not seen complete by {@link #monitorAll}
     */
    public List<String> pivotAll(String domain, Collection<String> devices) throws HypervisorOperationException {
        for (String device : devices) {
            if (!observedComplete.contains(device)) {
                throw new IllegalStateException("Block copy of " + device + " was not seen complete");
            }
        }

        List<String> pivoted = new ArrayList<>();
        for (String device : devices) {
            hypervisor.pivotBlockJob(domain, device);
            observedComplete.remove(device);
            pivoted.add(device);
            MigrationAlertLogger.blockCopyPivoted(domain, device);
        }
        return pivoted;
    }

    private static List<DeviceProgress> snapshot(Map<String, Integer> percent, Set<String> complete) {
        List<DeviceProgress> progress = new ArrayList<>(percent.size());
        percent.forEach((device, pct) -> progress.add(new DeviceProgress(device, pct, complete.contains(device))));
        return List.copyOf(progress);
    }
}
