package storagemigrator.hypervisor;

import storagemigrator.exceptions.HypervisorOperationException;

import java.util.Optional;

/**
 * The hypervisor calls a storage migration needs.
 *
 * <p>All calls are synchronous request/response. The hypervisor runs the actual copy
 * in the background, so callers poll {@link #blockJobStatus(String, String)}.
 * Implementations are used by a single thread and release their connection on
 * {@link #close()}.
 *
 * @see LibvirtHypervisor
 */
public interface Hypervisor extends AutoCloseable {

    /**
     * Reads the domain's description as it will be persisted.
     *
     * @param domain the domain name
     * @return the domain XML
     * @throws HypervisorOperationException if the domain is unknown or the call fails
     */
    String describe(String domain) throws HypervisorOperationException;

    /**
     * Checks whether the domain has a persistent definition.
     *
     * @param domain the domain name
     * @return false for a transient (running but undefined) domain
     * @throws HypervisorOperationException if the call fails
     */
    boolean isPersistent(String domain) throws HypervisorOperationException;

    /**
     * Queries the block job running on a device.
     *
     * @param domain the domain name
     * @param device the target device
     * @return the job's progress, or empty when no job runs on the device
     * @throws HypervisorOperationException if the query fails
     */
    Optional<BlockJobStatus> blockJobStatus(String domain, String device) throws HypervisorOperationException;

    /**
     * Starts mirroring a device to a new location. Returns as soon as the job is started.
     *
     * @param domain the domain name
     * @param device the target device
     * @param destinationXml the {@code <disk>} element describing the new location
     * @throws HypervisorOperationException if the job cannot be started
     */
    void startBlockCopy(String domain, String device, String destinationXml) throws HypervisorOperationException;

    /**
     * Finalizes a completed block copy: the domain switches to the new location and
     * drops the old source. Irreversible.
     *
     * @param domain the domain name
     * @param device the target device
     * @throws HypervisorOperationException if the pivot fails
     */
    void pivotBlockJob(String domain, String device) throws HypervisorOperationException;

    /**
     * Removes the domain's persistent definition while keeping its NVRAM (firmware
     * variable store) association. The running domain becomes transient.
     *
     * @param domain the domain name
     * @throws HypervisorOperationException if the call fails
     */
    void undefineKeepingNvram(String domain) throws HypervisorOperationException;

    /**
     * Defines (or replaces) a persistent domain configuration.
     *
     * @param domainXml the domain description
     * @throws HypervisorOperationException if the definition is rejected
     */
    void define(String domainXml) throws HypervisorOperationException;

    /** Releases the connection. Never fails; problems are logged. */
    @Override
    default void close() {
    }
}
