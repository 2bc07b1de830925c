package storagemigrator.hypervisor;

import org.libvirt.Connect;
import org.libvirt.Domain;
import org.libvirt.DomainBlockJobInfo;
import org.libvirt.LibvirtException;
import org.libvirt.TypedParameter;
import org.libvirt.TypedUlongParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import storagemigrator.exceptions.ConnectionException;
import storagemigrator.exceptions.HypervisorOperationException;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link Hypervisor} backed by a libvirt connection through the {@code org.libvirt}
 * bindings.
 *
 * <p>Each call looks the domain up by name and frees the handle afterwards, so no
 * domain handle outlives a call. The connection itself is shared and closed by
 * {@link #close()}.
 */
public final class LibvirtHypervisor implements Hypervisor {

    private static final Logger log = LoggerFactory.getLogger(LibvirtHypervisor.class);

    // virDomainXMLFlags / virDomainUndefineFlagsValues
    static final int XML_INACTIVE = 1 << 1;
    static final int UNDEFINE_KEEP_NVRAM = 1 << 3;

    private final Connect connection;
    private final String uri;

    LibvirtHypervisor(Connect connection, String uri) {
        this.connection = connection;
        this.uri = uri;
    }

    /**
     * Opens a connection to the hypervisor.
     *
     * @param settings where and how to connect
     * @return the connected hypervisor
     * @throws ConnectionException if the hypervisor cannot be reached or refuses the connection
     */
    public static LibvirtHypervisor open(ConnectionSettings settings) throws ConnectionException {
        Objects.requireNonNull(settings, "settings");
        String uri = settings.toUri();
        log.info("Connecting to hypervisor at {}", uri);
        try {
            return new LibvirtHypervisor(new Connect(uri), uri);
        } catch (LibvirtException e) {
            throw new ConnectionException(uri, describe(e), e);
        }
    }

    /** The URI this hypervisor is connected to. */
    public String uri() {
        return uri;
    }

    @Override
    public String describe(String domain) throws HypervisorOperationException {
        return withDomain(domain, "describe", null, dm -> dm.getXMLDesc(XML_INACTIVE));
    }

    @Override
    public boolean isPersistent(String domain) throws HypervisorOperationException {
        return withDomain(domain, "isPersistent", null, dm -> dm.isPersistent() == 1);
    }

    @Override
    public Optional<BlockJobStatus> blockJobStatus(String domain, String device) throws HypervisorOperationException {
        return withDomain(domain, "blockJobInfo", device, dm -> {
            DomainBlockJobInfo info = dm.getBlockJobInfo(device, 0);
            if (isIdle(info)) {
                return Optional.<BlockJobStatus>empty();
            }
            log.trace("Block job on {}: cur={} end={} type={} bandwidth={}",
                    device, info.cur, info.end, info.type, info.bandwidth);
            return Optional.of(new BlockJobStatus(info.cur, info.end));
        });
    }

    @Override
    public void startBlockCopy(String domain, String device, String destinationXml) throws HypervisorOperationException {
        withDomain(domain, "blockCopy", device, dm -> {
            TypedParameter[] parameters = {new TypedUlongParameter("bandwidth", 0)};
            dm.blockCopy(device, destinationXml, parameters, 0);
            return null;
        });
    }

    @Override
    public void pivotBlockJob(String domain, String device) throws HypervisorOperationException {
        withDomain(domain, "blockJobAbort", device, dm -> {
            dm.blockJobAbort(device, Domain.BlockJobAbortFlags.PIVOT);
            return null;
        });
    }

    @Override
    public void undefineKeepingNvram(String domain) throws HypervisorOperationException {
        withDomain(domain, "undefine", null, dm -> {
            dm.undefine(UNDEFINE_KEEP_NVRAM);
            return null;
        });
    }

    @Override
    public void define(String domainXml) throws HypervisorOperationException {
        Domain dm = null;
        try {
            dm = connection.domainDefineXML(domainXml);
        } catch (LibvirtException e) {
            throw failure("defineXML", null, null, e);
        } finally {
            free(dm);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (LibvirtException e) {
            log.warn("Failed to close hypervisor connection {}: {}", uri, describe(e));
        }
    }

    // ===== helpers =====

    @FunctionalInterface
    private interface DomainCall<T> {
        T apply(Domain domain) throws LibvirtException;
    }

    private <T> T withDomain(String domain, String operation, String device, DomainCall<T> call)
            throws HypervisorOperationException {
        Domain dm;
        try {
            dm = connection.domainLookupByName(domain);
        } catch (LibvirtException e) {
            throw failure("lookup", domain, null, e);
        }
        if (dm == null) {
            throw new HypervisorOperationException("lookup", domain, null, "No such domain: " + domain);
        }
        try {
            return call.apply(dm);
        } catch (LibvirtException e) {
            throw failure(operation, domain, device, e);
        } finally {
            free(dm);
        }
    }

    // The bindings hand back a zeroed struct when the disk has no block job.
    static boolean isIdle(DomainBlockJobInfo info) {
        return info.type == 0 && info.cur == 0 && info.end == 0;
    }

    private static void free(Domain dm) {
        if (dm == null) {
            return;
        }
        try {
            dm.free();
        } catch (LibvirtException e) {
            log.trace("Ignoring libvirt error while freeing domain", e);
        }
    }

    private static HypervisorOperationException failure(String operation, String domain, String device, LibvirtException e) {
        return new HypervisorOperationException(operation, domain, device, errorCode(e), describe(e), e);
    }

    private static int errorCode(LibvirtException e) {
        org.libvirt.Error error = e.getError();
        if (error == null || error.getCode() == null) {
            return HypervisorOperationException.UNKNOWN_ERROR_CODE;
        }
        return error.getCode().ordinal();
    }

    private static String describe(LibvirtException e) {
        org.libvirt.Error error = e.getError();
        if (error != null && error.getMessage() != null) {
            return error.getMessage();
        }
        return String.valueOf(e.getMessage());
    }
}
