package storagemigrator.testing;

import storagemigrator.exceptions.HypervisorOperationException;
import storagemigrator.hypervisor.BlockJobStatus;
import storagemigrator.hypervisor.Hypervisor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory hypervisor for one domain.
 *
 * <p>Block job statuses are scripted per device; each query consumes one entry and the
 * last entry repeats. A device without a script reports no job until a copy is started
 * on it, after which it reports a finished copy. A pivot ends the job.
 *
 * <p>Every mutating call is recorded as {@code operation:device} (or just the
 * operation) in {@link #mutations()}.
 */
public final class FakeHypervisor implements Hypervisor {

    public static final String UNDEFINE = "undefineKeepingNvram";
    public static final String DEFINE = "define";

    private final String domain;
    private String description;
    private boolean persistent = true;

    private final Map<String, Deque<Optional<BlockJobStatus>>> scripts = new HashMap<>();
    private final Set<String> running = new HashSet<>();
    private final Map<String, Integer> statusQueries = new HashMap<>();
    private final Map<String, String> launchedXml = new HashMap<>();
    private final Set<String> failures = new HashSet<>();
    private final List<String> mutations = new ArrayList<>();
    private String definedXml;
    private boolean closed;

    public FakeHypervisor(String domain, String description) {
        this.domain = domain;
        this.description = description;
    }

    // ===== scripting =====

    /** Scripts the statuses returned for a device; {@code null} stands for "no job". */
    public FakeHypervisor script(String device, BlockJobStatus... statuses) {
        Deque<Optional<BlockJobStatus>> queue = new ArrayDeque<>();
        Arrays.stream(statuses).map(Optional::ofNullable).forEach(queue::add);
        scripts.put(device, queue);
        return this;
    }

    /** Marks a device as carrying a finished block job left by an earlier run. */
    public FakeHypervisor leftRunning(String device) {
        running.add(device);
        return this;
    }

    public FakeHypervisor transientDomain() {
        persistent = false;
        return this;
    }

    /** Makes {@code operation} fail for {@code device}, or for any device when device is null. */
    public FakeHypervisor failOn(String operation, String device) {
        failures.add(device == null ? operation : operation + ":" + device);
        return this;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    // ===== inspection =====

    public List<String> mutations() {
        return List.copyOf(mutations);
    }

    public int statusQueries(String device) {
        return statusQueries.getOrDefault(device, 0);
    }

    public String launchedXml(String device) {
        return launchedXml.get(device);
    }

    public String definedXml() {
        return definedXml;
    }

    public boolean isPersistentNow() {
        return persistent;
    }

    public boolean isClosed() {
        return closed;
    }

    // ===== Hypervisor =====

    @Override
    public String describe(String name) throws HypervisorOperationException {
        checkDomain("describe", name);
        maybeFail("describe", null);
        return description;
    }

    @Override
    public boolean isPersistent(String name) throws HypervisorOperationException {
        checkDomain("isPersistent", name);
        return persistent;
    }

    @Override
    public Optional<BlockJobStatus> blockJobStatus(String name, String device) throws HypervisorOperationException {
        checkDomain("blockJobInfo", name);
        statusQueries.merge(device, 1, Integer::sum);
        maybeFail("blockJobInfo", device);

        Deque<Optional<BlockJobStatus>> queue = scripts.get(device);
        if (queue != null && !queue.isEmpty()) {
            return queue.size() > 1 ? queue.poll() : queue.peek();
        }
        return running.contains(device) ? Optional.of(new BlockJobStatus(100, 100)) : Optional.empty();
    }

    @Override
    public void startBlockCopy(String name, String device, String destinationXml) throws HypervisorOperationException {
        checkDomain("blockCopy", name);
        maybeFail("blockCopy", device);
        mutations.add("blockCopy:" + device);
        launchedXml.put(device, destinationXml);
        running.add(device);
    }

    @Override
    public void pivotBlockJob(String name, String device) throws HypervisorOperationException {
        checkDomain("blockJobAbort", name);
        maybeFail("blockJobAbort", device);
        mutations.add("blockJobAbort:" + device);
        running.remove(device);
        scripts.remove(device);
    }

    @Override
    public void undefineKeepingNvram(String name) throws HypervisorOperationException {
        checkDomain("undefine", name);
        maybeFail("undefine", null);
        mutations.add(UNDEFINE);
        persistent = false;
    }

    @Override
    public void define(String domainXml) throws HypervisorOperationException {
        maybeFail("defineXML", null);
        mutations.add(DEFINE);
        definedXml = domainXml;
        persistent = true;
    }

    @Override
    public void close() {
        closed = true;
    }

    private void checkDomain(String operation, String name) throws HypervisorOperationException {
        if (!domain.equals(name)) {
            throw new HypervisorOperationException(operation, name, null, 42,
                    "Domain not found: no domain with matching name '" + name + "'", null);
        }
    }

    private void maybeFail(String operation, String device) throws HypervisorOperationException {
        if (failures.contains(operation) || (device != null && failures.contains(operation + ":" + device))) {
            throw new HypervisorOperationException(operation, domain, device, 1,
                    "internal error: scripted failure", null);
        }
    }
}
