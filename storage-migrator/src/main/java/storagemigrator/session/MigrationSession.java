package storagemigrator.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import storagemigrator.alert.MigrationAlertLogger;
import storagemigrator.config.MigrationConfig;
import storagemigrator.exceptions.MigrateException;
import storagemigrator.exceptions.OperatorDeclinedException;
import storagemigrator.hypervisor.Hypervisor;
import storagemigrator.inventory.VolumeInventory;
import storagemigrator.inventory.VolumeMap;
import storagemigrator.job.JobCoordinator;
import storagemigrator.job.PollSchedule;
import storagemigrator.job.ResumeDetector;
import storagemigrator.job.Sleeper;
import storagemigrator.metrics.MigrationMetrics;
import storagemigrator.metrics.MigrationMetricsCollector;
import storagemigrator.plan.Destination;
import storagemigrator.plan.MigrationPartitioner;
import storagemigrator.plan.MigrationPlan;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Moves every disk of one running domain to a destination, end to end.
 *
 * <p>A fresh run inspects the domain, plans, asks the operator, backs the description
 * up, undefines the domain (keeping NVRAM), launches one block copy per pending disk,
 * waits for all of them, pivots them, and defines the updated description again.
 *
 * <p>A run that finds block jobs left by an interrupted earlier run skips all of that
 * and only waits for, pivots and persists those jobs. A run that finds every disk
 * already at the destination does nothing. Either way the tool can be re-run safely.
 *
 * <p>Any failure ends the session in {@link SessionState#ABORTED} and propagates; the
 * session never retries and never tries to undo hypervisor state.
 *
 * <p>A session is single-use: {@link #run()} may be called once.
 *
 * @see SessionState
 */
public final class MigrationSession {

    private static final Logger log = LoggerFactory.getLogger(MigrationSession.class);

    private static final AtomicLong SESSION_COUNTER = new AtomicLong(1L);

    private final String domain;
    private final Destination destination;
    private final MigrationConfig config;
    private final Hypervisor hypervisor;
    private final OperatorConsole console;
    private final JobCoordinator coordinator;
    private final ResumeDetector resumeDetector;
    private final DescriptionBackup backup;
    private final MigrationMetricsCollector metrics;

    private SessionState state = SessionState.INSPECT;
    private boolean started;
    private long sessionId;

    private VolumeMap volumes;
    private MigrationPlan plan;
    private String originalDescription;

    public MigrationSession(String domain,
                            Destination destination,
                            MigrationConfig config,
                            Hypervisor hypervisor,
                            OperatorConsole console) {
        this(domain, destination, config, hypervisor, console, Sleeper.SYSTEM, Clock.systemUTC());
    }

    public MigrationSession(String domain,
                            Destination destination,
                            MigrationConfig config,
                            Hypervisor hypervisor,
                            OperatorConsole console,
                            Sleeper sleeper,
                            Clock clock) {
        this.domain = Objects.requireNonNull(domain, "domain");
        this.destination = Objects.requireNonNull(destination, "destination");
        this.config = Objects.requireNonNull(config, "config");
        this.hypervisor = Objects.requireNonNull(hypervisor, "hypervisor");
        this.console = Objects.requireNonNull(console, "console");

        PollSchedule schedule = new PollSchedule(config.pollInterval(), Objects.requireNonNull(sleeper, "sleeper"));
        this.coordinator = new JobCoordinator(hypervisor, schedule, console::progress);
        this.resumeDetector = new ResumeDetector(hypervisor);
        this.backup = new DescriptionBackup(config.backupDirectory());
        this.metrics = new MigrationMetricsCollector(clock);
    }

    /**
     * Runs the session to completion.
     *
     * @return the outcome of a session that reached {@link SessionState#DONE}
     * @throws OperatorDeclinedException if the operator did not confirm; nothing was modified
     * @throws MigrateException if any step fails; the exception's stage names the state
     */
    public SessionOutcome run() throws MigrateException {
        if (started) {
            throw new IllegalStateException("Session already run");
        }
        started = true;
        sessionId = SESSION_COUNTER.getAndIncrement();

        MigrationAlertLogger.setAlertLevel(config.alertLevel());
        MigrationAlertLogger.sessionStarted(sessionId, domain, destination.describe());
        metrics.start(sessionId);
        log.debug("Session #{} for {} with {}", sessionId, domain, config);

        try {
            inspect();
            planMigration();

            if (plan.isNoop()) {
                console.println("All volumes of " + domain + " are already at the destination, nothing to do.");
                warnIfTransient();
                return finish(List.of(), Set.of(), null, false);
            }

            Set<String> ongoing = resumeDetector.findOngoing(domain, plan.pendingDevices());
            if (!ongoing.isEmpty()) {
                return resume(ongoing);
            }
            return migrate();
        } catch (OperatorDeclinedException e) {
            e.recordStage(state.name());
            transition(SessionState.ABORTED);
            MigrationAlertLogger.sessionAborted(sessionId, e.getMessage());
            throw e;
        } catch (MigrateException e) {
            e.recordStage(state.name());
            MigrationAlertLogger.sessionFailed(sessionId, e, state);
            transition(SessionState.ABORTED);
            throw e;
        } catch (RuntimeException e) {
            MigrationAlertLogger.sessionFailed(sessionId, e, state);
            transition(SessionState.ABORTED);
            throw e;
        }
    }

    // ===== states =====

    private void inspect() throws MigrateException {
        metrics.timed(SessionState.INSPECT, () -> {
            originalDescription = hypervisor.describe(domain);
            volumes = VolumeInventory.parse(originalDescription);
        });
        log.info("Domain {} has {} volume(s): {}", domain, volumes.size(), volumes.devices());
    }

    private void planMigration() {
        transition(SessionState.PLAN);
        plan = metrics.timed(SessionState.PLAN, () -> MigrationPartitioner.partition(volumes, destination));
        metrics.devicesPending(plan.pending().size())
               .devicesAlreadyMigrated(plan.alreadyMigrated().size());
        log.info("Plan for {}: {}", domain, plan.summary());
        PlanReport.render(domain, plan).forEach(console::println);
    }

    private SessionOutcome resume(Set<String> ongoing) throws MigrateException {
        console.println("Resuming block copies left running by an earlier run: " + ongoing);
        metrics.resumed(true);

        transition(SessionState.RESUME_MONITOR);
        int ticks = metrics.timed(SessionState.RESUME_MONITOR, () -> coordinator.monitorAll(domain, ongoing));
        metrics.pollTicks(ticks);

        transition(SessionState.PIVOT);
        List<String> pivoted = metrics.timed(SessionState.PIVOT, () -> coordinator.pivotAll(domain, ongoing));
        metrics.devicesPivoted(pivoted.size());

        redefine();

        Set<String> stillPending = new LinkedHashSet<>(plan.pendingDevices());
        stillPending.removeAll(ongoing);
        if (!stillPending.isEmpty()) {
            console.println("Volumes still to migrate: " + stillPending + ". Run again to migrate them.");
        }
        return finish(pivoted, stillPending, null, true);
    }

    private SessionOutcome migrate() throws MigrateException {
        transition(SessionState.CONFIRM_DESTRUCTIVE);
        if (!config.assumeYes() && !console.confirm("\nProceed?")) {
            throw new OperatorDeclinedException(domain);
        }

        console.println(PlanReport.SEPARATOR);
        transition(SessionState.BACKUP);
        Path backupFile = writeBackup();

        transition(SessionState.UNDEFINE);
        undefine();

        transition(SessionState.LAUNCH_ALL);
        metrics.timed(SessionState.LAUNCH_ALL,
                () -> coordinator.launchAll(domain, plan.pendingVolumes(), destination));

        transition(SessionState.MONITOR_ALL);
        int ticks = metrics.timed(SessionState.MONITOR_ALL,
                () -> coordinator.monitorAll(domain, plan.pendingDevices()));
        metrics.pollTicks(ticks);

        transition(SessionState.PIVOT_ALL);
        List<String> pivoted = metrics.timed(SessionState.PIVOT_ALL,
                () -> coordinator.pivotAll(domain, plan.pendingDevices()));
        metrics.devicesPivoted(pivoted.size());

        redefine();
        return finish(pivoted, Set.of(), backupFile, false);
    }

    private Path writeBackup() throws MigrateException {
        Path target = backup.pathFor(domain);
        console.println("Backing up domain XML to local file \"" + target + "\"");
        try {
            return metrics.timed(SessionState.BACKUP, () -> backup.write(domain, originalDescription));
        } catch (IOException e) {
            throw new MigrateException("Failed to write backup " + target + ": " + e.getMessage(), domain, null, e);
        }
    }

    private void undefine() throws MigrateException {
        if (!hypervisor.isPersistent(domain)) {
            MigrationAlertLogger.stepSkipped(sessionId, SessionState.UNDEFINE, "domain is already transient");
            log.info("Domain {} is already transient, not undefining", domain);
            return;
        }
        metrics.timed(SessionState.UNDEFINE, () -> hypervisor.undefineKeepingNvram(domain));
    }

    // A run stopped between the last pivot and REDEFINE leaves every disk moved but the domain transient.
    private void warnIfTransient() throws MigrateException {
        if (hypervisor.isPersistent(domain)) {
            return;
        }
        Path saved = backup.pathFor(domain);
        log.warn("Domain {} is transient, its definition is lost when it shuts down", domain);
        console.println("WARNING: " + domain + " is not persistent and will disappear when it shuts down. "
                + "Define it again from its current description (virsh dumpxml " + domain + " > " + domain
                + ".xml && virsh define " + domain + ".xml). The definition from before the migration was saved to "
                + saved + ".");
    }

    private void redefine() throws MigrateException {
        transition(SessionState.REDEFINE);
        metrics.timed(SessionState.REDEFINE, () -> hypervisor.define(hypervisor.describe(domain)));
        log.info("Persisted updated definition of {}", domain);
    }

    private SessionOutcome finish(List<String> pivoted, Set<String> stillPending, Path backupFile, boolean resumed) {
        transition(SessionState.DONE);
        MigrationMetrics m = metrics.finish();
        MigrationAlertLogger.sessionCompleted(sessionId, m);
        log.info("{}", m.summary());
        console.println("Complete!");
        return new SessionOutcome(state, plan, List.copyOf(pivoted), Set.copyOf(stillPending), backupFile, resumed, m);
    }

    private void transition(SessionState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal session transition " + state + " -> " + next);
        }
        log.debug("Session #{}: {} -> {}", sessionId, state, next);
        state = next;
        MigrationAlertLogger.stateEntered(sessionId, next);
    }

    // ===== queries =====

    /** Current (or, after {@link #run()}, final) state. */
    public SessionState state() {
        return state;
    }

    /** The plan, once the session got past {@link SessionState#PLAN}; null before. */
    public MigrationPlan plan() {
        return plan;
    }

    public String domain() {
        return domain;
    }

    public Destination destination() {
        return destination;
    }
}
