package storagemigrator.exceptions;

/**
 * Base exception for every failure that ends a storage migration session.
 *
 * <p>Besides the message, an exception carries optional diagnostic context:
 * <ul>
 *   <li>The domain (VM) whose storage was being migrated</li>
 *   <li>The target device involved, when the failure concerns a single disk</li>
 *   <li>The session stage at which the failure surfaced</li>
 * </ul>
 *
 * <p>The stage is usually unknown where the exception is thrown (deep inside the
 * hypervisor adapter), so the session records it on the way out with
 * {@link #recordStage(String)}. The first recorded stage wins.
 *
 * @see storagemigrator.session.MigrationSession
 */
public class MigrateException extends Exception {

    private final String domain;
    private final String device;
    private String stage;

    // ---------------- constructors ----------------

    /**
     * Creates a new migration exception with a message.
     *
     * @param message the error message
     */
    public MigrateException(String message) {
        this(message, null, null, null);
    }

    /**
     * Creates a new migration exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrateException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    /**
     * Creates a new migration exception with domain and device context.
     *
     * @param message the error message
     * @param domain the domain being migrated, or null
     * @param device the target device involved, or null
     * @param cause the underlying cause, or null
     */
    public MigrateException(String message, String domain, String device, Throwable cause) {
        super(message, cause);
        this.domain = domain;
        this.device = device;
    }

    // ---------------- stage ----------------

    /**
     * Records the session stage at which this exception surfaced, unless one is already set.
     *
     * @param stage the stage name
     * @return this exception, for rethrowing
     */
    public MigrateException recordStage(String stage) {
        if (this.stage == null) {
            this.stage = stage;
        }
        return this;
    }

    // ---------------- getters ----------------

    /** Returns the domain being migrated, or null if not set. */
    public String getDomain() {
        return domain;
    }

    /** Returns the target device involved in the failure, or null if not set. */
    public String getDevice() {
        return device;
    }

    /** Returns the session stage where the failure occurred, or null if not set. */
    public String getStage() {
        return stage;
    }

    /**
     * Short, human-readable name of the failure kind, used in operator output.
     *
     * @return the failure kind
     */
    public String kind() {
        return "MigrationError";
    }

    // ---------------- diagnostics ----------------

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(String.valueOf(super.getMessage()));

        if (stage != null) sb.append(" [stage=").append(stage).append("]");
        if (domain != null) sb.append(" [domain=").append(domain).append("]");
        if (device != null) sb.append(" [device=").append(device).append("]");

        return sb.toString();
    }
}
