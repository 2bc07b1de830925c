package storagemigrator.exceptions;

/**
 * Thrown when a hypervisor control call fails.
 *
 * <p>Covers domain lookup, description reads, block job status queries, block-copy
 * launch, pivot, undefine and define. Any of these ends the session: the orchestrator
 * never tries to repair hypervisor state by guessing and relies on the next run's
 * resume detection instead.
 */
public class HypervisorOperationException extends MigrateException {

    /** Error code used when the hypervisor did not report one. */
    public static final int UNKNOWN_ERROR_CODE = -1;

    private final String operation;
    private final int errorCode;

    /**
     * Creates a new hypervisor operation exception.
     *
     * @param operation the control call that failed (e.g. "blockCopy")
     * @param domain the domain the call targeted
     * @param device the target device, or null for domain-wide calls
     * @param errorCode the hypervisor error code, or {@link #UNKNOWN_ERROR_CODE}
     * @param detail the hypervisor error message
     * @param cause the underlying error, or null
     */
    public HypervisorOperationException(String operation,
                                        String domain,
                                        String device,
                                        int errorCode,
                                        String detail,
                                        Throwable cause) {
        super("Hypervisor call '" + operation + "' failed: " + detail, domain, device, cause);
        this.operation = operation;
        this.errorCode = errorCode;
    }

    /**
     * Creates a new hypervisor operation exception without an error code.
     *
     * @param operation the control call that failed
     * @param domain the domain the call targeted
     * @param device the target device, or null for domain-wide calls
     * @param detail the failure detail
     */
    public HypervisorOperationException(String operation, String domain, String device, String detail) {
        this(operation, domain, device, UNKNOWN_ERROR_CODE, detail, null);
    }

    /** Returns the name of the control call that failed. */
    public String getOperation() {
        return operation;
    }

    /** Returns the hypervisor error code, or {@link #UNKNOWN_ERROR_CODE}. */
    public int getErrorCode() {
        return errorCode;
    }

    @Override
    public String kind() {
        return "HypervisorOperationError";
    }
}
