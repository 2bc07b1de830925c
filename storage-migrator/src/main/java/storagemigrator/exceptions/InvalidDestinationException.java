package storagemigrator.exceptions;

/**
 * Thrown when the migration destination is not exactly one of a storage pool or a
 * filesystem directory.
 *
 * <p>This is detected before any contact with the hypervisor.
 *
 * @see storagemigrator.plan.Destination#of(String, String)
 */
public class InvalidDestinationException extends MigrateException {

    /**
     * Creates a new invalid destination exception.
     *
     * @param message a description of the problem
     */
    public InvalidDestinationException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "InvalidDestination";
    }
}
