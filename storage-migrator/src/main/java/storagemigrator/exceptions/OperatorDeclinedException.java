package storagemigrator.exceptions;

/**
 * Thrown when the operator does not confirm the destructive part of a migration.
 *
 * <p>Nothing has been modified when this is raised.
 */
public class OperatorDeclinedException extends MigrateException {

    /**
     * Creates a new operator declined exception.
     *
     * @param domain the domain whose migration was declined
     */
    public OperatorDeclinedException(String domain) {
        super("Migration not confirmed by operator", domain, null, null);
    }

    @Override
    public String kind() {
        return "OperatorDeclined";
    }
}
