package storagemigrator.exceptions;

/**
 * Thrown when the hypervisor cannot be reached or refuses authentication.
 *
 * <p>The connection URI is kept so the operator can see which transport was tried.
 */
public class ConnectionException extends MigrateException {

    private final String uri;

    /**
     * Creates a new connection exception.
     *
     * @param uri the connection URI that was attempted
     * @param detail the transport error detail
     * @param cause the underlying hypervisor library error
     */
    public ConnectionException(String uri, String detail, Throwable cause) {
        super("Failed to open connection to hypervisor for URI \"" + uri + "\": " + detail, cause);
        this.uri = uri;
    }

    /** Returns the connection URI that was attempted. */
    public String getUri() {
        return uri;
    }

    @Override
    public String kind() {
        return "ConnectionError";
    }
}
