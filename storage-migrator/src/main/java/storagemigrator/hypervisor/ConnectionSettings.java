package storagemigrator.hypervisor;

/**
 * Where and how to reach the hypervisor.
 *
 * <p>Rendered as a libvirt QEMU URI by {@link #toUri()}:
 * {@code qemu[+ssh]://[user@]host/session}. An empty host means the local daemon.
 *
 * @param host the hypervisor host, empty for local
 * @param user the remote user, or null to let the transport decide
 * @param ssh whether to tunnel the connection over SSH
 * @param session the libvirt session, usually {@code system} or {@code session}
 */
public record ConnectionSettings(String host, String user, boolean ssh, String session) {

    public static final String DEFAULT_SESSION = "system";

    /** Local system connection: {@code qemu:///system}. */
    public static final ConnectionSettings LOCAL = new ConnectionSettings("", null, false, DEFAULT_SESSION);

    public ConnectionSettings {
        host = host == null ? "" : host.trim();
        user = user == null || user.isBlank() ? null : user.trim();
        session = session == null || session.isBlank() ? DEFAULT_SESSION : session.trim();
    }

    /**
     * Builds the libvirt connection URI for these settings.
     *
     * @return the connection URI
     */
    public String toUri() {
        StringBuilder uri = new StringBuilder("qemu");
        if (ssh) {
            uri.append("+ssh");
        }
        uri.append("://");
        if (user != null) {
            uri.append(user).append('@');
        }
        uri.append(host).append('/').append(session);
        return uri.toString();
    }

    public ConnectionSettings withHost(String host) {
        return new ConnectionSettings(host, user, ssh, session);
    }

    public ConnectionSettings withUser(String user) {
        return new ConnectionSettings(host, user, ssh, session);
    }

    public ConnectionSettings withSsh(boolean ssh) {
        return new ConnectionSettings(host, user, ssh, session);
    }

    public ConnectionSettings withSession(String session) {
        return new ConnectionSettings(host, user, ssh, session);
    }
}
