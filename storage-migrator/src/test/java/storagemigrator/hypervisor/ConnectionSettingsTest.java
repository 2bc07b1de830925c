package storagemigrator.hypervisor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConnectionSettings")
class ConnectionSettingsTest {

    @Test
    @DisplayName("should default to the local system session")
    void shouldDefaultToLocalSystem() {
        assertThat(ConnectionSettings.LOCAL.toUri()).isEqualTo("qemu:///system");
    }

    @Test
    @DisplayName("should build an ssh URI with user")
    void shouldBuildSshUri() {
        ConnectionSettings settings = ConnectionSettings.LOCAL
                .withHost("kvm1.example.org")
                .withUser("ops")
                .withSsh(true);

        assertThat(settings.toUri()).isEqualTo("qemu+ssh://ops@kvm1.example.org/system");
    }

    @Test
    @DisplayName("should build a plain remote URI for another session")
    void shouldBuildRemoteSessionUri() {
        ConnectionSettings settings = new ConnectionSettings("kvm1", null, false, "session");

        assertThat(settings.toUri()).isEqualTo("qemu://kvm1/session");
    }

    @Test
    @DisplayName("should normalize blank values")
    void shouldNormalizeBlanks() {
        ConnectionSettings settings = new ConnectionSettings(null, " ", false, "");

        assertThat(settings.host()).isEmpty();
        assertThat(settings.user()).isNull();
        assertThat(settings.session()).isEqualTo(ConnectionSettings.DEFAULT_SESSION);
        assertThat(settings).isEqualTo(ConnectionSettings.LOCAL);
    }
}
