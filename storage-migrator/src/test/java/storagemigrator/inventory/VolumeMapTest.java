package storagemigrator.inventory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VolumeMap")
class VolumeMapTest {

    private static final VolumeDescriptor VDA = VolumeDescriptor.FileBacked.ofFile("vda", Path.of("/images/a.qcow2"));
    private static final VolumeDescriptor VDB = new VolumeDescriptor.PoolBacked("vdb", "fast", "b");

    @Test
    @DisplayName("should keep insertion order")
    void shouldKeepOrder() {
        VolumeMap map = VolumeMap.of(VDB, VDA);

        assertThat(map.devices()).containsExactly("vdb", "vda");
        assertThat(map.descriptors()).containsExactly(VDB, VDA);
        assertThat(map.size()).isEqualTo(2);
        assertThat(map.contains("vda")).isTrue();
        assertThat(map.get("vdz")).isNull();
    }

    @Test
    @DisplayName("should reject duplicate target devices")
    void shouldRejectDuplicates() {
        VolumeDescriptor other = new VolumeDescriptor.PoolBacked("vda", "slow", "x");

        assertThatThrownBy(() -> VolumeMap.of(List.of(VDA, other)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("vda");
    }

    @Test
    @DisplayName("should compare equal only with the same order")
    void shouldCompareWithOrder() {
        assertThat(VolumeMap.of(VDA, VDB)).isEqualTo(VolumeMap.of(List.of(VDA, VDB)));
        assertThat(VolumeMap.of(VDA, VDB)).isNotEqualTo(VolumeMap.of(VDB, VDA));
        assertThat(VolumeMap.empty().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("should expose unmodifiable views")
    void shouldBeUnmodifiable() {
        VolumeMap map = VolumeMap.of(VDA);

        assertThatThrownBy(() -> map.devices().add("vdz")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> map.descriptors().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should split a file path into directory and name")
    void shouldSplitFilePath() {
        VolumeDescriptor.FileBacked file = VolumeDescriptor.FileBacked.ofFile("vda", Path.of("/var/images/web.qcow2"));

        assertThat(file.path()).isEqualTo(Path.of("/var/images"));
        assertThat(file.fileName()).isEqualTo("web.qcow2");
        assertThat(file.file()).isEqualTo(Path.of("/var/images/web.qcow2"));
        assertThatThrownBy(() -> VolumeDescriptor.FileBacked.ofFile("vda", Path.of("web.qcow2")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
