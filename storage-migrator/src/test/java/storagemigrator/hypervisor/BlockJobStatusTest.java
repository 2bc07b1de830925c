package storagemigrator.hypervisor;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class BlockJobStatusTest {

    @Test
    void percentIsFloored() {
        assertThat(new BlockJobStatus(1, 3).percent()).isEqualTo(33);
        assertThat(new BlockJobStatus(999, 1000).percent()).isEqualTo(99);
        assertThat(new BlockJobStatus(0, 1000).percent()).isZero();
    }

    @Test
    void completeWhenCaughtUp() {
        assertThat(new BlockJobStatus(10, 10).isComplete()).isTrue();
        assertThat(new BlockJobStatus(11, 10).isComplete()).isTrue();
        assertThat(new BlockJobStatus(9, 10).isComplete()).isFalse();
        assertThat(new BlockJobStatus(11, 10).percent()).isEqualTo(100);
    }

    @Test
    void emptyJobIsComplete() {
        BlockJobStatus empty = new BlockJobStatus(0, 0);

        assertThat(empty.isComplete()).isTrue();
        assertThat(empty.percent()).isEqualTo(100);
    }

    @Test
    void absentJobIsComplete() {
        assertThat(BlockJobStatus.isComplete(Optional.empty())).isTrue();
        assertThat(BlockJobStatus.percentOf(Optional.empty())).isEqualTo(100);
        assertThat(BlockJobStatus.percentOf(Optional.of(new BlockJobStatus(42, 100)))).isEqualTo(42);
    }

    @Test
    void largeValuesDoNotOverflow() {
        long end = 2L * 1024 * 1024 * 1024 * 1024;

        assertThat(new BlockJobStatus(end / 2, end).percent()).isEqualTo(50);
    }
}
