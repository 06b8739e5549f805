package orion.domain.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for StatusView labels and readiness
 * @author Orion team
 * @since 16/10/2026
 */
class StatusViewTest {

    private static final JobInfo JOB = new JobInfo("part.sl1", "/a/part.sl1", "Local");

    @Test
    @DisplayName("Transitional flags should win over the reported status")
    void transitionalFlagsShouldWin() {
        // Given
        DeviceSnapshot printing = DeviceSnapshot.builder(DeviceStatus.PRINTING).build();

        // When
        StatusView canceling = StatusView.builder().snapshot(printing).transitional(true, true).build();
        StatusView pausing = StatusView.builder().snapshot(printing).transitional(true, false).build();

        // Then
        assertThat(canceling.displayLabel()).isEqualTo("Canceling");
        assertThat(pausing.displayLabel()).isEqualTo("Pausing");
    }

    @Test
    @DisplayName("Should label finished and curing snapshots")
    void shouldLabelFinishedAndCuring() {
        // Given
        DeviceSnapshot finished = DeviceSnapshot.builder(DeviceStatus.IDLE).layer(100, 100).build();
        DeviceSnapshot curing = DeviceSnapshot.builder(DeviceStatus.PRINTING).curing(true).build();

        // Then
        assertThat(StatusView.builder().snapshot(finished).build().displayLabel()).isEqualTo("Finished");
        assertThat(StatusView.builder().snapshot(curing).build().displayLabel()).isEqualTo("Curing");
        assertThat(StatusView.builder().snapshot(DeviceSnapshot.builder(DeviceStatus.PAUSED).build()).build()
                .displayLabel()).isEqualTo("Paused");
    }

    @Test
    @DisplayName("New session should be ready only with active job and settled thumbnail")
    void readinessShouldRequireThumbnail() {
        // Given
        DeviceSnapshot printing = DeviceSnapshot.builder(DeviceStatus.PRINTING).job(JOB).build();

        // When
        StatusView resolving = StatusView.builder().snapshot(printing)
                .thumbnail(ThumbnailHandle.resolving(JOB.key())).build();
        StatusView settled = StatusView.builder().snapshot(printing)
                .thumbnail(ThumbnailHandle.ready(JOB.key(), null)).build();

        // Then
        assertThat(resolving.isNewSessionReady()).isFalse();
        assertThat(settled.isNewSessionReady()).isTrue();
        assertThat(settled.hasThumbnail()).isFalse();
    }

    @Test
    @DisplayName("Hinted job should be shown until the device reports one")
    void hintedJobShouldBeFallback() {
        // Given
        JobInfo hint = new JobInfo("next.sl1", "/a/next.sl1", null);

        // When
        StatusView waiting = StatusView.builder().hintedJob(hint).loading(true, false).build();

        // Then
        assertThat(waiting.getEffectiveJob()).isEqualTo(hint);
        assertThat(waiting.displayLabel()).isEqualTo("Loading");
    }
}
