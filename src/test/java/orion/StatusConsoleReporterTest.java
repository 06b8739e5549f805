package orion;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import orion.dal.SyncConfig;
import orion.domain.api.FakeDeviceApi;
import orion.domain.scheduling.ManualEngineScheduler;
import orion.domain.status.DeviceSnapshot;
import orion.domain.status.DeviceStatus;
import orion.domain.status.JobInfo;
import orion.domain.status.SessionHints;
import orion.domain.status.SnapshotCodec;
import orion.domain.status.SnapshotSource;
import orion.domain.status.StatusStore;
import orion.domain.status.ThumbnailResolver;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the one-line status description
 * @author Orion team
 * @since 17/10/2026
 */
class StatusConsoleReporterTest {

    private StatusStore store;

    @BeforeEach
    void setUp() {
        ManualEngineScheduler scheduler = new ManualEngineScheduler(0);
        FakeDeviceApi api = new FakeDeviceApi();
        SyncConfig syncConfig = SyncConfig.defaults();
        store = new StatusStore(api, scheduler, new SnapshotCodec(),
                new ThumbnailResolver(api, scheduler, syncConfig), syncConfig);
    }

    @Test
    @DisplayName("Printing job should show progress, layers, elapsed time and job name")
    void printingJobShouldBeDescribed() {
        // Given
        DeviceSnapshot snapshot = DeviceSnapshot.builder(DeviceStatus.PRINTING)
                .layer(25, 100)
                .progress(0.25)
                .elapsedSeconds(3725)
                .job(new JobInfo("part.sl1", "/a/part.sl1", "Local"))
                .build();

        // When
        store.applySnapshot(snapshot, SnapshotSource.STREAM);
        String line = StatusConsoleReporter.describe(store.getView());

        // Then
        assertThat(line).isEqualTo("[STREAMING] Printing 25.0% layer 25/100 elapsed 01:02:05 job=part.sl1");
    }

    @Test
    @DisplayName("Session reset should show the hinted job while waiting")
    void sessionResetShouldShowHintedJob() {
        // When
        store.resetForNewSession(SessionHints.of(new JobInfo("next.sl1", "/next.sl1", null), null));
        String line = StatusConsoleReporter.describe(store.getView());

        // Then
        assertThat(line).startsWith("[DISCONNECTED] Loading");
        assertThat(line).contains("job=next.sl1").endsWith("(waiting for new session)");
    }
}
