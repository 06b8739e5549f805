package orion.domain.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import orion.common.EBackendType;
import orion.dal.BackendConfig;
import orion.dal.SyncConfig;
import orion.domain.EngineEventBus;
import orion.domain.api.DeviceApiException;
import orion.domain.api.FakeDeviceApi;
import orion.domain.scheduling.ManualEngineScheduler;

import java.io.IOException;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

/**
 * Tests for ChannelManager channel selection, fallback and reconnect
 * @author Orion team
 * @since 16/10/2026
 */
@ExtendWith(MockitoExtension.class)
class ChannelManagerTest {

    private static final String API_URL = "http://printer.local:12357";

    @Mock
    private EngineEventBus mockEventBus;

    private ManualEngineScheduler scheduler;
    private FakeDeviceApi api;
    private StatusStore store;
    private PollLoop pollLoop;
    private ChannelManager channelManager;

    private void create(BackendConfig backendConfig, Random random) {
        scheduler = new ManualEngineScheduler(5_000_000);
        api = new FakeDeviceApi();
        SnapshotCodec codec = new SnapshotCodec();
        SyncConfig syncConfig = SyncConfig.defaults();
        store = new StatusStore(api, scheduler, codec, new ThumbnailResolver(api, scheduler, syncConfig), syncConfig);
        pollLoop = new PollLoop(store, scheduler, syncConfig);
        StreamSubscriber subscriber = new StreamSubscriber(api, scheduler, codec, store);
        channelManager = new ChannelManager(backendConfig, syncConfig, pollLoop, subscriber, store, scheduler,
                mockEventBus, random);
    }

    private void createStreaming() {
        create(BackendConfig.odyssey(API_URL), new Random(42));
    }

    private long reconnectDelay() {
        return channelManager.getNextStreamRetryAtMs() - scheduler.nowMillis();
    }

    @Test
    @DisplayName("Polling-only backend should never attempt streaming")
    void pollingOnlyBackendShouldNeverStream() {
        // Given
        create(BackendConfig.nanoDlp(API_URL), new Random(1));

        // When
        channelManager.start();
        scheduler.advance(60_000);

        // Then
        assertThat(channelManager.getState()).isEqualTo(ConnectionState.POLLING);
        assertThat(api.getStreams()).isEmpty();
        assertThat(pollLoop.isRunning()).isTrue();
        assertThat(api.statusFetchCount()).isEqualTo(1);

        ArgumentCaptor<ConnectionStateEvent> captor = ArgumentCaptor.forClass(ConnectionStateEvent.class);
        verify(mockEventBus).post(captor.capture());
        assertThat(captor.getValue().getPrevious()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(captor.getValue().getCurrent()).isEqualTo(ConnectionState.POLLING);
    }

    @Test
    @DisplayName("Disabled streaming should behave as polling-only")
    void disabledStreamingShouldPoll() {
        // Given
        create(new BackendConfig(API_URL, EBackendType.ODYSSEY, 5_000, false), new Random(1));

        // When
        channelManager.start();

        // Then
        assertThat(channelManager.getState()).isEqualTo(ConnectionState.POLLING);
        assertThat(api.getStreams()).isEmpty();
    }

    @Test
    @DisplayName("Opened stream should become the only channel")
    void openedStreamShouldBeOnlyChannel() {
        // Given
        createStreaming();
        channelManager.start();

        // When
        api.lastStream().open();

        // Then
        assertThat(channelManager.getState()).isEqualTo(ConnectionState.STREAMING);
        assertThat(store.getView().getConnectionState()).isEqualTo(ConnectionState.STREAMING);
        assertThat(pollLoop.isRunning()).isFalse();
        assertThat(api.statusFetchCount()).isZero();
    }

    @Test
    @DisplayName("Stream error should fall back to polling at once and reconnect within 3 to 5 seconds")
    void streamErrorShouldFallBackAndReconnect() {
        // Given
        createStreaming();
        channelManager.start();
        api.lastStream().open();

        // When
        api.lastStream().fail(new IOException("connection reset"));

        // Then
        assertThat(channelManager.getState()).isEqualTo(ConnectionState.POLLING);
        assertThat(pollLoop.isRunning()).isTrue();
        assertThat(api.statusFetchCount()).isEqualTo(1);
        long delay = reconnectDelay();
        assertThat(delay).isBetween(3_000L, 5_000L);
        assertThat(store.getView().getNextStreamRetryAtMs()).isEqualTo(channelManager.getNextStreamRetryAtMs());

        // When
        scheduler.advance(delay - 1);

        // Then
        assertThat(api.getStreams()).hasSize(1);

        // When
        scheduler.advance(1);
        api.lastStream().open();

        // Then
        assertThat(api.getStreams()).hasSize(2);
        assertThat(channelManager.getState()).isEqualTo(ConnectionState.STREAMING);
        assertThat(pollLoop.isRunning()).isFalse();
        assertThat(channelManager.getNextStreamRetryAtMs()).isNull();
    }

    @Test
    @DisplayName("Server close should be handled like a stream error")
    void serverCloseShouldFallBack() {
        // Given
        createStreaming();
        channelManager.start();
        api.lastStream().open();

        // When
        api.lastStream().serverClose();

        // Then
        assertThat(channelManager.getState()).isEqualTo(ConnectionState.POLLING);
        assertThat(reconnectDelay()).isBetween(3_000L, 5_000L);
    }

    @Test
    @DisplayName("Failed initial attempt should poll and keep retrying the stream")
    void failedInitialAttemptShouldRetry() {
        // Given
        createStreaming();
        channelManager.start();

        // When
        api.lastStream().fail(new DeviceApiException("Status stream returned HTTP 404", 404));

        // Then
        assertThat(channelManager.getState()).isEqualTo(ConnectionState.POLLING);
        assertThat(pollLoop.isRunning()).isTrue();

        // When - every retry fails again
        for (int attempt = 2; attempt <= 4; attempt++) {
            scheduler.advance(reconnectDelay());
            assertThat(api.getStreams()).hasSize(attempt);
            api.lastStream().fail(new IOException("refused"));
            assertThat(reconnectDelay()).isBetween(3_000L, 5_000L);
        }

        // Then
        assertThat(channelManager.getState()).isEqualTo(ConnectionState.POLLING);
        verify(mockEventBus, atLeastOnce()).post(any(ConnectionStateEvent.class));
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 2026L, 99_991L})
    @DisplayName("Reconnect delay should stay within base plus jitter for any random source")
    void reconnectDelayShouldStayInRange(long seed) {
        // Given
        create(BackendConfig.odyssey(API_URL), new Random(seed));
        channelManager.start();

        for (int i = 0; i < 50; i++) {
            // When
            api.lastStream().fail(new IOException("refused"));

            // Then
            assertThat(reconnectDelay()).isBetween(3_000L, 5_000L);
            scheduler.advance(reconnectDelay());
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {3L, 11L, 1234L})
    @DisplayName("Streaming and polling should never be active together for arbitrary event sequences")
    void streamingAndPollingShouldBeExclusive(long seed) {
        // Given
        createStreaming();
        Random events = new Random(seed);
        channelManager.start();

        for (int step = 0; step < 400; step++) {
            // When
            switch (events.nextInt(7)) {
                case 0 -> api.lastStream().open();
                case 1 -> api.lastStream().fail(new IOException("reset"));
                case 2 -> api.lastStream().serverClose();
                case 3 -> api.lastStream().emit(StatusPayloads.printing(step % 100));
                case 4 -> {
                    if (api.pendingStatusFetches() > 0) {
                        api.respondStatus(StatusPayloads.printing(step % 100));
                    }
                }
                case 5 -> {
                    if (api.pendingStatusFetches() > 0) {
                        api.failStatus(new IOException("timeout"));
                    }
                }
                default -> scheduler.advance(events.nextInt(6_000));
            }

            // Then
            ConnectionState state = channelManager.getState();
            if (state == ConnectionState.STREAMING) {
                assertThat(pollLoop.isRunning()).as("poll loop while streaming at step %d", step).isFalse();
                assertThat(channelManager.getNextStreamRetryAtMs()).isNull();
            }
            if (state == ConnectionState.POLLING) {
                assertThat(pollLoop.isRunning()).as("poll loop while polling at step %d", step).isTrue();
            }
        }
    }

    @Test
    @DisplayName("Suspend should stop every channel and resume should select again")
    void suspendAndResume() {
        // Given
        createStreaming();
        channelManager.start();
        api.lastStream().open();

        // When
        channelManager.suspend();

        // Then
        assertThat(channelManager.getState()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(channelManager.isSuspended()).isTrue();
        assertThat(api.lastStream().isClosed()).isTrue();
        assertThat(pollLoop.isRunning()).isFalse();

        // When
        scheduler.advance(30_000);
        channelManager.resume();
        api.lastStream().open();

        // Then
        assertThat(api.getStreams()).hasSize(2);
        assertThat(channelManager.getState()).isEqualTo(ConnectionState.STREAMING);
    }

    @Test
    @DisplayName("Dispose should cancel the reconnect timer and stop polling")
    void disposeShouldCancelTimers() {
        // Given
        createStreaming();
        channelManager.start();
        api.lastStream().fail(new IOException("refused"));

        // When
        channelManager.dispose();
        scheduler.advance(20_000);

        // Then
        assertThat(api.getStreams()).hasSize(1);
        assertThat(pollLoop.isRunning()).isFalse();
        assertThat(channelManager.getNextStreamRetryAtMs()).isNull();
    }
}
