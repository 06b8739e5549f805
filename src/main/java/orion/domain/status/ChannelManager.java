package orion.domain.status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import orion.dal.BackendConfig;
import orion.dal.SyncConfig;
import orion.domain.EngineEventBus;
import orion.domain.scheduling.IEngineScheduler;
import orion.domain.scheduling.ScheduledTask;

import javax.inject.Inject;
import java.util.Random;

/**
 * Selects and maintains the channel that drives status updates.
 * <pre>
 * Init -> PollingOnly                      (backend cannot stream)
 * Init -> AttemptStream -> Streaming       (subscription opened, polling stopped)
 * Streaming / AttemptStream -> Polling     (error or server close, reconnect after base + jitter)
 * Polling -> Streaming                     (a reconnect attempt succeeded)
 * </pre>
 * At most one of {@link PollLoop} and {@link StreamSubscriber} drives updates at any time.
 *
 * @author Orion team
 * @since 15/10/2026
 */
public class ChannelManager implements IStreamStateListener {
    private static final Logger logger = LoggerFactory.getLogger(ChannelManager.class);

    private final BackendConfig backendConfig;
    private final SyncConfig syncConfig;
    private final PollLoop pollLoop;
    private final StreamSubscriber streamSubscriber;
    private final StatusStore store;
    private final IEngineScheduler scheduler;
    private final EngineEventBus eventBus;
    private final Random random;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean disposed;
    private ScheduledTask reconnectTimer;
    private Long nextStreamRetryAtMs;
    private boolean started;
    private boolean suspended;
    private boolean attempting;
    private int failedAttempts;

    @Inject
    public ChannelManager(BackendConfig backendConfig,
                          SyncConfig syncConfig,
                          PollLoop pollLoop,
                          StreamSubscriber streamSubscriber,
                          StatusStore store,
                          IEngineScheduler scheduler,
                          EngineEventBus eventBus,
                          Random random) {
        this.backendConfig = backendConfig;
        this.syncConfig = syncConfig;
        this.pollLoop = pollLoop;
        this.streamSubscriber = streamSubscriber;
        this.store = store;
        this.scheduler = scheduler;
        this.eventBus = eventBus;
        this.random = random;
        this.pollLoop.setStreamingActive(() -> state == ConnectionState.STREAMING);
    }

    public void start() {
        scheduler.execute(() -> {
            if (disposed || started) {
                return;
            }
            started = true;
            selectChannel();
        });
    }

    /**
     * Stop every channel during an expected outage, e.g. while the device installs an update
     */
    public void suspend() {
        scheduler.execute(() -> {
            if (disposed || suspended) {
                return;
            }
            suspended = true;
            logger.info("Suspending status channels");
            cancelReconnect();
            attempting = false;
            streamSubscriber.unsubscribe();
            pollLoop.stop();
            transition(ConnectionState.DISCONNECTED);
        });
    }

    public void resume() {
        scheduler.execute(() -> {
            if (disposed || !suspended) {
                return;
            }
            suspended = false;
            logger.info("Resuming status channels");
            if (started) {
                selectChannel();
            }
        });
    }

    private void selectChannel() {
        if (!backendConfig.supportsStreaming()) {
            logger.info("{} backend does not stream, polling only", backendConfig.backendType());
            transition(ConnectionState.POLLING);
            pollLoop.start();
            return;
        }
        attemptStream();
    }

    private void attemptStream() {
        attempting = true;
        logger.debug("Attempting status stream (state={})", state);
        streamSubscriber.subscribe(this);
    }

    @Override
    public void onStreamOpened() {
        if (disposed || suspended) {
            streamSubscriber.unsubscribe();
            return;
        }
        attempting = false;
        failedAttempts = 0;
        cancelReconnect();
        pollLoop.stop();
        transition(ConnectionState.STREAMING);
    }

    @Override
    public void onStreamLost(Throwable cause) {
        attempting = false;
        if (disposed || suspended) {
            return;
        }
        failedAttempts++;
        if (state == ConnectionState.STREAMING) {
            logger.warn("Status stream lost ({}), falling back to polling",
                    cause != null ? cause.getMessage() : "closed by server");
        } else {
            logger.debug("Stream attempt {} failed: {}", failedAttempts, cause != null ? cause.getMessage() : "closed");
        }
        scheduleReconnect();
        transition(ConnectionState.POLLING);
        pollLoop.start();
    }

    private void scheduleReconnect() {
        cancelReconnect();
        long jitter = syncConfig.reconnectJitterMs() > 0
                ? random.nextInt((int) Math.min(Integer.MAX_VALUE - 1, syncConfig.reconnectJitterMs()) + 1)
                : 0;
        long delay = syncConfig.reconnectBaseMs() + jitter;
        nextStreamRetryAtMs = scheduler.nowMillis() + delay;
        reconnectTimer = scheduler.schedule(this::reconnect, delay);
        logger.info("Stream reconnect scheduled in {}ms", delay);
    }

    private void reconnect() {
        reconnectTimer = null;
        nextStreamRetryAtMs = null;
        if (disposed || suspended || state == ConnectionState.STREAMING || attempting) {
            return;
        }
        attemptStream();
    }

    private void cancelReconnect() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
        nextStreamRetryAtMs = null;
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state;
        if (previous != next) {
            state = next;
            logger.debug("Channel {} -> {}", previous, next);
            eventBus.post(new ConnectionStateEvent(previous, next, nextStreamRetryAtMs, scheduler.nowMillis()));
        }
        store.updateChannelState(next, nextStreamRetryAtMs);
    }

    public ConnectionState getState() {
        return state;
    }

    /**
     * Engine time of the next stream attempt, null when none is pending
     */
    public Long getNextStreamRetryAtMs() {
        return nextStreamRetryAtMs;
    }

    public boolean isSuspended() {
        return suspended;
    }

    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        cancelReconnect();
        streamSubscriber.dispose();
        pollLoop.dispose();
        logger.debug("Channel manager disposed");
    }
}
