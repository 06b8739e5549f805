package orion.domain.status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import orion.domain.api.IDeviceApi;
import orion.domain.api.IStatusStream;
import orion.domain.api.IStatusStreamListener;
import orion.domain.scheduling.IEngineScheduler;

import javax.inject.Inject;

/**
 * Push channel: keeps the status stream open and feeds every decoded event into the store.
 * Each subscription has a generation; callbacks of a torn down subscription are ignored.
 * Engine thread only.
 *
 * @author Orion team
 * @since 15/10/2026
 */
public class StreamSubscriber {
    private static final Logger logger = LoggerFactory.getLogger(StreamSubscriber.class);

    private final IDeviceApi deviceApi;
    private final IEngineScheduler scheduler;
    private final SnapshotCodec codec;
    private final StatusStore store;

    private IStatusStream stream;
    private long generation;
    private long eventsReceived;
    private volatile boolean disposed;

    @Inject
    public StreamSubscriber(IDeviceApi deviceApi, IEngineScheduler scheduler, SnapshotCodec codec, StatusStore store) {
        this.deviceApi = deviceApi;
        this.scheduler = scheduler;
        this.codec = codec;
        this.store = store;
    }

    /**
     * Open a new subscription, replacing any current one
     */
    public void subscribe(IStreamStateListener listener) {
        if (disposed) {
            return;
        }
        teardown();
        final long subscription = ++generation;
        eventsReceived = 0;
        logger.debug("Opening status stream (subscription {})", subscription);

        try {
            stream = deviceApi.openStatusStream(new IStatusStreamListener() {
                @Override
                public void onOpen() {
                    onEngineThread(subscription, () -> {
                        logger.info("Status stream connected");
                        listener.onStreamOpened();
                    });
                }

                @Override
                public void onPayload(String payload) {
                    onEngineThread(subscription, () -> handlePayload(payload));
                }

                @Override
                public void onFailure(Throwable cause) {
                    onEngineThread(subscription, () -> {
                        logger.warn("Status stream failed: {}", cause != null ? cause.getMessage() : "unknown error");
                        teardown();
                        listener.onStreamLost(cause);
                    });
                }

                @Override
                public void onClosed() {
                    onEngineThread(subscription, () -> {
                        logger.warn("Status stream closed by server after {} events", eventsReceived);
                        teardown();
                        listener.onStreamLost(null);
                    });
                }
            });
        } catch (RuntimeException e) {
            logger.warn("Could not open status stream: {}", e.getMessage());
            stream = null;
            scheduler.execute(() -> {
                if (!disposed && generation == subscription) {
                    teardown();
                    listener.onStreamLost(e);
                }
            });
        }
    }

    private void onEngineThread(long subscription, Runnable action) {
        if (disposed) {
            return;
        }
        scheduler.execute(() -> {
            if (disposed || generation != subscription) {
                logger.trace("Ignoring callback of stale subscription {}", subscription);
                return;
            }
            action.run();
        });
    }

    private void handlePayload(String payload) {
        eventsReceived++;
        DeviceSnapshot snapshot;
        try {
            snapshot = codec.decode(payload);
        } catch (SnapshotParseException e) {
            logger.warn("Skipping undecodable stream event: {}", e.getMessage());
            return;
        }
        store.reconcile(snapshot, SnapshotSource.STREAM);
    }

    /**
     * Close the current subscription; its late callbacks are dropped
     */
    public void unsubscribe() {
        teardown();
    }

    private void teardown() {
        generation++;
        if (stream != null) {
            IStatusStream closing = stream;
            stream = null;
            try {
                closing.close();
            } catch (RuntimeException e) {
                logger.debug("Error closing status stream: {}", e.getMessage());
            }
        }
    }

    public boolean isSubscribed() {
        return stream != null;
    }

    public void dispose() {
        disposed = true;
        teardown();
    }
}
