package orion.domain.status;

import io.reactivex.rxjava3.disposables.Disposable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import orion.common.SyncConstants;
import orion.domain.api.IDeviceApi;
import orion.domain.scheduling.IEngineScheduler;

import javax.inject.Inject;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the live status synchronization engine.
 * Owns the store and the channel manager; every method may be called from any thread.
 *
 * @author Orion team
 * @since 16/10/2026
 */
public class StatusEngine {
    private static final Logger logger = LoggerFactory.getLogger(StatusEngine.class);

    private final StatusStore store;
    private final ChannelManager channelManager;
    private final IEngineScheduler scheduler;
    private final IDeviceApi deviceApi;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    @Inject
    public StatusEngine(StatusStore store, ChannelManager channelManager, IEngineScheduler scheduler, IDeviceApi deviceApi) {
        this.store = store;
        this.channelManager = channelManager;
        this.scheduler = scheduler;
        this.deviceApi = deviceApi;
    }

    public void start() {
        if (disposed.get() || !started.compareAndSet(false, true)) {
            logger.warn("Status engine already started or disposed");
            return;
        }
        logger.info("Starting status engine");
        channelManager.start();
    }

    public void suspend() {
        channelManager.suspend();
    }

    public void resume() {
        channelManager.resume();
    }

    public CompletableFuture<RefreshOutcome> refresh() {
        if (disposed.get()) {
            return CompletableFuture.completedFuture(RefreshOutcome.SKIPPED);
        }
        return store.refresh();
    }

    /**
     * Completes false after dispose, the engine thread is gone by then
     */
    public CompletableFuture<Boolean> pauseOrResume() {
        if (disposed.get()) {
            return CompletableFuture.completedFuture(false);
        }
        return store.pauseOrResume();
    }

    public CompletableFuture<Boolean> cancel() {
        if (disposed.get()) {
            return CompletableFuture.completedFuture(false);
        }
        return store.cancel();
    }

    public void resetForNewSession(SessionHints hints) {
        if (disposed.get()) {
            return;
        }
        store.resetForNewSession(hints);
    }

    public void clearError() {
        store.clearError();
    }

    public Disposable subscribe(IStatusObserver observer) {
        return store.subscribe(observer);
    }

    public StatusView getView() {
        return store.getView();
    }

    public ConnectionState getConnectionState() {
        return channelManager.getState();
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    /**
     * Cancel all timers, close the stream and stop the engine thread. Late callbacks are ignored.
     * The teardown itself runs on the engine thread; callers on other threads wait for it.
     */
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Disposing status engine");

        if (scheduler.isEngineThread()) {
            teardown();
        } else {
            CountDownLatch done = new CountDownLatch(1);
            scheduler.execute(() -> {
                try {
                    teardown();
                } finally {
                    done.countDown();
                }
            });
            awaitTeardown(done);
        }
        deviceApi.close();
        scheduler.shutdown();
    }

    private void teardown() {
        channelManager.dispose();
        store.dispose();
    }

    private void awaitTeardown(CountDownLatch done) {
        try {
            if (!done.await(SyncConstants.DISPOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                logger.warn("Engine thread did not finish teardown within {}ms", SyncConstants.DISPOSE_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for engine teardown");
        }
    }
}
