package orion.domain.status;

import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.subjects.PublishSubject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import orion.dal.SyncConfig;
import orion.domain.api.IDeviceApi;
import orion.domain.scheduling.IEngineScheduler;
import orion.domain.scheduling.ScheduledTask;

import javax.inject.Inject;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Single point of truth for the printer job state.
 * Merges snapshots from either channel with the transitional intents and the readiness barrier,
 * then publishes an immutable {@link StatusView}.
 * <p>
 * All state is owned by the engine thread. Public entry points hop onto it; methods documented
 * as engine thread only are called by the channel components that already run there.
 *
 * @author Orion team
 * @since 15/10/2026
 */
public class StatusStore {
    private static final Logger logger = LoggerFactory.getLogger(StatusStore.class);

    private final IDeviceApi deviceApi;
    private final IEngineScheduler scheduler;
    private final SnapshotCodec codec;
    private final ThumbnailResolver thumbnailResolver;
    private final SyncConfig syncConfig;

    private final PublishSubject<StatusView> viewSubject;
    private final TransitionalIntent intent = new TransitionalIntent();

    private volatile StatusView currentView;
    private volatile boolean disposed;

    private DeviceSnapshot snapshot;
    private ConnectionState connectionState = ConnectionState.DISCONNECTED;
    private AwaitingSession awaitingSession;
    private ScheduledTask awaitingTimer;
    private long minSpinnerUntilMs;
    private ScheduledTask spinnerTimer;
    private JobInfo hintedJob;
    private String lastError;
    private boolean loading = true;
    private boolean initialAttemptInProgress = true;
    private boolean everConnected;
    private int consecutivePollErrors;
    private Long nextPollRetryAtMs;
    private Long nextStreamRetryAtMs;
    private boolean fetchInFlight;

    @Inject
    public StatusStore(IDeviceApi deviceApi,
                       IEngineScheduler scheduler,
                       SnapshotCodec codec,
                       ThumbnailResolver thumbnailResolver,
                       SyncConfig syncConfig) {
        this.deviceApi = deviceApi;
        this.scheduler = scheduler;
        this.codec = codec;
        this.thumbnailResolver = thumbnailResolver;
        this.syncConfig = syncConfig;
        this.viewSubject = PublishSubject.create();
        this.thumbnailResolver.setResolvedListener(this::onThumbnailResolved);
        this.currentView = buildView();
    }

    /**
     * Register an observer; it is called synchronously on the engine thread after every reconciliation.
     * The current state is available through {@link #getView()}.
     * @return token that unsubscribes the observer when disposed
     */
    public Disposable subscribe(IStatusObserver observer) {
        return viewSubject.subscribe(view -> {
            try {
                observer.onUpdate(view);
            } catch (Exception e) {
                logger.error("Status observer {} failed", observer, e);
            }
        });
    }

    public StatusView getView() {
        return currentView;
    }

    // ===== Reconciliation =====

    /**
     * Merge a snapshot received outside the engine's own channels
     */
    public void applySnapshot(DeviceSnapshot incoming, SnapshotSource source) {
        scheduler.execute(() -> reconcile(incoming, source));
    }

    /**
     * Engine thread only
     */
    void reconcile(DeviceSnapshot incoming, SnapshotSource source) {
        if (disposed) {
            return;
        }
        if (intent.merge(incoming)) {
            logger.debug("Transitional flags now {}", intent);
        }

        checkAwaitingSession(incoming);

        if (incoming.isPrinting() && incoming.hasJob()) {
            thumbnailResolver.resolve(incoming.getJob());
        }

        this.snapshot = incoming;
        this.everConnected = true;
        this.loading = false;
        this.lastError = null;
        ConnectionState fromSource = source.toConnectionState();
        if (!(source == SnapshotSource.POLL && connectionState == ConnectionState.STREAMING)) {
            this.connectionState = fromSource;
        }
        logger.trace("Applied {} snapshot {}", source, incoming);
        publish();
    }

    private void checkAwaitingSession(DeviceSnapshot latest) {
        if (awaitingSession == null) {
            return;
        }
        AwaitingSession.EResolution resolution =
                awaitingSession.evaluate(latest, thumbnailResolver.getHandle().isReady(), scheduler.nowMillis());
        if (resolution != null) {
            logger.info("New session barrier resolved: {}", resolution);
            clearAwaitingSession();
        }
    }

    private void clearAwaitingSession() {
        awaitingSession = null;
        if (awaitingTimer != null) {
            awaitingTimer.cancel();
            awaitingTimer = null;
        }
    }

    private void onThumbnailResolved(ThumbnailHandle handle) {
        if (disposed) {
            return;
        }
        logger.debug("Thumbnail settled: {}", handle);
        checkAwaitingSession(snapshot);
        publish();
    }

    private void onAwaitingTimeout() {
        if (disposed || awaitingSession == null) {
            return;
        }
        awaitingTimer = null;
        if (awaitingSession.isTimedOut(scheduler.nowMillis())) {
            logger.warn("No coherent session data within {}ms, releasing barrier", syncConfig.awaitingTimeoutMs());
            clearAwaitingSession();
            publish();
        }
    }

    // ===== Refresh =====

    /**
     * Fetch the status once. A call made while a fetch is outstanding is dropped.
     */
    public CompletableFuture<RefreshOutcome> refresh() {
        CompletableFuture<RefreshOutcome> outcome = new CompletableFuture<>();
        scheduler.execute(() -> startFetch(outcome));
        return outcome;
    }

    private void startFetch(CompletableFuture<RefreshOutcome> outcome) {
        if (disposed || fetchInFlight) {
            logger.trace("Refresh dropped (disposed={}, inFlight={})", disposed, fetchInFlight);
            outcome.complete(RefreshOutcome.SKIPPED);
            return;
        }
        fetchInFlight = true;
        long startedAt = scheduler.nowMillis();

        deviceApi.fetchStatus().whenComplete((body, error) -> {
            if (disposed) {
                outcome.complete(RefreshOutcome.SKIPPED);
                return;
            }
            scheduler.execute(() -> outcome.complete(onFetched(body, error, startedAt)));
        });
    }

    private RefreshOutcome onFetched(String body, Throwable error, long startedAt) {
        fetchInFlight = false;
        if (disposed) {
            return RefreshOutcome.SKIPPED;
        }
        initialAttemptInProgress = false;

        if (error != null) {
            onFetchFailed("Status refresh failed: " + unwrap(error).getMessage(), startedAt);
            return RefreshOutcome.FAILED;
        }
        DeviceSnapshot parsed;
        try {
            parsed = codec.decode(body);
        } catch (SnapshotParseException e) {
            // The device is reachable; only this update is lost
            logger.warn("Dropping undecodable status payload: {}", e.getMessage());
            return RefreshOutcome.DISCARDED;
        }

        consecutivePollErrors = 0;
        nextPollRetryAtMs = null;
        reconcile(parsed, SnapshotSource.POLL);
        return RefreshOutcome.APPLIED;
    }

    private void onFetchFailed(String message, long startedAt) {
        consecutivePollErrors++;
        lastError = message;
        loading = false;
        nextPollRetryAtMs = scheduler.nowMillis() + syncConfig.maxPollIntervalMs();
        if (connectionState != ConnectionState.STREAMING) {
            connectionState = ConnectionState.DISCONNECTED;
        }
        logger.warn("{} after {}ms (attempt {})", message, scheduler.nowMillis() - startedAt, consecutivePollErrors);
        publish();
    }

    // ===== Commands =====

    /**
     * Resume when the device reports PAUSED, pause otherwise.
     * Completes false without issuing a command when no snapshot is known or a pause/resume is already in transition.
     */
    public CompletableFuture<Boolean> pauseOrResume() {
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        scheduler.execute(() -> {
            if (disposed || snapshot == null || intent.isPausing()) {
                logger.debug("Pause/resume ignored (snapshot={}, pausing={})", snapshot != null, intent.isPausing());
                result.complete(false);
                return;
            }
            TransitionalIntent.EPauseTarget target = snapshot.isPaused()
                    ? TransitionalIntent.EPauseTarget.RESUME
                    : TransitionalIntent.EPauseTarget.PAUSE;
            intent.beginPause(target);
            publish();
            logger.info("Sending {} command", target);

            CompletableFuture<Void> command = target == TransitionalIntent.EPauseTarget.RESUME
                    ? deviceApi.resume()
                    : deviceApi.pause();
            command.whenComplete((ignored, error) -> afterCommand(result, error, () -> {
                logger.error("{} command failed", target, unwrap(error));
                if (intent.getPauseTarget() == target) {
                    intent.revertPause();
                }
            }));
        });
        return result;
    }

    /**
     * Cancel the job. The canceling flag stays set on failure and is only cleared by the device.
     * Completes false without a command while a cancel is already in transition.
     */
    public CompletableFuture<Boolean> cancel() {
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        scheduler.execute(() -> {
            if (disposed || intent.isCanceling()) {
                logger.debug("Cancel ignored (canceling={})", intent.isCanceling());
                result.complete(false);
                return;
            }
            intent.beginCancel();
            publish();
            logger.info("Sending CANCEL command");
            deviceApi.cancel().whenComplete((ignored, error) -> afterCommand(result, error,
                    () -> logger.error("CANCEL command failed, still waiting for the device", unwrap(error))));
        });
        return result;
    }

    private void afterCommand(CompletableFuture<Boolean> result, Throwable error, Runnable onFailure) {
        if (disposed) {
            result.complete(false);
            return;
        }
        scheduler.execute(() -> {
            try {
                if (error != null && !disposed) {
                    onFailure.run();
                    publish();
                }
            } finally {
                result.complete(error == null);
                refresh();
            }
        });
    }

    // ===== Session =====

    /**
     * Forget the current job and wait for the next one. Hints are shown until fresh data arrives.
     */
    public void resetForNewSession(SessionHints hints) {
        SessionHints effective = hints != null ? hints : SessionHints.NONE;
        scheduler.execute(() -> {
            if (disposed) {
                return;
            }
            long now = scheduler.nowMillis();
            snapshot = null;
            intent.clear();
            lastError = null;
            loading = true;
            hintedJob = effective.job();
            thumbnailResolver.reset(effective.thumbnail(), effective.job());

            clearAwaitingSession();
            awaitingSession = new AwaitingSession(now, syncConfig.awaitingTimeoutMs());
            awaitingTimer = scheduler.schedule(this::onAwaitingTimeout, syncConfig.awaitingTimeoutMs());

            if (spinnerTimer != null) {
                spinnerTimer.cancel();
            }
            minSpinnerUntilMs = now + syncConfig.minSpinnerMs();
            spinnerTimer = scheduler.schedule(this::onSpinnerElapsed, syncConfig.minSpinnerMs());

            logger.info("Session reset (hinted job={}, thumbnail hint={})",
                    hintedJob != null ? hintedJob.name() : null, effective.hasThumbnail());
            publish();
            refresh();
        });
    }

    private void onSpinnerElapsed() {
        spinnerTimer = null;
        if (!disposed) {
            publish();
        }
    }

    public void clearError() {
        scheduler.execute(() -> {
            if (!disposed && lastError != null) {
                lastError = null;
                publish();
            }
        });
    }

    // ===== Channel bookkeeping (engine thread only) =====

    void updateChannelState(ConnectionState state, Long nextStreamRetryAt) {
        if (disposed) {
            return;
        }
        if (connectionState != state || !Objects.equals(nextStreamRetryAtMs, nextStreamRetryAt)) {
            connectionState = state;
            nextStreamRetryAtMs = nextStreamRetryAt;
            publish();
        }
    }

    boolean isFetchInFlight() {
        return fetchInFlight;
    }

    boolean isAwaitingNewSession() {
        return awaitingSession != null;
    }

    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        if (awaitingTimer != null) {
            awaitingTimer.cancel();
        }
        if (spinnerTimer != null) {
            spinnerTimer.cancel();
        }
        thumbnailResolver.dispose();
        viewSubject.onComplete();
        logger.debug("Status store disposed");
    }

    private void publish() {
        if (disposed) {
            return;
        }
        StatusView view = buildView();
        currentView = view;
        viewSubject.onNext(view);
    }

    private StatusView buildView() {
        return StatusView.builder()
                .snapshot(snapshot)
                .connectionState(connectionState)
                .transitional(intent.isPausing(), intent.isCanceling())
                .awaitingNewSession(awaitingSession != null)
                .thumbnail(thumbnailResolver.getHandle())
                .hintedJob(hintedJob)
                .lastError(lastError)
                .loading(loading, initialAttemptInProgress)
                .everConnected(everConnected)
                .pollErrors(consecutivePollErrors, nextPollRetryAtMs)
                .nextStreamRetryAtMs(nextStreamRetryAtMs)
                .minSpinnerActive(scheduler.nowMillis() < minSpinnerUntilMs)
                .build();
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
