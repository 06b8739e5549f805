package orion.domain.status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import orion.dal.SyncConfig;
import orion.domain.scheduling.IEngineScheduler;
import orion.domain.scheduling.ScheduledTask;

import javax.inject.Inject;
import java.util.function.BooleanSupplier;

/**
 * Pull channel: refreshes the store on a two-level cadence.
 * The minimum interval follows a successful fetch, the maximum interval follows a failed one.
 * The loop stops itself whenever the push channel is active.
 * Engine thread only.
 *
 * @author Orion team
 * @since 15/10/2026
 */
public class PollLoop {
    private static final Logger logger = LoggerFactory.getLogger(PollLoop.class);

    private final StatusStore store;
    private final IEngineScheduler scheduler;
    private final long minIntervalMs;
    private final long maxIntervalMs;

    private BooleanSupplier streamingActive = () -> false;
    private ScheduledTask nextTick;
    private long intervalMs;
    private boolean running;
    private boolean tickInFlight;
    private volatile boolean disposed;

    @Inject
    public PollLoop(StatusStore store, IEngineScheduler scheduler, SyncConfig syncConfig) {
        this.store = store;
        this.scheduler = scheduler;
        this.minIntervalMs = syncConfig.minPollIntervalMs();
        this.maxIntervalMs = syncConfig.maxPollIntervalMs();
        this.intervalMs = minIntervalMs;
    }

    /**
     * Checked before every tick and every reschedule
     */
    public void setStreamingActive(BooleanSupplier streamingActive) {
        this.streamingActive = streamingActive;
    }

    public void start() {
        if (disposed || running) {
            return;
        }
        if (streamingActive.getAsBoolean()) {
            logger.debug("Not starting polling, stream is active");
            return;
        }
        running = true;
        logger.info("Polling started");
        refresh();
    }

    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        cancelNextTick();
        logger.info("Polling stopped");
    }

    /**
     * Run one tick now. A tick requested while one is outstanding is a no-op.
     */
    public void refresh() {
        if (disposed) {
            return;
        }
        if (streamingActive.getAsBoolean()) {
            stop();
            return;
        }
        if (tickInFlight) {
            logger.trace("Poll tick already in flight");
            return;
        }
        cancelNextTick();
        tickInFlight = true;
        store.refresh().whenComplete((outcome, error) -> scheduler.execute(() -> onTickComplete(outcome)));
    }

    private void onTickComplete(RefreshOutcome outcome) {
        tickInFlight = false;
        if (disposed) {
            return;
        }
        if (outcome == RefreshOutcome.APPLIED) {
            intervalMs = minIntervalMs;
        } else if (outcome == RefreshOutcome.FAILED) {
            if (intervalMs != maxIntervalMs) {
                logger.warn("Status poll failed, backing off to {}ms", maxIntervalMs);
            }
            intervalMs = maxIntervalMs;
        }

        if (streamingActive.getAsBoolean()) {
            stop();
            return;
        }
        if (running) {
            cancelNextTick();
            nextTick = scheduler.schedule(this::refresh, intervalMs);
        }
    }

    private void cancelNextTick() {
        if (nextTick != null) {
            nextTick.cancel();
            nextTick = null;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public void dispose() {
        disposed = true;
        running = false;
        cancelNextTick();
    }
}
