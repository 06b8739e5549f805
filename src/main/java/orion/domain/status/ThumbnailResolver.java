package orion.domain.status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import orion.dal.SyncConfig;
import orion.domain.api.IDeviceApi;
import orion.domain.scheduling.IEngineScheduler;

import javax.inject.Inject;
import java.util.function.Consumer;

/**
 * Lazily fetches the preview image of the active job, at most once per session.
 * A failed or empty fetch settles the handle as READY without an image, it is never retried.
 * Must only be used from the engine thread.
 *
 * @author Orion team
 * @since 15/10/2026
 */
public class ThumbnailResolver {
    private static final Logger logger = LoggerFactory.getLogger(ThumbnailResolver.class);

    private final IDeviceApi deviceApi;
    private final IEngineScheduler scheduler;
    private final String thumbnailSize;

    private Consumer<ThumbnailHandle> resolvedListener = handle -> { };
    private ThumbnailHandle handle = ThumbnailHandle.unresolved();
    private long generation;
    private volatile boolean disposed;

    @Inject
    public ThumbnailResolver(IDeviceApi deviceApi, IEngineScheduler scheduler, SyncConfig syncConfig) {
        this.deviceApi = deviceApi;
        this.scheduler = scheduler;
        this.thumbnailSize = syncConfig.thumbnailSize();
    }

    /**
     * Called on the engine thread whenever a fetch settles
     */
    public void setResolvedListener(Consumer<ThumbnailHandle> resolvedListener) {
        this.resolvedListener = resolvedListener;
    }

    public ThumbnailHandle getHandle() {
        return handle;
    }

    /**
     * Start a new session; results of fetches started before are discarded.
     * @param seedBytes image supplied by the caller for instant display, may be null
     * @param seedJob   job the seed belongs to, may be null
     */
    public void reset(byte[] seedBytes, JobInfo seedJob) {
        generation++;
        if (seedBytes != null && seedBytes.length > 0) {
            handle = ThumbnailHandle.ready(seedJob != null ? seedJob.key() : null, seedBytes);
        } else {
            handle = ThumbnailHandle.unresolved();
        }
        logger.debug("Thumbnail session {} started with {}", generation, handle);
    }

    /**
     * Whether a fetch for this job would be started
     */
    public boolean needsResolution(JobInfo job) {
        if (job == null || disposed) {
            return false;
        }
        // Once per session: a settled or pending handle is kept until the next reset
        return handle.isUnresolved();
    }

    /**
     * Start the fetch for the given job if it still needs one
     * @return true when a request was issued
     */
    public boolean resolve(JobInfo job) {
        if (!needsResolution(job)) {
            return false;
        }
        final long requestGeneration = generation;
        final String jobKey = job.key();
        handle = ThumbnailHandle.resolving(jobKey);
        logger.debug("Fetching thumbnail for {} ({})", job.name(), jobKey);

        deviceApi.fetchThumbnail(job.effectiveLocation(), job.path(), thumbnailSize)
                .whenComplete((bytes, error) -> scheduler.execute(() -> complete(requestGeneration, jobKey, bytes, error)));
        return true;
    }

    private void complete(long requestGeneration, String jobKey, byte[] bytes, Throwable error) {
        if (disposed || requestGeneration != generation) {
            logger.trace("Discarding stale thumbnail result for {}", jobKey);
            return;
        }
        if (error != null) {
            logger.warn("Thumbnail fetch for {} failed, continuing without image: {}", jobKey, error.getMessage());
            handle = ThumbnailHandle.ready(jobKey, null);
        } else {
            handle = ThumbnailHandle.ready(jobKey, bytes);
            if (!handle.hasImage()) {
                logger.info("Device has no thumbnail for {}", jobKey);
            }
        }
        try {
            resolvedListener.accept(handle);
        } catch (Exception e) {
            logger.error("Error in thumbnail listener", e);
        }
    }

    public void dispose() {
        disposed = true;
    }
}
