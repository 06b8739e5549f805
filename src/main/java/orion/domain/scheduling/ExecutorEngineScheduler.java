package orion.domain.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import orion.common.SyncConstants;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Engine scheduler backed by a single-threaded ScheduledExecutorService
 * @author Orion team
 * @since 14/10/2026
 */
public class ExecutorEngineScheduler implements IEngineScheduler {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorEngineScheduler.class);

    private final ScheduledExecutorService executor;
    private volatile Thread engineThread;

    public ExecutorEngineScheduler() {
        this(Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, SyncConstants.SCHEDULER_THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        }));
    }

    public ExecutorEngineScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            logger.debug("Engine scheduler is shut down, dropping task");
        }
    }

    @Override
    public ScheduledTask schedule(Runnable task, long delayMs) {
        try {
            ScheduledFuture<?> future = executor.schedule(guarded(task), Math.max(0, delayMs), TimeUnit.MILLISECONDS);
            return new FutureTask(future);
        } catch (RejectedExecutionException e) {
            logger.debug("Engine scheduler is shut down, not scheduling task");
            return new FutureTask(null);
        }
    }

    @Override
    public long nowMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public boolean isEngineThread() {
        return Thread.currentThread() == engineThread;
    }

    @Override
    public void shutdown() {
        executor.shutdownNow();
    }

    /**
     * A failing task must not kill the engine thread
     */
    private Runnable guarded(Runnable task) {
        return () -> {
            engineThread = Thread.currentThread();
            try {
                task.run();
            } catch (Exception e) {
                logger.error("Unhandled error in engine task", e);
            }
        };
    }

    private static final class FutureTask implements ScheduledTask {
        private final ScheduledFuture<?> future;

        private FutureTask(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public void cancel() {
            if (future != null) {
                future.cancel(false);
            }
        }

        @Override
        public boolean isDone() {
            return future == null || future.isDone();
        }
    }
}
