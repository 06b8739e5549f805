package orion.domain.scheduling;

/**
 * Single logical thread on which all engine state is mutated.
 * Tasks run one at a time in submission order.
 * @author Orion team
 * @since 14/10/2026
 */
public interface IEngineScheduler {

    /**
     * Run the task on the engine thread as soon as possible
     */
    void execute(Runnable task);

    /**
     * Run the task on the engine thread after the given delay
     */
    ScheduledTask schedule(Runnable task, long delayMs);

    /**
     * Engine clock in milliseconds
     */
    long nowMillis();

    /**
     * Whether the calling thread is the engine thread
     */
    boolean isEngineThread();

    /**
     * Stop accepting tasks; pending ones are dropped
     */
    void shutdown();
}
