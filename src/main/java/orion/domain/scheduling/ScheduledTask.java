package orion.domain.scheduling;

/**
 * Handle to a delayed engine task
 * @author Orion team
 * @since 14/10/2026
 */
public interface ScheduledTask {
    void cancel();

    boolean isDone();
}
