package orion.domain.status;

/**
 * Receives every published view, synchronously on the engine thread
 * @author Orion team
 * @since 15/10/2026
 */
@FunctionalInterface
public interface IStatusObserver {
    void onUpdate(StatusView view);
}
