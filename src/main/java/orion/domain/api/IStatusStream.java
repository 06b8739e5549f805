package orion.domain.api;

/**
 * Handle to an open status stream
 * @author Orion team
 * @since 14/10/2026
 */
public interface IStatusStream {

    /**
     * Close the stream; no further callbacks are expected, but late ones may still arrive
     */
    void close();
}
