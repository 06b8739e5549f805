package orion.domain.status;

/**
 * Lifecycle of the push subscription, delivered on the engine thread
 * @author Orion team
 * @since 15/10/2026
 */
public interface IStreamStateListener {

    void onStreamOpened();

    /**
     * The subscription is gone and already torn down
     * @param cause failure, or null when the server closed the stream
     */
    void onStreamLost(Throwable cause);
}
