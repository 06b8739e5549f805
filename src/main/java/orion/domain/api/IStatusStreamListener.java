package orion.domain.api;

/**
 * Callbacks of a status stream, invoked on a transport thread
 * @author Orion team
 * @since 14/10/2026
 */
public interface IStatusStreamListener {
    void onOpen();

    void onPayload(String data);

    void onFailure(Throwable error);

    void onClosed();
}
