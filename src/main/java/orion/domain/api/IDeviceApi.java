package orion.domain.api;

import java.util.concurrent.CompletableFuture;

/**
 * Remote printer API used by the status engine.
 * All calls are asynchronous; futures complete on a transport thread, never on the engine thread.
 * Failed calls complete exceptionally, usually with {@link DeviceApiException}.
 * @author Orion team
 * @since 14/10/2026
 */
public interface IDeviceApi {

    /**
     * GET /status - raw JSON body
     */
    CompletableFuture<String> fetchStatus();

    /**
     * GET /status/stream - opens a server push channel; events are delivered to the listener
     */
    IStatusStream openStatusStream(IStatusStreamListener listener);

    CompletableFuture<Void> pause();

    CompletableFuture<Void> resume();

    CompletableFuture<Void> cancel();

    /**
     * GET /thumbnail - image bytes, empty when the device has no preview
     */
    CompletableFuture<byte[]> fetchThumbnail(String location, String path, String size);

    void close();
}
