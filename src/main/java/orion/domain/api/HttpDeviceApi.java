package orion.domain.api;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okhttp3.sse.EventSource;
import okhttp3.sse.EventSourceListener;
import okhttp3.sse.EventSources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import orion.dal.BackendConfig;

import javax.inject.Inject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * OkHttp implementation of the device API.
 * Plain requests use the configured timeout; the status stream runs without a read timeout.
 *
 * @author Orion team
 * @since 15/10/2026
 */
public class HttpDeviceApi implements IDeviceApi {
    private static final Logger logger = LoggerFactory.getLogger(HttpDeviceApi.class);

    private final HttpUrl baseUrl;
    private final OkHttpClient client;
    private final OkHttpClient streamClient;

    @Inject
    public HttpDeviceApi(BackendConfig config, OkHttpClient baseClient) {
        HttpUrl parsed = HttpUrl.parse(config.apiUrl());
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid backend API URL: " + config.apiUrl());
        }
        this.baseUrl = parsed;
        this.client = baseClient.newBuilder()
                .callTimeout(config.requestTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();
        this.streamClient = baseClient.newBuilder()
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .callTimeout(0, TimeUnit.MILLISECONDS)
                .build();
        logger.info("Device API client created for {}", baseUrl);
    }

    @Override
    public CompletableFuture<String> fetchStatus() {
        Request request = new Request.Builder().url(url("status")).get().build();
        return call(request, body -> new String(body, StandardCharsets.UTF_8));
    }

    @Override
    public IStatusStream openStatusStream(IStatusStreamListener listener) {
        Request request = new Request.Builder()
                .url(url("status/stream"))
                .header("Accept", "text/event-stream")
                .build();
        logger.debug("Opening status stream {}", request.url());

        EventSource eventSource = EventSources.createFactory(streamClient)
                .newEventSource(request, new StreamListenerAdapter(listener));
        return eventSource::cancel;
    }

    @Override
    public CompletableFuture<Void> pause() {
        return post("pause");
    }

    @Override
    public CompletableFuture<Void> resume() {
        return post("resume");
    }

    @Override
    public CompletableFuture<Void> cancel() {
        return post("cancel");
    }

    @Override
    public CompletableFuture<byte[]> fetchThumbnail(String location, String path, String size) {
        HttpUrl thumbnailUrl = baseUrl.newBuilder()
                .addPathSegment("thumbnail")
                .addQueryParameter("location", location)
                .addQueryParameter("path", path)
                .addQueryParameter("size", size)
                .build();
        Request request = new Request.Builder().url(thumbnailUrl).get().build();
        return call(request, Function.identity());
    }

    @Override
    public void close() {
        client.dispatcher().cancelAll();
        streamClient.dispatcher().cancelAll();
        logger.debug("Device API client closed");
    }

    private CompletableFuture<Void> post(String endpoint) {
        Request request = new Request.Builder()
                .url(url(endpoint))
                .post(RequestBody.create(new byte[0]))
                .build();
        return call(request, body -> null);
    }

    private HttpUrl url(String pathSegments) {
        return baseUrl.newBuilder().addPathSegments(pathSegments).build();
    }

    private <T> CompletableFuture<T> call(Request request, Function<byte[], T> bodyMapper) {
        CompletableFuture<T> result = new CompletableFuture<>();
        String description = request.method() + " " + request.url().encodedPath();

        client.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                logger.debug("{} failed: {}", description, e.getMessage());
                result.completeExceptionally(new DeviceApiException(description + " failed: " + e.getMessage(), e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (!response.isSuccessful()) {
                        result.completeExceptionally(new DeviceApiException(
                                description + " returned HTTP " + response.code(), response.code()));
                        return;
                    }
                    ResponseBody body = response.body();
                    byte[] bytes = body != null ? body.bytes() : new byte[0];
                    logger.trace("{} -> {} bytes", description, bytes.length);
                    result.complete(bodyMapper.apply(bytes));
                } catch (IOException e) {
                    result.completeExceptionally(new DeviceApiException(description + " body read failed", e));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            }
        });
        return result;
    }

    /**
     * Maps okhttp-sse callbacks onto the engine's stream listener
     */
    private static final class StreamListenerAdapter extends EventSourceListener {
        private final IStatusStreamListener listener;

        private StreamListenerAdapter(IStatusStreamListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(EventSource eventSource, Response response) {
            listener.onOpen();
        }

        @Override
        public void onEvent(EventSource eventSource, String id, String type, String data) {
            if (data == null || data.isBlank()) {
                return;
            }
            listener.onPayload(data);
        }

        @Override
        public void onClosed(EventSource eventSource) {
            listener.onClosed();
        }

        @Override
        public void onFailure(EventSource eventSource, Throwable t, Response response) {
            if (t != null) {
                listener.onFailure(t);
            } else if (response != null) {
                listener.onFailure(new DeviceApiException("Status stream returned HTTP " + response.code(), response.code()));
            } else {
                listener.onFailure(new DeviceApiException("Status stream failed", -1));
            }
        }
    }
}
