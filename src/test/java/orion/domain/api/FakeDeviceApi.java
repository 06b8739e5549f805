package orion.domain.api;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Device API double whose responses are completed by the test
 * @author Orion team
 * @since 16/10/2026
 */
public class FakeDeviceApi implements IDeviceApi {
    private final List<CompletableFuture<String>> statusRequests = new ArrayList<>();
    private final List<CompletableFuture<Void>> pauseRequests = new ArrayList<>();
    private final List<CompletableFuture<Void>> resumeRequests = new ArrayList<>();
    private final List<CompletableFuture<Void>> cancelRequests = new ArrayList<>();
    private final List<ThumbnailRequest> thumbnailRequests = new ArrayList<>();
    private final List<FakeStream> streams = new ArrayList<>();
    private boolean closed;

    @Override
    public CompletableFuture<String> fetchStatus() {
        CompletableFuture<String> future = new CompletableFuture<>();
        statusRequests.add(future);
        return future;
    }

    @Override
    public IStatusStream openStatusStream(IStatusStreamListener listener) {
        FakeStream stream = new FakeStream(listener);
        streams.add(stream);
        return stream;
    }

    @Override
    public CompletableFuture<Void> pause() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        pauseRequests.add(future);
        return future;
    }

    @Override
    public CompletableFuture<Void> resume() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        resumeRequests.add(future);
        return future;
    }

    @Override
    public CompletableFuture<Void> cancel() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        cancelRequests.add(future);
        return future;
    }

    @Override
    public CompletableFuture<byte[]> fetchThumbnail(String location, String path, String size) {
        ThumbnailRequest request = new ThumbnailRequest(location, path, size, new CompletableFuture<>());
        thumbnailRequests.add(request);
        return request.future();
    }

    @Override
    public void close() {
        closed = true;
    }

    // ===== Test controls =====

    public int statusFetchCount() {
        return statusRequests.size();
    }

    public long pendingStatusFetches() {
        return statusRequests.stream().filter(f -> !f.isDone()).count();
    }

    /**
     * Complete the oldest outstanding status fetch
     */
    public void respondStatus(String json) {
        oldestPending().complete(json);
    }

    public void failStatus(Throwable error) {
        oldestPending().completeExceptionally(error);
    }

    private CompletableFuture<String> oldestPending() {
        return statusRequests.stream()
                .filter(f -> !f.isDone())
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No status fetch outstanding"));
    }

    public List<CompletableFuture<Void>> getPauseRequests() {
        return pauseRequests;
    }

    public List<CompletableFuture<Void>> getResumeRequests() {
        return resumeRequests;
    }

    public List<CompletableFuture<Void>> getCancelRequests() {
        return cancelRequests;
    }

    public List<ThumbnailRequest> getThumbnailRequests() {
        return thumbnailRequests;
    }

    public List<FakeStream> getStreams() {
        return streams;
    }

    public FakeStream lastStream() {
        if (streams.isEmpty()) {
            throw new IllegalStateException("No stream opened");
        }
        return streams.get(streams.size() - 1);
    }

    public boolean isClosed() {
        return closed;
    }

    public record ThumbnailRequest(String location, String path, String size, CompletableFuture<byte[]> future) {
    }

    public static final class FakeStream implements IStatusStream {
        private final IStatusStreamListener listener;
        private boolean closed;

        private FakeStream(IStatusStreamListener listener) {
            this.listener = listener;
        }

        public void open() {
            listener.onOpen();
        }

        public void emit(String payload) {
            listener.onPayload(payload);
        }

        public void fail(Throwable cause) {
            listener.onFailure(cause);
        }

        public void serverClose() {
            listener.onClosed();
        }

        @Override
        public void close() {
            closed = true;
        }

        public boolean isClosed() {
            return closed;
        }
    }
}
