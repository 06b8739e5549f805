package orion.common;

/**
 * Device backend flavours
 * @author Orion team
 * @since 14/10/2026
 */
public enum EBackendType {
    ODYSSEY(true),     // Exposes /status/stream
    NANODLP(false);    // Polling-only adapter

    private final boolean streamingCapable;

    EBackendType(boolean streamingCapable) {
        this.streamingCapable = streamingCapable;
    }

    public boolean isStreamingCapable() {
        return streamingCapable;
    }
}
