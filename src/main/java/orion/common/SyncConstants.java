package orion.common;

/**
 * Status synchronization defaults
 * @author Orion team
 * @since 14/10/2026
 */
public final class SyncConstants {
    private SyncConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static final String DEFAULT_API_URL = "http://localhost:12357";
    public static final int DEFAULT_REQUEST_TIMEOUT_MS = 5_000;

    // Poll cadence (two-level: min after success, max after failure)
    public static final long MIN_POLL_INTERVAL_MS = 1_000;
    public static final long MAX_POLL_INTERVAL_MS = 15_000;

    // Stream reconnect = base + uniform jitter
    public static final long STREAM_RECONNECT_BASE_MS = 3_000;
    public static final long STREAM_RECONNECT_JITTER_MS = 2_000;

    // New session readiness barrier
    public static final long AWAITING_SESSION_TIMEOUT_MS = 12_000;
    public static final long MIN_SPINNER_MS = 2_000;

    public static final String THUMBNAIL_SIZE = "Large";
    public static final String DEFAULT_LOCATION_CATEGORY = "Local";

    public static final String SCHEDULER_THREAD_NAME = "orion-status-engine";
    // Upper bound for the engine thread to finish teardown on dispose
    public static final long DISPOSE_TIMEOUT_MS = 2_000;
}
