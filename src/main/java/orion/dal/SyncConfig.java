package orion.dal;

import orion.common.SyncConstants;

/**
 * Timing configuration of the synchronization engine
 *
 * @author Orion team
 * @since 14/10/2026
 */
public record SyncConfig(long minPollIntervalMs,
                         long maxPollIntervalMs,
                         long reconnectBaseMs,
                         long reconnectJitterMs,
                         long awaitingTimeoutMs,
                         long minSpinnerMs,
                         String thumbnailSize) {

    public static SyncConfig defaults() {
        return new SyncConfig(
                SyncConstants.MIN_POLL_INTERVAL_MS,
                SyncConstants.MAX_POLL_INTERVAL_MS,
                SyncConstants.STREAM_RECONNECT_BASE_MS,
                SyncConstants.STREAM_RECONNECT_JITTER_MS,
                SyncConstants.AWAITING_SESSION_TIMEOUT_MS,
                SyncConstants.MIN_SPINNER_MS,
                SyncConstants.THUMBNAIL_SIZE);
    }

    public void validate() throws ConfigurationException {
        if (minPollIntervalMs < 100) {
            throw new ConfigurationException("Minimum poll interval must be at least 100ms");
        }
        if (maxPollIntervalMs < minPollIntervalMs) {
            throw new ConfigurationException("Maximum poll interval must not be below the minimum poll interval");
        }
        if (reconnectBaseMs < 0 || reconnectJitterMs < 0) {
            throw new ConfigurationException("Reconnect delays cannot be negative");
        }
        if (awaitingTimeoutMs < 1000) {
            throw new ConfigurationException("Awaiting session timeout must be at least 1000ms");
        }
        if (minSpinnerMs < 0) {
            throw new ConfigurationException("Minimum spinner time cannot be negative");
        }
        if (thumbnailSize == null || thumbnailSize.trim().isEmpty()) {
            throw new ConfigurationException("Thumbnail size cannot be empty");
        }
    }

    @Override
    public String toString() {
        return String.format("SyncConfiguration{poll=%d..%dms, reconnect=%d+%dms, awaiting=%dms, thumbnail=%s}",
                minPollIntervalMs, maxPollIntervalMs, reconnectBaseMs, reconnectJitterMs, awaitingTimeoutMs, thumbnailSize);
    }
}
