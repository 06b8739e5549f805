package orion.dal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import orion.common.EBackendType;
import orion.common.SyncConstants;

/**
 * Main configuration service - entry point for all engine configuration needs
 * @author Orion team
 * @since 14/10/2026
 */
public class ConfigurationService {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationService.class);

    private final ConfigurationLoader loader;
    private BackendConfig backendConfig;
    private SyncConfig syncConfig;

    public ConfigurationService() throws ConfigurationException {
        this(new ConfigurationLoader());
    }

    public ConfigurationService(ConfigurationLoader loader) throws ConfigurationException {
        this.loader = loader;
        this.backendConfig = loadBackendConfiguration();
        this.syncConfig = loadSyncConfiguration();
    }

    /**
     * Load backend configuration; the backend type decides whether streaming is ever attempted
     */
    private BackendConfig loadBackendConfiguration() throws ConfigurationException {
        String apiUrl = loader.getString("backend.api.url", SyncConstants.DEFAULT_API_URL);
        int timeout = loader.getInt("backend.request.timeout", SyncConstants.DEFAULT_REQUEST_TIMEOUT_MS);
        boolean streaming = loader.getBoolean("backend.streaming", true);

        String typeStr = loader.getString("backend.type", "ODYSSEY");
        EBackendType backendType;
        try {
            backendType = EBackendType.valueOf(typeStr.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid backend type '{}', defaulting to ODYSSEY", typeStr);
            backendType = EBackendType.ODYSSEY;
        }

        BackendConfig config = new BackendConfig(apiUrl.trim(), backendType, timeout, streaming);
        config.validate();
        logger.info("Configured {} backend at {} (streaming={})", backendType, config.apiUrl(), config.supportsStreaming());
        return config;
    }

    private SyncConfig loadSyncConfiguration() throws ConfigurationException {
        SyncConfig config = new SyncConfig(
                loader.getLong("sync.poll.min.interval", SyncConstants.MIN_POLL_INTERVAL_MS),
                loader.getLong("sync.poll.max.interval", SyncConstants.MAX_POLL_INTERVAL_MS),
                loader.getLong("sync.stream.reconnect.base", SyncConstants.STREAM_RECONNECT_BASE_MS),
                loader.getLong("sync.stream.reconnect.jitter", SyncConstants.STREAM_RECONNECT_JITTER_MS),
                loader.getLong("sync.session.awaiting.timeout", SyncConstants.AWAITING_SESSION_TIMEOUT_MS),
                loader.getLong("sync.session.min.spinner", SyncConstants.MIN_SPINNER_MS),
                loader.getString("sync.thumbnail.size", SyncConstants.THUMBNAIL_SIZE));
        config.validate();
        return config;
    }

    public BackendConfig getBackendConfiguration() {
        return backendConfig;
    }

    public SyncConfig getSyncConfiguration() {
        return syncConfig;
    }

    /**
     * Reload configuration
     */
    public void reload() throws ConfigurationException {
        logger.info("Reloading configuration...");
        loader.reload();
        this.backendConfig = loadBackendConfiguration();
        this.syncConfig = loadSyncConfiguration();

        logger.info("Configuration reloaded successfully");
        logger.info("Backend: {}", backendConfig);
        logger.info("Sync: {}", syncConfig);
    }
}
