package orion.dal;

import orion.common.EBackendType;
import orion.common.SyncConstants;

/**
 * Type-safe configuration of the device backend the engine talks to
 *
 * @param apiUrl           base URL of the device API, http:// or https://
 * @param backendType      backend flavour, decides the static streaming capability
 * @param requestTimeoutMs per-request HTTP timeout (does not apply to the status stream)
 * @param streamingEnabled operator switch, false forces polling even on a streaming-capable backend
 * @author Orion team
 * @since 14/10/2026
 */
public record BackendConfig(String apiUrl, EBackendType backendType, int requestTimeoutMs, boolean streamingEnabled) {

    public static BackendConfig odyssey(String apiUrl) {
        return new BackendConfig(apiUrl, EBackendType.ODYSSEY, SyncConstants.DEFAULT_REQUEST_TIMEOUT_MS, true);
    }

    public static BackendConfig nanoDlp(String apiUrl) {
        return new BackendConfig(apiUrl, EBackendType.NANODLP, SyncConstants.DEFAULT_REQUEST_TIMEOUT_MS, false);
    }

    /**
     * Static capability: the engine never attempts to stream when this is false
     */
    public boolean supportsStreaming() {
        return streamingEnabled && backendType.isStreamingCapable();
    }

    public void validate() throws ConfigurationException {
        if (apiUrl == null || apiUrl.trim().isEmpty()) {
            throw new ConfigurationException("Backend API URL cannot be empty");
        }
        if (!apiUrl.startsWith("http://") && !apiUrl.startsWith("https://")) {
            throw new ConfigurationException("Backend API URL must start with http:// or https://: " + apiUrl);
        }
        if (backendType == null) {
            throw new ConfigurationException("Backend type cannot be null");
        }
        if (requestTimeoutMs < 500) {
            throw new ConfigurationException("Request timeout must be at least 500ms");
        }
    }

    @Override
    public String toString() {
        return String.format("BackendConfiguration{type=%s, url='%s', timeout=%d, streaming=%s}",
                backendType, apiUrl, requestTimeoutMs, supportsStreaming());
    }
}
