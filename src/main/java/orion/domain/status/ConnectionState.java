package orion.domain.status;

/**
 * Channel currently feeding the engine; a single value, so never streaming and polling at once
 * @author Orion team
 * @since 15/10/2026
 */
public enum ConnectionState {
    DISCONNECTED,
    STREAMING,
    POLLING
}
