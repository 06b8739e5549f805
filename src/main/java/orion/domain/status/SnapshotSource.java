package orion.domain.status;

/**
 * Channel a snapshot arrived on
 * @author Orion team
 * @since 15/10/2026
 */
public enum SnapshotSource {
    POLL(ConnectionState.POLLING),
    STREAM(ConnectionState.STREAMING);

    private final ConnectionState connectionState;

    SnapshotSource(ConnectionState connectionState) {
        this.connectionState = connectionState;
    }

    public ConnectionState toConnectionState() {
        return connectionState;
    }
}
