package orion.domain.status;

/**
 * Posted on the engine event bus whenever the active channel changes
 * @author Orion team
 * @since 15/10/2026
 */
public class ConnectionStateEvent {
    private final ConnectionState previous;
    private final ConnectionState current;
    private final Long nextStreamRetryAtMs;
    private final long timestamp;

    public ConnectionStateEvent(ConnectionState previous, ConnectionState current, Long nextStreamRetryAtMs, long timestamp) {
        this.previous = previous;
        this.current = current;
        this.nextStreamRetryAtMs = nextStreamRetryAtMs;
        this.timestamp = timestamp;
    }

    public ConnectionState getPrevious() {
        return previous;
    }

    public ConnectionState getCurrent() {
        return current;
    }

    /**
     * Engine time of the next stream attempt, null when none is scheduled
     */
    public Long getNextStreamRetryAtMs() {
        return nextStreamRetryAtMs;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "ConnectionStateEvent [previous=" + previous + ", current=" + current
                + ", nextStreamRetryAt=" + nextStreamRetryAtMs + ", timestamp=" + timestamp + "]";
    }
}
