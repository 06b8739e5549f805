package orion.domain.status;

/**
 * Raw status payload could not be turned into a snapshot; the update is dropped
 * @author Orion team
 * @since 15/10/2026
 */
public class SnapshotParseException extends Exception {
    public SnapshotParseException(String message) {
        super(message);
    }

    public SnapshotParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
