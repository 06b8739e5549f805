package orion.domain.api;

/**
 * Device API request failed (transport error or non-success HTTP status)
 * @author Orion team
 * @since 14/10/2026
 */
public class DeviceApiException extends RuntimeException {
    private final int statusCode;

    public DeviceApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public DeviceApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status code, -1 when the request never got a response
     */
    public int getStatusCode() {
        return statusCode;
    }
}
