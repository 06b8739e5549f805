package orion.dal;

/**
 * Exception thrown when engine configuration is invalid or missing
 * @author Orion team
 * @since 14/10/2026
 */
public class ConfigurationException extends Exception {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
