package rastr.dal;

/**
 * Exception thrown when configuration is invalid or missing
 * @since 19/10/2026
 */
public class ConfigurationException extends Exception {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
