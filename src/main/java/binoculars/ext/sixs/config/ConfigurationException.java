package binoculars.ext.sixs.config;

/**
 * Invalid or missing configuration, including references to scan files that do not
 * exist. Fatal for the run: raised before any job executes.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
