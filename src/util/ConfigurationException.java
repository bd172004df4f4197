package util;

/**
 * Thrown when a model is configured with values it cannot work with: invalid
 * hyperparameter ranges, a vocabulary size that does not cover the observed
 * symbols, or components configured for different restaurant variants.
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1123581321L;

    public ConfigurationException(String msg) {
        super(msg);
    }

    public ConfigurationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
