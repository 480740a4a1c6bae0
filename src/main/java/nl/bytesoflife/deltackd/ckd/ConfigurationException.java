package nl.bytesoflife.deltackd.ckd;

/**
 * Thrown when a caller supplies a value or shape the library cannot interpret:
 * an unknown quadrature type, an unknown bin filter, an unrecognized selection
 * spec, a reversed filter interval or malformed configuration text.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
