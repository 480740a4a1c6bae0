package nl.bytesoflife.deltackd.ckd.data;

/**
 * Raised when a dataset cannot be read or does not have the expected layout.
 */
public class DatasetException extends RuntimeException {

    public DatasetException(String message) {
        super(message);
    }

    public DatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
