package nl.bytesoflife.deltackd.ckd;

/**
 * Thrown when constructing an object would violate one of its structural invariants.
 * The offending object is never returned.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
