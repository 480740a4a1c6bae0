package nl.bytesoflife.deltackd.ckd.spectral;

/**
 * Raised by an evaluator asked for a spectral mode it does not implement.
 */
public class UnsupportedModeException extends RuntimeException {

    private final SpectralMode supported;

    public UnsupportedModeException(SpectralMode supported) {
        super("unsupported spectral mode, supported: " + supported.getId());
        this.supported = supported;
    }

    public SpectralMode getSupported() {
        return supported;
    }
}
