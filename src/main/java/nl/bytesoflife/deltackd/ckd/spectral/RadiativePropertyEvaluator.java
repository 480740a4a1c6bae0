package nl.bytesoflife.deltackd.ckd.spectral;

import nl.bytesoflife.deltackd.ckd.model.Bindex;
import nl.bytesoflife.deltackd.ckd.model.Wavelength;

import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * A radiative property (absorption coefficient, albedo, ...) evaluated one spectral
 * point at a time.
 */
public interface RadiativePropertyEvaluator {

    /**
     * Value at one CKD quadrature point.
     *
     * @param binSetId identifier of the bin set the bindex comes from, for evaluators whose
     *                 data is tabulated per bin set
     * @throws UnsupportedModeException if the evaluator only supports monochromatic mode
     */
    double evalCkd(Bindex bindex, String binSetId);

    /**
     * Value at a single wavelength.
     *
     * @throws UnsupportedModeException if the evaluator only supports CKD mode
     */
    default double evalMono(Wavelength w) {
        throw new UnsupportedModeException(SpectralMode.CKD);
    }

    /**
     * Evaluator defined at single wavelengths only. Its {@link #evalCkd} reports that only
     * monochromatic mode is supported.
     */
    static RadiativePropertyEvaluator monochromatic(ToDoubleFunction<Wavelength> function) {
        Objects.requireNonNull(function, "function");
        return new RadiativePropertyEvaluator() {
            @Override
            public double evalCkd(Bindex bindex, String binSetId) {
                throw new UnsupportedModeException(SpectralMode.MONOCHROMATIC);
            }

            @Override
            public double evalMono(Wavelength w) {
                return function.applyAsDouble(w);
            }
        };
    }
}
