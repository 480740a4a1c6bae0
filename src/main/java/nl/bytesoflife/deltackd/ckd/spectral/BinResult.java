package nl.bytesoflife.deltackd.ckd.spectral;

import nl.bytesoflife.deltackd.ckd.model.Bin;

/**
 * Values evaluated at each quadrature point of a bin, and their integral over the
 * cumulative probability coordinate g in [0, 1].
 *
 * @param bin    evaluated bin
 * @param values one value per bindex, in bindex order
 * @param value  {@code bin.getQuad().integrate(values, 0, 1)}
 */
public record BinResult(Bin bin, double[] values, double value) {

    public BinResult {
        values = values.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }
}
