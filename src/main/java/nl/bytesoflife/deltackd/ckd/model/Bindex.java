package nl.bytesoflife.deltackd.ckd.model;

import nl.bytesoflife.deltackd.ckd.ConfigurationException;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A (bin, quadrature point) pair, the unit at which CKD radiative properties are evaluated.
 * <p>
 * {@code index} is not checked against {@code bin.getQuad().size()}; an out-of-range index
 * only fails when the node it designates is looked up.
 */
public record Bindex(Bin bin, int index) {

    public Bindex {
        Objects.requireNonNull(bin, "bin");
    }

    /**
     * Loose construction from plain data. A {@code Bindex} is returned unchanged, a 2-element
     * list is read as {@code (bin, index)} and a map is read by field name. The bin goes
     * through {@link Bin#convert(Object)}.
     */
    public static Bindex convert(Object value) {
        if (value instanceof Bindex bindex) {
            return bindex;
        }
        if (value instanceof List<?> list) {
            if (list.size() != 2) {
                throw new ConfigurationException(
                        "a bindex is built from (bin, index), got " + list.size() + " values");
            }
            return build(list.get(0), list.get(1));
        }
        if (value instanceof Map<?, ?> map) {
            if (map.size() != 2 || !map.containsKey("bin") || !map.containsKey("index")) {
                throw new ConfigurationException("a bindex is built from fields {bin, index}, got " + map.keySet());
            }
            return build(map.get("bin"), map.get("index"));
        }
        throw new ConfigurationException("cannot convert " + value + " to a bindex");
    }

    private static Bindex build(Object bin, Object index) {
        if (!(index instanceof Integer || index instanceof Long || index instanceof Short)) {
            throw new ConfigurationException("bindex index must be an integer, got " + index);
        }
        return new Bindex(Bin.convert(bin), ((Number) index).intValue());
    }

    /**
     * The quadrature node of this point mapped onto the cumulative probability interval [0, 1].
     */
    public double getGPoint() {
        return bin.getQuad().evalNodes(0.0, 1.0)[index];
    }

    @Override
    public String toString() {
        return "Bindex{bin='" + bin.getId() + "', index=" + index + "}";
    }
}
