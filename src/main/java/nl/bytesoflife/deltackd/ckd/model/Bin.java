package nl.bytesoflife.deltackd.ckd.model;

import nl.bytesoflife.deltackd.ckd.ConfigurationException;
import nl.bytesoflife.deltackd.ckd.ValidationException;
import nl.bytesoflife.deltackd.ckd.quad.QuadratureRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A spectral bin: the interval {@code [wmin, wmax]} with the quadrature rule used to
 * integrate over its cumulative probability coordinate.
 */
public final class Bin {

    /**
     * Canonical bin ordering: lower bound, then upper bound, then identifier.
     * The quadrature rule takes no part in it.
     */
    public static final Comparator<Bin> CANONICAL_ORDER = Comparator
            .comparing(Bin::getWmin)
            .thenComparing(Bin::getWmax)
            .thenComparing(Bin::getId);

    private static final Set<String> FIELDS = Set.of("id", "wmin", "wmax", "quad");

    private final String id;
    private final Wavelength wmin;
    private final Wavelength wmax;
    private final QuadratureRule quad;

    public Bin(String id, Wavelength wmin, Wavelength wmax, QuadratureRule quad) {
        this.id = Objects.requireNonNull(id, "id");
        this.wmin = Objects.requireNonNull(wmin, "wmin");
        this.wmax = Objects.requireNonNull(wmax, "wmax");
        this.quad = Objects.requireNonNull(quad, "quad");
        if (wmin.compareTo(wmax) >= 0) {
            throw new ValidationException("while validating wmin: wmin must be lower than wmax, got wmin = "
                    + wmin + " and wmax = " + wmax);
        }
    }

    /**
     * Loose construction from plain data. A {@code Bin} is returned unchanged, a 4-element
     * list is read as {@code (id, wmin, wmax, quad)} and a map is read by field name.
     * Bounds go through {@link Wavelength#convert(Object)}.
     */
    public static Bin convert(Object value) {
        if (value instanceof Bin bin) {
            return bin;
        }
        if (value instanceof List<?> list) {
            if (list.size() != 4) {
                throw new ConfigurationException(
                        "a bin is built from (id, wmin, wmax, quad), got " + list.size() + " values");
            }
            return build(list.get(0), list.get(1), list.get(2), list.get(3));
        }
        if (value instanceof Map<?, ?> map) {
            for (Object key : map.keySet()) {
                if (!(key instanceof String name) || !FIELDS.contains(name)) {
                    throw new ConfigurationException("unexpected bin field '" + key + "'");
                }
            }
            for (String field : FIELDS) {
                if (!map.containsKey(field)) {
                    throw new ConfigurationException("missing bin field '" + field + "'");
                }
            }
            return build(map.get("id"), map.get("wmin"), map.get("wmax"), map.get("quad"));
        }
        throw new ConfigurationException("cannot convert " + value + " to a bin");
    }

    private static Bin build(Object id, Object wmin, Object wmax, Object quad) {
        if (!(quad instanceof QuadratureRule rule)) {
            throw new ConfigurationException("bin quadrature must be a QuadratureRule, got " + quad);
        }
        return new Bin(String.valueOf(id), Wavelength.convert(wmin), Wavelength.convert(wmax), rule);
    }

    public String getId() {
        return id;
    }

    public Wavelength getWmin() {
        return wmin;
    }

    public Wavelength getWmax() {
        return wmax;
    }

    public QuadratureRule getQuad() {
        return quad;
    }

    public Wavelength getWidth() {
        return wmax.minus(wmin);
    }

    public Wavelength getWcenter() {
        return wmin.plus(wmax).times(0.5);
    }

    /**
     * One {@link Bindex} per quadrature point, in node order.
     */
    public List<Bindex> getBindexes() {
        List<Bindex> bindexes = new ArrayList<>(quad.size());
        for (int i = 0; i < quad.size(); i++) {
            bindexes.add(new Bindex(this, i));
        }
        return Collections.unmodifiableList(bindexes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bin other)) return false;
        return id.equals(other.id)
                && wmin.equals(other.wmin)
                && wmax.equals(other.wmax)
                && quad == other.quad;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, wmin, wmax, System.identityHashCode(quad));
    }

    @Override
    public String toString() {
        return "Bin{id='" + id + "', wmin=" + wmin + ", wmax=" + wmax + ", quad=" + quad.summary() + "}";
    }
}
