package nl.bytesoflife.deltackd.ckd.quad;

import nl.bytesoflife.deltackd.ckd.ConfigurationException;

import java.util.Map;

public enum QuadratureType {
    GAUSS_LEGENDRE("gauss_legendre"),
    GAUSS_LOBATTO("gauss_lobatto");

    private static final Map<String, QuadratureType> NAMES = Map.of(
            "gauss_legendre", GAUSS_LEGENDRE,
            "gauss_lobatto", GAUSS_LOBATTO
    );

    private final String id;

    QuadratureType(String id) {
        this.id = id;
    }

    /**
     * Identifier used in dataset attributes, e.g. {@code gauss_legendre}.
     */
    public String getId() {
        return id;
    }

    public static QuadratureType fromName(String name) {
        QuadratureType type = name == null ? null : NAMES.get(name.toLowerCase());
        if (type == null) {
            throw new ConfigurationException("unknown quadrature type '" + name + "'");
        }
        return type;
    }

    @Override
    public String toString() {
        return id;
    }
}
