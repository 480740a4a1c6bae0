package nl.bytesoflife.deltackd.ckd.quad;

import nl.bytesoflife.deltackd.ckd.ConfigurationException;
import nl.bytesoflife.deltackd.ckd.ValidationException;

import java.util.Objects;

/**
 * A quadrature rule: nodes and weights defined on the reference interval [-1, 1].
 * The reference interval can be changed with {@link #evalNodes(double, double)} and
 * {@link #integrate(double[], double, double)}.
 * <p>
 * Instances are immutable and compare by identity: bins share a rule by reference,
 * and bin sets check that sharing with {@code ==}.
 */
public final class QuadratureRule {

    private final QuadratureType type;
    private final double[] nodes;
    private final double[] weights;

    public QuadratureRule(QuadratureType type, double[] nodes, double[] weights) {
        this.type = Objects.requireNonNull(type, "type");
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(weights, "weights");
        if (nodes.length != weights.length) {
            throw new ValidationException(
                    "while validating nodes: nodes and weights arrays must have the same shape, got nodes.length = "
                            + nodes.length + " and weights.length = " + weights.length);
        }
        this.nodes = nodes.clone();
        this.weights = weights.clone();
    }

    /**
     * Creates a rule of the named type, e.g. {@code gauss_legendre} or {@code gauss_lobatto}.
     */
    public static QuadratureRule create(String type, int n) {
        return create(QuadratureType.fromName(type), n);
    }

    public static QuadratureRule create(QuadratureType type, int n) {
        return switch (type) {
            case GAUSS_LEGENDRE -> gaussLegendre(n);
            case GAUSS_LOBATTO -> gaussLobatto(n);
        };
    }

    public static QuadratureRule gaussLegendre(int n) {
        if (n < 1) {
            throw new ConfigurationException("Gauss-Legendre quadrature requires n >= 1, got " + n);
        }
        double[][] rule = GaussQuadrature.legendre(n);
        return new QuadratureRule(QuadratureType.GAUSS_LEGENDRE, rule[0], rule[1]);
    }

    public static QuadratureRule gaussLobatto(int n) {
        if (n < 2) {
            throw new ConfigurationException("Gauss-Lobatto quadrature requires n >= 2, got " + n);
        }
        double[][] rule = GaussQuadrature.lobatto(n);
        return new QuadratureRule(QuadratureType.GAUSS_LOBATTO, rule[0], rule[1]);
    }

    public QuadratureType getType() {
        return type;
    }

    public int size() {
        return nodes.length;
    }

    public double[] getNodes() {
        return nodes.clone();
    }

    public double[] getWeights() {
        return weights.clone();
    }

    /**
     * Nodes on the reference interval [-1, 1].
     */
    public double[] evalNodes() {
        return nodes.clone();
    }

    /**
     * Nodes mapped onto {@code [a, b]} with {@code x' = 0.5 * (a + b + (b - a) * x)}.
     */
    public double[] evalNodes(double a, double b) {
        double[] scaled = new double[nodes.length];
        for (int i = 0; i < nodes.length; i++) {
            scaled[i] = 0.5 * (a + b + (b - a) * nodes[i]);
        }
        return scaled;
    }

    /**
     * Weighted sum of function values sampled at the nodes, on the reference interval.
     */
    public double integrate(double[] values) {
        Objects.requireNonNull(values, "values");
        if (values.length != weights.length) {
            throw new ConfigurationException(
                    "expected " + weights.length + " values at quadrature nodes, got " + values.length);
        }
        double sum = 0.0;
        for (int i = 0; i < weights.length; i++) {
            sum += weights[i] * values[i];
        }
        return sum;
    }

    /**
     * Weighted sum of function values sampled at {@link #evalNodes(double, double)},
     * scaled by the Jacobian {@code 0.5 * (b - a)} of the interval map.
     */
    public double integrate(double[] values, double a, double b) {
        return 0.5 * (b - a) * integrate(values);
    }

    public String summary() {
        return "QuadratureRule(type=" + type + ", n=" + nodes.length + ")";
    }

    @Override
    public String toString() {
        return summary();
    }
}
