package nl.bytesoflife.deltackd.ckd.quad;

/**
 * Node and weight generators for Gauss-type quadrature rules on [-1, 1].
 * Nodes are returned in ascending order.
 */
final class GaussQuadrature {

    private static final int MAX_ITERATIONS = 100;
    private static final double TOLERANCE = 1e-15;

    private GaussQuadrature() {
    }

    /**
     * Gauss-Legendre rule with {@code n} points: nodes are the roots of P_n.
     *
     * @return {@code {nodes, weights}}
     */
    static double[][] legendre(int n) {
        double[] nodes = new double[n];
        double[] weights = new double[n];

        int half = (n + 1) / 2;
        for (int i = 0; i < half; i++) {
            // Tricomi initial guess, descending from +1
            double x = Math.cos(Math.PI * (i + 0.75) / (n + 0.5));
            double derivative = 0;

            for (int it = 0; it < MAX_ITERATIONS; it++) {
                double[] p = legendreWithPrevious(n, x);
                derivative = n * (x * p[0] - p[1]) / (x * x - 1.0);
                double dx = p[0] / derivative;
                x -= dx;
                if (Math.abs(dx) <= TOLERANCE) {
                    double[] pFinal = legendreWithPrevious(n, x);
                    derivative = n * (x * pFinal[0] - pFinal[1]) / (x * x - 1.0);
                    break;
                }
            }

            double w = 2.0 / ((1.0 - x * x) * derivative * derivative);
            nodes[i] = -x;
            nodes[n - 1 - i] = x;
            weights[i] = w;
            weights[n - 1 - i] = w;
        }

        if (n % 2 == 1) {
            nodes[n / 2] = 0.0;
        }

        return new double[][]{nodes, weights};
    }

    /**
     * Gauss-Lobatto rule with {@code n >= 2} points: the endpoints plus the roots of P'_{n-1}.
     *
     * @return {@code {nodes, weights}}
     */
    static double[][] lobatto(int n) {
        int order = n - 1;
        double[] nodes = new double[n];
        double[] weights = new double[n];

        for (int i = 0; i < n; i++) {
            // Chebyshev-Gauss-Lobatto initial guess, descending from +1
            double x = Math.cos(Math.PI * i / order);

            for (int it = 0; it < MAX_ITERATIONS; it++) {
                double[] p = legendreWithPrevious(order, x);
                double dx = (x * p[0] - p[1]) / (n * p[0]);
                x -= dx;
                if (Math.abs(dx) <= TOLERANCE) {
                    break;
                }
            }

            double pn = legendreWithPrevious(order, x)[0];
            nodes[n - 1 - i] = x;
            weights[n - 1 - i] = 2.0 / (order * n * pn * pn);
        }

        if (n % 2 == 1) {
            nodes[n / 2] = 0.0;
        }

        return new double[][]{nodes, weights};
    }

    /**
     * Evaluates P_n(x) and P_{n-1}(x) with the three-term recurrence.
     */
    private static double[] legendreWithPrevious(int n, double x) {
        if (n == 0) {
            return new double[]{1.0, 0.0};
        }
        double previous = 1.0;
        double current = x;
        for (int k = 2; k <= n; k++) {
            double next = ((2.0 * k - 1.0) * x * current - (k - 1.0) * previous) / k;
            previous = current;
            current = next;
        }
        return new double[]{current, previous};
    }
}
