package radiacool.physics.solver.impl;

import radiacool.physics.solver.SpectralInterpolator;

import java.util.Arrays;

/**
 * Interpolación cúbica de Hermite monótona por tramos (PCHIP, Fritsch–Carlson).
 * <p>
 * Preserva la forma de los datos: no produce sobreoscilaciones entre nodos. Fuera del rango
 * de origen el valor se fija al extremo más cercano. El ruido negativo residual se recorta a 0.
 * <p>
 * Stateless y Thread-Safe.
 */
public class PchipSpectralResampler implements SpectralInterpolator {

    @Override
    public double[] resample(double[] x, double[] y, double[] target) {
        if (x.length != y.length || x.length < 2) {
            throw new IllegalArgumentException("Se necesitan al menos dos nodos con abscisa y valor.");
        }
        final double[] slopes = computeSlopes(x, y);
        final int last = x.length - 1;
        double[] result = new double[target.length];

        for (int i = 0; i < target.length; i++) {
            final double t = target[i];
            double value;
            if (t <= x[0]) {
                value = y[0];
            } else if (t >= x[last]) {
                value = y[last];
            } else {
                int k = findInterval(x, t);
                value = hermite(x[k], x[k + 1], y[k], y[k + 1], slopes[k], slopes[k + 1], t);
            }
            result[i] = Math.max(0.0, value);
        }
        return result;
    }

    /**
     * Derivadas en los nodos. Interior: media armónica ponderada de las pendientes adyacentes,
     * cero en extremos locales. Bordes: fórmula no centrada de tres puntos con corrección de forma.
     */
    static double[] computeSlopes(double[] x, double[] y) {
        final int n = x.length;
        double[] h = new double[n - 1];
        double[] delta = new double[n - 1];
        for (int k = 0; k < n - 1; k++) {
            h[k] = x[k + 1] - x[k];
            delta[k] = (y[k + 1] - y[k]) / h[k];
        }

        double[] m = new double[n];
        if (n == 2) {
            m[0] = delta[0];
            m[1] = delta[0];
            return m;
        }

        for (int k = 1; k < n - 1; k++) {
            final double d0 = delta[k - 1];
            final double d1 = delta[k];
            if (d0 * d1 <= 0.0) {
                m[k] = 0.0;
            } else {
                final double w1 = 2.0 * h[k] + h[k - 1];
                final double w2 = h[k] + 2.0 * h[k - 1];
                m[k] = (w1 + w2) / (w1 / d0 + w2 / d1);
            }
        }

        m[0] = endpointSlope(h[0], h[1], delta[0], delta[1]);
        m[n - 1] = endpointSlope(h[n - 2], h[n - 3], delta[n - 2], delta[n - 3]);
        return m;
    }

    private static double endpointSlope(double h0, double h1, double d0, double d1) {
        double slope = ((2.0 * h0 + h1) * d0 - h0 * d1) / (h0 + h1);
        if (Math.signum(slope) != Math.signum(d0)) {
            return 0.0;
        }
        if (Math.signum(d0) != Math.signum(d1) && Math.abs(slope) > Math.abs(3.0 * d0)) {
            return 3.0 * d0;
        }
        return slope;
    }

    /**
     * Índice k tal que x[k] ≤ t < x[k+1]. Requiere x[0] < t < x[n-1].
     */
    private static int findInterval(double[] x, double t) {
        int idx = Arrays.binarySearch(x, t);
        if (idx >= 0) {
            return Math.min(idx, x.length - 2);
        }
        return -idx - 2;
    }

    private static double hermite(double x0, double x1, double y0, double y1, double m0, double m1, double t) {
        final double h = x1 - x0;
        final double s = (t - x0) / h;
        final double s2 = s * s;
        final double s3 = s2 * s;
        final double h00 = 2 * s3 - 3 * s2 + 1;
        final double h10 = s3 - 2 * s2 + s;
        final double h01 = -2 * s3 + 3 * s2;
        final double h11 = s3 - s2;
        return h00 * y0 + h10 * h * m0 + h01 * y1 + h11 * h * m1;
    }
}
