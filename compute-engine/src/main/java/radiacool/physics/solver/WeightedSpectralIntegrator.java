package radiacool.physics.solver;

import radiacool.domain.exception.SpectralIntegrationException;
import radiacool.domain.spectrum.WavelengthBand;

import java.util.Arrays;

/**
 * Cuadratura trapezoidal sobre rejillas no uniformes y medias espectrales ponderadas.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class WeightedSpectralIntegrator {

    private WeightedSpectralIntegrator() {}

    public static double trapezoid(double[] x, double[] y) {
        double sum = 0.0;
        for (int i = 1; i < x.length; i++) {
            sum += 0.5 * (y[i] + y[i - 1]) * (x[i] - x[i - 1]);
        }
        return sum;
    }

    /**
     * Anchura de celda asociada a cada nodo para la regla del trapecio:
     * la mitad del intervalo en los extremos y la semisuma de intervalos adyacentes en el interior.
     * Σ f·Δλ reproduce exactamente {@link #trapezoid(double[], double[])}.
     */
    public static double[] cellWidths(double[] x) {
        final int n = x.length;
        double[] widths = new double[n];
        if (n < 2) {
            return widths;
        }
        widths[0] = 0.5 * (x[1] - x[0]);
        widths[n - 1] = 0.5 * (x[n - 1] - x[n - 2]);
        for (int i = 1; i < n - 1; i++) {
            widths[i] = 0.5 * (x[i + 1] - x[i - 1]);
        }
        return widths;
    }

    /**
     * ∫f·w dλ / ∫w dλ sobre los puntos de la rejilla contenidos en la banda.
     *
     * @param quantityName Nombre de la magnitud integrada, para el mensaje de error.
     * @throws SpectralIntegrationException si quedan menos de dos puntos o el denominador es nulo.
     */
    public static double weightedAverage(double[] wavelengths,
                                         double[] values,
                                         double[] weights,
                                         WavelengthBand band,
                                         String quantityName) {
        int from = 0;
        while (from < wavelengths.length && wavelengths[from] < band.lower()) from++;
        int to = from;
        while (to < wavelengths.length && wavelengths[to] <= band.upper()) to++;

        if (to - from < 2) {
            throw new SpectralIntegrationException(quantityName, band,
                    "solo " + (to - from) + " puntos dentro de la banda");
        }

        double[] x = Arrays.copyOfRange(wavelengths, from, to);
        double[] w = Arrays.copyOfRange(weights, from, to);
        double[] fw = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            fw[i] = values[from + i] * w[i];
        }

        final double denominator = trapezoid(x, w);
        if (!(denominator > 0.0) || !Double.isFinite(denominator)) {
            throw new SpectralIntegrationException(quantityName, band,
                    "la integral del peso es nula o no finita (" + denominator + ")");
        }
        return trapezoid(x, fw) / denominator;
    }
}
