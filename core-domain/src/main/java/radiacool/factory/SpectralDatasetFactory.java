package radiacool.factory;

import lombok.extern.slf4j.Slf4j;
import radiacool.domain.exception.SpectralDataFormatException;
import radiacool.domain.spectrum.SpectralDataset;
import radiacool.domain.spectrum.SpectralQuantity;
import radiacool.domain.spectrum.WavelengthBand;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Fábrica responsable de convertir datos espectrales crudos en instancias normalizadas de {@link SpectralDataset}.
 * <p>
 * Proceso de normalización en cascada:
 * <ol>
 * <li>Se descartan filas con valores no finitos.</li>
 * <li>Detección de unidades: si la longitud de onda máxima supera el umbral de la magnitud
 *     ({@link SpectralQuantity#getNanometerThreshold()}) se asume nanómetros y se divide entre 1000.</li>
 * <li>Orden estable por longitud de onda; ante duplicados se conserva el primero.</li>
 * <li>Magnitudes fraccionarias: si el máximo supera {@value #PERCENT_THRESHOLD} se asumen porcentajes (÷100)
 *     y el resultado se recorta a [0,1]. El espectro solar solo se recorta por debajo en 0.</li>
 * </ol>
 */
@Slf4j
public class SpectralDatasetFactory {

    public static final double PERCENT_THRESHOLD = 1.5;

    private SpectralDatasetFactory() {}

    /**
     * @param rows Filas {λ, valor, ...}; columnas extra se ignoran.
     */
    public static SpectralDataset fromRows(SpectralQuantity quantity, double[][] rows) {
        if (rows == null) {
            throw new SpectralDataFormatException(quantity, "No se recibieron datos.");
        }
        double[] wavelengths = new double[rows.length];
        double[] values = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i] == null || rows[i].length < 2) {
                throw new SpectralDataFormatException(quantity,
                        "La fila " + i + " no tiene las dos columnas (longitud de onda, valor).");
            }
            wavelengths[i] = rows[i][0];
            values[i] = rows[i][1];
        }
        return fromColumns(quantity, wavelengths, values);
    }

    public static SpectralDataset fromRows(SpectralQuantity quantity, List<double[]> rows) {
        if (rows == null) {
            throw new SpectralDataFormatException(quantity, "No se recibieron datos.");
        }
        return fromRows(quantity, rows.toArray(new double[0][]));
    }

    public static SpectralDataset fromColumns(SpectralQuantity quantity, double[] wavelengths, double[] values) {
        if (quantity == null) {
            throw new SpectralDataFormatException(null, "La magnitud espectral es obligatoria.");
        }
        if (wavelengths == null || values == null) {
            throw new SpectralDataFormatException(quantity, "Faltan columnas de datos.");
        }
        if (wavelengths.length != values.length) {
            throw new SpectralDataFormatException(quantity,
                    "Columnas de distinta longitud: " + wavelengths.length + " vs " + values.length);
        }

        // 1. Filtrado de filas no numéricas
        int n = 0;
        double[][] pairs = new double[wavelengths.length][];
        for (int i = 0; i < wavelengths.length; i++) {
            if (Double.isFinite(wavelengths[i]) && Double.isFinite(values[i])) {
                pairs[n++] = new double[]{wavelengths[i], values[i]};
            }
        }
        if (n < wavelengths.length) {
            log.debug("[{}] Descartadas {} filas no numéricas.", quantity.getLabel(), wavelengths.length - n);
        }
        if (n < 2) {
            throw new SpectralDataFormatException(quantity,
                    "Se necesitan al menos dos filas numéricas, hay " + n);
        }
        pairs = Arrays.copyOf(pairs, n);

        // 2. Unidades de longitud de onda
        double maxWavelength = Arrays.stream(pairs).mapToDouble(p -> p[0]).max().orElse(0.0);
        if (maxWavelength > quantity.getNanometerThreshold()) {
            log.debug("[{}] Longitudes de onda en nm (máx {}), convirtiendo a μm.", quantity.getLabel(), maxWavelength);
            for (double[] p : pairs) p[0] /= 1000.0;
        }

        // 3. Orden estable y eliminación de duplicados
        Arrays.sort(pairs, Comparator.comparingDouble(p -> p[0]));
        double[] lambda = new double[n];
        double[] value = new double[n];
        int distinct = 0;
        for (double[] p : pairs) {
            if (distinct > 0 && p[0] == lambda[distinct - 1]) {
                continue;
            }
            lambda[distinct] = p[0];
            value[distinct] = p[1];
            distinct++;
        }
        if (distinct < 2) {
            throw new SpectralDataFormatException(quantity,
                    "Se necesitan al menos dos longitudes de onda distintas, hay " + distinct);
        }
        lambda = Arrays.copyOf(lambda, distinct);
        value = Arrays.copyOf(value, distinct);

        // 4. Escala de valores
        normalizeValues(quantity, value);

        return new SpectralDataset(quantity, lambda, value);
    }

    /**
     * Espectro constante muestreado uniformemente en la banda (ambos extremos incluidos).
     */
    public static SpectralDataset constant(SpectralQuantity quantity, WavelengthBand band, double value, int points) {
        if (points < 2) {
            throw new SpectralDataFormatException(quantity, "Se necesitan al menos dos puntos, recibido " + points);
        }
        double[] lambda = new double[points];
        double[] values = new double[points];
        final double step = band.width() / (points - 1);
        for (int i = 0; i < points; i++) {
            lambda[i] = band.lower() + i * step;
            values[i] = value;
        }
        lambda[points - 1] = band.upper();
        return fromColumns(quantity, lambda, values);
    }

    private static void normalizeValues(SpectralQuantity quantity, double[] values) {
        if (quantity.isFraction()) {
            double max = Arrays.stream(values).max().orElse(0.0);
            if (max > PERCENT_THRESHOLD) {
                log.debug("[{}] Valores en porcentaje (máx {}), dividiendo entre 100.", quantity.getLabel(), max);
                for (int i = 0; i < values.length; i++) values[i] /= 100.0;
            }
        }
        int clipped = 0;
        for (int i = 0; i < values.length; i++) {
            double original = values[i];
            values[i] = Math.max(0.0, values[i]);
            if (quantity.isFraction()) {
                values[i] = Math.min(1.0, values[i]);
            }
            if (values[i] != original) clipped++;
        }
        if (clipped > 0) {
            log.warn("[{}] {} valores fuera de rango recortados.", quantity.getLabel(), clipped);
        }
    }
}
