package radiacool.domain.spectrum;

import lombok.Getter;
import radiacool.domain.exception.SpectralDataFormatException;

import java.util.Arrays;

/**
 * Serie espectral normalizada e inmutable: pares (λ, valor) con λ en micrómetros,
 * estrictamente creciente y al menos dos puntos.
 * <p>
 * Para magnitudes fraccionarias los valores están en [0,1]. La normalización desde datos
 * crudos (unidades, porcentajes, orden, duplicados) la realiza
 * {@link radiacool.factory.SpectralDatasetFactory}; este constructor solo verifica invariantes.
 */
public final class SpectralDataset {

    @Getter
    private final SpectralQuantity quantity;
    private final double[] wavelengths;
    private final double[] values;

    public SpectralDataset(SpectralQuantity quantity, double[] wavelengths, double[] values) {
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
        if (wavelengths.length < 2) {
            throw new SpectralDataFormatException(quantity,
                    "Se necesitan al menos dos puntos, hay " + wavelengths.length);
        }
        for (int i = 0; i < wavelengths.length; i++) {
            if (!Double.isFinite(wavelengths[i]) || !Double.isFinite(values[i])) {
                throw new SpectralDataFormatException(quantity, "Valor no numérico en la fila " + i);
            }
            if (i > 0 && wavelengths[i] <= wavelengths[i - 1]) {
                throw new SpectralDataFormatException(quantity,
                        "Longitudes de onda no estrictamente crecientes en la fila " + i);
            }
            if (values[i] < 0.0 || (quantity.isFraction() && values[i] > 1.0)) {
                throw new SpectralDataFormatException(quantity,
                        "Valor fuera de rango en la fila " + i + ": " + values[i]);
            }
        }
        this.quantity = quantity;
        this.wavelengths = wavelengths.clone();
        this.values = values.clone();
    }

    public int size() {
        return wavelengths.length;
    }

    public double wavelengthAt(int index) {
        return wavelengths[index];
    }

    public double valueAt(int index) {
        return values[index];
    }

    public double minWavelength() {
        return wavelengths[0];
    }

    public double maxWavelength() {
        return wavelengths[wavelengths.length - 1];
    }

    /**
     * @return Copia defensiva de las longitudes de onda (μm).
     */
    public double[] getWavelengths() {
        return wavelengths.clone();
    }

    /**
     * @return Copia defensiva de los valores normalizados.
     */
    public double[] getValues() {
        return values.clone();
    }

    /**
     * Devuelve los puntos cuya longitud de onda cae dentro de la banda (incluidos los extremos).
     */
    public SpectralSlice slice(WavelengthBand band) {
        int from = 0;
        while (from < wavelengths.length && wavelengths[from] < band.lower()) from++;
        int to = from;
        while (to < wavelengths.length && wavelengths[to] <= band.upper()) to++;
        return new SpectralSlice(
                Arrays.copyOfRange(wavelengths, from, to),
                Arrays.copyOfRange(values, from, to));
    }

    @Override
    public String toString() {
        return "SpectralDataset{" + quantity.getLabel() + ", n=" + wavelengths.length
                + ", λ=[" + minWavelength() + ", " + maxWavelength() + "] μm}";
    }
}
