package radiacool.domain.spectrum;

/**
 * Subconjunto de un {@link SpectralDataset} restringido a una banda.
 * Puede contener menos de dos puntos; quien lo consuma decide si es suficiente.
 */
public record SpectralSlice(double[] wavelengths, double[] values) {

    public int size() {
        return wavelengths.length;
    }

    public boolean isEmpty() {
        return wavelengths.length == 0;
    }
}
