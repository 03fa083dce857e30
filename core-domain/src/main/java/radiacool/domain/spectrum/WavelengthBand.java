package radiacool.domain.spectrum;

import radiacool.domain.exception.PhysicalDomainException;

/**
 * Intervalo cerrado [lower, upper] de longitudes de onda en micrómetros.
 *
 * @param lower Límite inferior (μm).
 * @param upper Límite superior (μm), estrictamente mayor que {@code lower}.
 */
public record WavelengthBand(double lower, double upper) {

    public WavelengthBand {
        if (!Double.isFinite(lower) || !Double.isFinite(upper)) {
            throw new PhysicalDomainException("band", "los límites deben ser finitos: [" + lower + ", " + upper + "]");
        }
        if (lower >= upper) {
            throw new PhysicalDomainException("band", "banda vacía o invertida: [" + lower + ", " + upper + "]");
        }
    }

    public static WavelengthBand of(double lower, double upper) {
        return new WavelengthBand(lower, upper);
    }

    public boolean contains(double wavelength) {
        return wavelength >= lower && wavelength <= upper;
    }

    public double width() {
        return upper - lower;
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + "] μm";
    }
}
