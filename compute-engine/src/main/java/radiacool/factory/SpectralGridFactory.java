package radiacool.factory;

import lombok.extern.slf4j.Slf4j;
import radiacool.config.RadiationConfig;
import radiacool.domain.exception.PhysicalDomainException;
import radiacool.domain.spectrum.SpectralGrid;
import radiacool.domain.spectrum.SpectralInputs;
import radiacool.domain.spectrum.WavelengthBand;
import radiacool.physics.model.AtmosphericEmissivityModel;
import radiacool.physics.solver.SpectralInterpolator;
import radiacool.physics.solver.WeightedSpectralIntegrator;

/**
 * Fábrica de la rejilla infrarroja común ({@link SpectralGrid}).
 * <p>
 * La rejilla se construye una vez por cálculo y se reutiliza en todo el barrido:
 * <ol>
 * <li>Abscisas uniformes en la banda infrarroja con el paso de resolución espectral.</li>
 * <li>Emisividad y transmitancia remuestreadas sobre ellas.</li>
 * <li>Conversión a metros, anchuras de celda del trapecio y ln τ precalculado.</li>
 * </ol>
 */
@Slf4j
public class SpectralGridFactory {

    private static final double MICRON = 1e-6;

    private SpectralGridFactory() {}

    public static SpectralGrid createInfraredGrid(RadiationConfig config,
                                                  SpectralInputs inputs,
                                                  SpectralInterpolator interpolator) {
        final double[] microns = uniformWavelengths(config.infraredBand(), config.spectralResolution());

        double[] emissivity = interpolator.resample(inputs.emissivity(), microns);
        double[] transmittance = interpolator.resample(inputs.transmittance(), microns);
        for (int i = 0; i < microns.length; i++) {
            emissivity[i] = Math.min(1.0, emissivity[i]);
            transmittance[i] = Math.min(1.0, transmittance[i]);
        }

        double[] meters = new double[microns.length];
        for (int i = 0; i < microns.length; i++) {
            meters[i] = microns[i] * MICRON;
        }

        log.debug("Rejilla infrarroja: {} puntos en {} con paso {} μm.",
                microns.length, config.infraredBand(), config.spectralResolution());

        return new SpectralGrid(
                meters,
                WeightedSpectralIntegrator.cellWidths(meters),
                emissivity,
                transmittance,
                AtmosphericEmissivityModel.logTransmittance(transmittance));
    }

    /**
     * Abscisas lower, lower+step, ... sin superar upper (incluido si cae en la rejilla).
     */
    public static double[] uniformWavelengths(WavelengthBand band, double step) {
        if (!(step > 0.0)) {
            throw new PhysicalDomainException("spectralResolution", "el paso debe ser positivo: " + step);
        }
        int count = (int) Math.floor(band.width() / step + 1e-9) + 1;
        if (count < 2) {
            throw new PhysicalDomainException("spectralResolution",
                    "la banda " + band + " no admite dos puntos con paso " + step);
        }
        double[] grid = new double[count];
        for (int i = 0; i < count; i++) {
            grid[i] = band.lower() + i * step;
        }
        return grid;
    }
}
