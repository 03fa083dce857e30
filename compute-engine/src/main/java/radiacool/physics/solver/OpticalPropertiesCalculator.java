package radiacool.physics.solver;

import lombok.extern.slf4j.Slf4j;
import radiacool.config.RadiationConfig;
import radiacool.domain.balance.OpticalProperties;
import radiacool.domain.exception.PhysicalDomainException;
import radiacool.domain.exception.SpectralIntegrationException;
import radiacool.domain.spectrum.SpectralDataset;
import radiacool.domain.spectrum.SpectralInputs;
import radiacool.domain.spectrum.SpectralSlice;
import radiacool.domain.spectrum.WavelengthBand;
import radiacool.physics.model.BlackbodyRadiationModel;

/**
 * Calcula las figuras de mérito escalares de la superficie:
 * reflectancia solar y visible, absortancia solar y emisividad media.
 */
@Slf4j
public class OpticalPropertiesCalculator {

    private static final double MICRON = 1e-6;

    private final RadiationConfig config;
    private final SpectralInterpolator interpolator;
    private final BlackbodyRadiationModel blackbody;

    public OpticalPropertiesCalculator(RadiationConfig config, SpectralInterpolator interpolator) {
        this.config = config;
        this.interpolator = interpolator;
        this.blackbody = BlackbodyRadiationModel.from(config);
    }

    public OpticalProperties calculate(SpectralInputs inputs) {
        final double solarReflectance = solarWeightedReflectance(inputs, config.solarBand());
        final double visibleReflectance = solarWeightedReflectance(inputs, config.visibleBand());
        final double absorptance = 1.0 - solarReflectance;
        if (absorptance < 0.0 || absorptance > 1.0 || Double.isNaN(absorptance)) {
            throw new PhysicalDomainException("solarAbsorptance", "fuera de [0,1]: " + absorptance);
        }
        final double emissivity = averageEmissivity(inputs.emissivity(), config.ambientTemperatureKelvin());

        log.info("Propiedades ópticas: R_sol={}, R_vis={}, α_s={}, ε_media={}",
                solarReflectance, visibleReflectance, absorptance, emissivity);
        return new OpticalProperties(solarReflectance, visibleReflectance, absorptance, emissivity);
    }

    /**
     * Reflectancia ponderada por el espectro solar: los puntos de reflectancia dentro de la banda
     * son la rejilla, y el espectro solar (recortado a la banda) se remuestrea sobre ella.
     */
    public double solarWeightedReflectance(SpectralInputs inputs, WavelengthBand band) {
        SpectralSlice reflectance = inputs.reflectance().slice(band);
        SpectralSlice solar = inputs.solarSpectrum().slice(band);
        if (solar.size() < 2) {
            throw new SpectralIntegrationException(inputs.solarSpectrum().getQuantity().getLabel(), band,
                    "solo " + solar.size() + " puntos del espectro solar dentro de la banda");
        }
        if (reflectance.size() < 2) {
            throw new SpectralIntegrationException(inputs.reflectance().getQuantity().getLabel(), band,
                    "solo " + reflectance.size() + " puntos de reflectancia dentro de la banda");
        }
        double[] weights = interpolator.resample(solar.wavelengths(), solar.values(), reflectance.wavelengths());
        return WeightedSpectralIntegrator.weightedAverage(
                reflectance.wavelengths(), reflectance.values(), weights, band,
                inputs.reflectance().getQuantity().getLabel());
    }

    /**
     * Emisividad media ponderada por la radiancia de cuerpo negro a la temperatura dada,
     * sobre la rejilla propia del espectro de emisividad dentro de la banda infrarroja.
     *
     * @param temperature Temperatura de ponderación (K).
     */
    public double averageEmissivity(SpectralDataset emissivity, double temperature) {
        SpectralSlice slice = emissivity.slice(config.infraredBand());
        double[] meters = new double[slice.size()];
        for (int i = 0; i < meters.length; i++) {
            meters[i] = slice.wavelengths()[i] * MICRON;
        }
        double[] weights = blackbody.spectralRadiance(meters, temperature);
        return WeightedSpectralIntegrator.weightedAverage(
                slice.wavelengths(), slice.values(), weights, config.infraredBand(),
                emissivity.getQuantity().getLabel());
    }
}
