package radiacool.domain.spectrum;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Magnitudes espectrales que admite el motor.
 * <p>
 * Las magnitudes fraccionarias (reflectancia, emisividad, transmitancia) se normalizan
 * a [0,1]; la irradiancia solar es solo un peso y conserva su escala original.
 * <p>
 * Cada magnitud declara a partir de qué longitud de onda se interpretan los datos en nanómetros.
 * Las magnitudes infrarrojas llegan legítimamente a 100 μm o más, por lo que su umbral es mayor.
 */
@Getter
@RequiredArgsConstructor
public enum SpectralQuantity {

    REFLECTANCE("reflectance", true, 100.0),
    EMISSIVITY("emissivity", true, 1000.0),
    TRANSMITTANCE("transmittance", true, 1000.0),
    SOLAR_IRRADIANCE("solar-spectrum", false, 100.0);

    private final String label;

    /**
     * true si los valores representan una fracción adimensional en [0,1].
     */
    private final boolean fraction;

    /**
     * Longitud de onda máxima (μm) admisible; por encima se asume que los datos vienen en nm.
     */
    private final double nanometerThreshold;
}
