package radiacool.domain.exception;

import lombok.Getter;
import radiacool.domain.spectrum.WavelengthBand;

/**
 * Dominio de integración degenerado: menos de dos puntos dentro de la banda
 * o integral del peso nula (espectro de ponderación idénticamente cero).
 */
@Getter
public class SpectralIntegrationException extends RadiationEngineException {

    private final String quantityName;
    private final WavelengthBand band;

    public SpectralIntegrationException(String quantityName, WavelengthBand band, String message) {
        super("Integración de '" + quantityName + "' en " + band + ": " + message);
        this.quantityName = quantityName;
        this.band = band;
    }
}
